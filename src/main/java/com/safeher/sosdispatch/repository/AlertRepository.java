package com.safeher.sosdispatch.repository;

import com.safeher.sosdispatch.entity.Alert;
import com.safeher.sosdispatch.entity.AlertStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Alert entity.
 *
 * Every status transition is a single conditional UPDATE (compare-and-set). The
 * returned row count tells the caller whether it won: 1 means the precondition
 * still held when the row was written, 0 means another request got there first.
 * Two concurrent accepts on the same alert therefore produce exactly one winner.
 */
@Repository
public interface AlertRepository extends JpaRepository<Alert, Long> {

    // ────────────────────────────────────────────────────────────────────────
    // Conditional transitions
    // ────────────────────────────────────────────────────────────────────────

    /**
     * ACTIVE → RESPONDING, only while no volunteer has been assigned.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Alert a SET a.status = :responding, a.respondingVolunteerId = :volunteerId, " +
           "a.acceptedAt = :at, a.respondingDistanceMeters = :distance, " +
           "a.responseTimeSeconds = :responseTime, a.updatedAt = :at " +
           "WHERE a.id = :id AND a.status = :active AND a.respondingVolunteerId IS NULL")
    int markResponding(@Param("id") Long id,
                       @Param("volunteerId") Long volunteerId,
                       @Param("at") LocalDateTime at,
                       @Param("distance") Long distanceMeters,
                       @Param("responseTime") Long responseTimeSeconds,
                       @Param("active") AlertStatus active,
                       @Param("responding") AlertStatus responding);

    default boolean acceptIfActive(Long id, Long volunteerId, LocalDateTime at,
                                   Long distanceMeters, Long responseTimeSeconds) {
        return markResponding(id, volunteerId, at, distanceMeters, responseTimeSeconds,
                AlertStatus.ACTIVE, AlertStatus.RESPONDING) == 1;
    }

    /**
     * Moves the alert to {@code to} only if its current status is one of {@code from}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Alert a SET a.status = :to, a.updatedAt = :at " +
           "WHERE a.id = :id AND a.status IN :from")
    int transitionStatus(@Param("id") Long id,
                         @Param("from") Collection<AlertStatus> from,
                         @Param("to") AlertStatus to,
                         @Param("at") LocalDateTime at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Alert a SET a.status = :resolved, a.resolvedBy = :resolvedBy, a.resolvedAt = :at, " +
           "a.resolutionNotes = :notes, a.rating = :rating, a.feedback = :feedback, " +
           "a.ratingRecorded = :ratingRecorded, " +
           "a.totalDurationSeconds = :totalDuration, a.updatedAt = :at " +
           "WHERE a.id = :id AND a.status IN :from")
    int resolve(@Param("id") Long id,
                @Param("resolvedBy") Long resolvedBy,
                @Param("at") LocalDateTime at,
                @Param("notes") String notes,
                @Param("rating") Integer rating,
                @Param("feedback") String feedback,
                @Param("ratingRecorded") Boolean ratingRecorded,
                @Param("totalDuration") Long totalDurationSeconds,
                @Param("from") Collection<AlertStatus> from,
                @Param("resolved") AlertStatus resolved);

    default boolean resolveIfOpen(Long id, Long resolvedBy, LocalDateTime at, String notes,
                                  Integer rating, String feedback, boolean ratingRecorded,
                                  Long totalDurationSeconds) {
        return resolve(id, resolvedBy, at, notes, rating, feedback, ratingRecorded, totalDurationSeconds,
                AlertStatus.OPEN, AlertStatus.RESOLVED) == 1;
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Alert a SET a.latitude = :lat, a.longitude = :lon, a.locationUpdatedAt = :at, " +
           "a.updatedAt = :at WHERE a.id = :id AND a.status IN :from")
    int updateLocationIfOpen(@Param("id") Long id,
                             @Param("lat") double latitude,
                             @Param("lon") double longitude,
                             @Param("at") LocalDateTime at,
                             @Param("from") Collection<AlertStatus> from);

    // ────────────────────────────────────────────────────────────────────────
    // Reads
    // ────────────────────────────────────────────────────────────────────────

    List<Alert> findTop20ByUserIdOrderByCreatedAtDesc(Long userId);

    List<Alert> findTop20ByUserIdAndStatusOrderByCreatedAtDesc(Long userId, AlertStatus status);

    Optional<Alert> findFirstByUserIdAndStatusInOrderByCreatedAtDesc(Long userId,
                                                                     Collection<AlertStatus> statuses);

    /**
     * Resolved alerts of the user that had a responder but carry neither a rating nor
     * feedback yet, most recently resolved first.
     */
    @Query("SELECT a FROM Alert a WHERE a.userId = :userId AND a.status = :status " +
           "AND a.respondingVolunteerId IS NOT NULL AND a.rating IS NULL AND a.feedback IS NULL " +
           "ORDER BY a.resolvedAt DESC")
    List<Alert> findAwaitingFeedback(@Param("userId") Long userId,
                                     @Param("status") AlertStatus status,
                                     Pageable pageable);

    default List<Alert> findPendingFeedback(Long userId) {
        return findAwaitingFeedback(userId, AlertStatus.RESOLVED, PageRequest.of(0, 20));
    }

    /**
     * Alerts on which the volunteer was notified, newest first.
     */
    @Query(value = "SELECT a FROM Alert a WHERE a.id IN " +
                   "(SELECT n.alertId FROM AlertVolunteerNotification n WHERE n.volunteerId = :volunteerId) " +
                   "ORDER BY a.createdAt DESC",
           countQuery = "SELECT COUNT(a) FROM Alert a WHERE a.id IN " +
                        "(SELECT n.alertId FROM AlertVolunteerNotification n WHERE n.volunteerId = :volunteerId)")
    Page<Alert> findNotifiedToVolunteer(@Param("volunteerId") Long volunteerId, Pageable pageable);

    /**
     * Coarse bounding-box pre-filter for the nearby-alerts view; callers refine by exact distance.
     */
    @Query("SELECT a FROM Alert a WHERE a.status = :status " +
           "AND a.latitude BETWEEN :minLat AND :maxLat " +
           "AND a.longitude BETWEEN :minLon AND :maxLon " +
           "ORDER BY a.createdAt DESC")
    List<Alert> findByStatusWithinBounds(@Param("status") AlertStatus status,
                                         @Param("minLat") double minLat,
                                         @Param("maxLat") double maxLat,
                                         @Param("minLon") double minLon,
                                         @Param("maxLon") double maxLon);

    // ────────────────────────────────────────────────────────────────────────
    // Sweeper
    // ────────────────────────────────────────────────────────────────────────

    @Query("SELECT a.id FROM Alert a WHERE a.status IN :statuses AND a.createdAt < :cutoff")
    List<Long> findIdsByStatusInAndCreatedBefore(@Param("statuses") Collection<AlertStatus> statuses,
                                                 @Param("cutoff") LocalDateTime cutoff);

    @Query("SELECT a.id FROM Alert a WHERE a.createdAt < :cutoff")
    List<Long> findIdsCreatedBefore(@Param("cutoff") LocalDateTime cutoff);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Alert a WHERE a.id IN :ids")
    int deleteAllByIdIn(@Param("ids") Collection<Long> ids);
}
