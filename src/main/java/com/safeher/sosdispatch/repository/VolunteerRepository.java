package com.safeher.sosdispatch.repository;

import com.safeher.sosdispatch.entity.Volunteer;
import com.safeher.sosdispatch.entity.VolunteerStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Volunteer entity.
 *
 * "Eligible" means verified, on duty and in the given status (ACTIVE in practice).
 */
@Repository
public interface VolunteerRepository extends JpaRepository<Volunteer, Long> {

    Optional<Volunteer> findByUserId(Long userId);

    /**
     * Bounding-box candidates for geo matching. Volunteers without a location are excluded.
     */
    @Query("SELECT v FROM Volunteer v WHERE v.status = :status AND v.onDuty = true AND v.verified = true " +
           "AND v.latitude IS NOT NULL AND v.longitude IS NOT NULL " +
           "AND v.latitude BETWEEN :minLat AND :maxLat " +
           "AND v.longitude BETWEEN :minLon AND :maxLon")
    List<Volunteer> findEligibleWithinBounds(@Param("status") VolunteerStatus status,
                                             @Param("minLat") double minLat,
                                             @Param("maxLat") double maxLat,
                                             @Param("minLon") double minLon,
                                             @Param("maxLon") double maxLon);

    /**
     * Location-agnostic eligible volunteers, used as the matching fallback.
     */
    @Query("SELECT v FROM Volunteer v WHERE v.status = :status AND v.onDuty = true AND v.verified = true " +
           "ORDER BY v.id ASC")
    List<Volunteer> findEligible(@Param("status") VolunteerStatus status, Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Volunteer v SET v.declinedAlerts = v.declinedAlerts + 1 WHERE v.id = :id")
    int incrementDeclinedAlerts(@Param("id") Long id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Volunteer v SET v.latitude = :lat, v.longitude = :lon, v.locationUpdatedAt = :at " +
           "WHERE v.id = :id")
    int updateLocation(@Param("id") Long id,
                       @Param("lat") double latitude,
                       @Param("lon") double longitude,
                       @Param("at") LocalDateTime at);
}
