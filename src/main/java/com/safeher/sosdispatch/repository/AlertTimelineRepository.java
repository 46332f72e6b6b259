package com.safeher.sosdispatch.repository;

import com.safeher.sosdispatch.entity.AlertTimelineEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for the alert audit trail.
 * Ordered by id so entries come back in the order they were appended.
 */
@Repository
public interface AlertTimelineRepository extends JpaRepository<AlertTimelineEntry, Long> {

    List<AlertTimelineEntry> findByAlertIdOrderByIdAsc(Long alertId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM AlertTimelineEntry t WHERE t.alertId IN :alertIds")
    int deleteByAlertIdIn(@Param("alertIds") Collection<Long> alertIds);
}
