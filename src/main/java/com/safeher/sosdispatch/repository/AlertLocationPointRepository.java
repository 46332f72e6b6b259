package com.safeher.sosdispatch.repository;

import com.safeher.sosdispatch.entity.AlertLocationPoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface AlertLocationPointRepository extends JpaRepository<AlertLocationPoint, Long> {

    List<AlertLocationPoint> findByAlertIdOrderByRecordedAtAsc(Long alertId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM AlertLocationPoint p WHERE p.alertId IN :alertIds")
    int deleteByAlertIdIn(@Param("alertIds") Collection<Long> alertIds);
}
