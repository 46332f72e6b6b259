package com.safeher.sosdispatch.repository;

import com.safeher.sosdispatch.entity.AlertContactNotification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface AlertContactNotificationRepository extends JpaRepository<AlertContactNotification, Long> {

    List<AlertContactNotification> findByAlertIdOrderByIdAsc(Long alertId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM AlertContactNotification n WHERE n.alertId IN :alertIds")
    int deleteByAlertIdIn(@Param("alertIds") Collection<Long> alertIds);
}
