package com.safeher.sosdispatch.repository;

import com.safeher.sosdispatch.entity.AlertVolunteerNotification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AlertVolunteerNotificationRepository extends JpaRepository<AlertVolunteerNotification, Long> {

    List<AlertVolunteerNotification> findByAlertIdOrderByIdAsc(Long alertId);

    Optional<AlertVolunteerNotification> findByAlertIdAndVolunteerId(Long alertId, Long volunteerId);

    List<AlertVolunteerNotification> findByVolunteerIdAndAlertIdIn(Long volunteerId, Collection<Long> alertIds);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM AlertVolunteerNotification n WHERE n.alertId IN :alertIds")
    int deleteByAlertIdIn(@Param("alertIds") Collection<Long> alertIds);
}
