package com.safeher.sosdispatch.service.notification;

import com.safeher.sosdispatch.entity.Alert;
import com.safeher.sosdispatch.entity.AppUser;
import com.safeher.sosdispatch.entity.EmergencyContact;
import com.safeher.sosdispatch.repository.AlertRepository;
import com.safeher.sosdispatch.service.CacheableDataService;
import com.safeher.sosdispatch.service.EmergencyContactService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;
import java.util.Optional;

/**
 * Runs the emergency-contact fan-out off the request thread.
 *
 * Fires only after the creating transaction commits, so the alert row is visible and a
 * rolled-back creation never texts anyone. Runs on the "notificationTaskExecutor" pool.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContactNotificationListener {

    private final AlertRepository alertRepository;
    private final CacheableDataService cacheableDataService;
    private final EmergencyContactService emergencyContactService;
    private final NotificationDispatcher notificationDispatcher;

    @Async("notificationTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onAlertCreated(AlertCreatedEvent event) {
        try {
            Optional<Alert> alert = alertRepository.findById(event.getAlertId());
            if (alert.isEmpty()) {
                log.warn("DISPATCH: alert #{} vanished before contact fan-out", event.getAlertId());
                return;
            }
            Optional<AppUser> requester = cacheableDataService.getUser(event.getUserId());
            if (requester.isEmpty()) {
                log.warn("DISPATCH: requester #{} not found, skipping contacts for alert #{}",
                        event.getUserId(), event.getAlertId());
                return;
            }
            List<EmergencyContact> contacts = emergencyContactService.findActiveContacts(event.getUserId());
            if (contacts.isEmpty()) {
                log.info("DISPATCH: user #{} has no emergency contacts — alert #{}",
                        event.getUserId(), event.getAlertId());
                return;
            }
            notificationDispatcher.notifyEmergencyContacts(alert.get(), requester.get(), contacts);
        } catch (Exception e) {
            log.error("DISPATCH: contact fan-out failed for alert #{} — {}",
                    event.getAlertId(), e.getMessage(), e);
        }
    }
}
