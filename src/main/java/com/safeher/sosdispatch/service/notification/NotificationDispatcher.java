package com.safeher.sosdispatch.service.notification;

import com.safeher.sosdispatch.entity.*;
import com.safeher.sosdispatch.repository.AlertContactNotificationRepository;
import com.safeher.sosdispatch.service.matching.VolunteerMatch;
import com.safeher.sosdispatch.util.PhoneUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fans an alert out to its two audiences:
 *
 *  1. Volunteers - one new_alert event per match on the volunteer's pub/sub channel.
 *  2. Emergency contacts - an SMS with a live-location link to every active contact,
 *     plus a voice call to the primary contact only.
 *
 * Every recipient is attempted independently. A failure is logged (volunteers) or
 * recorded as FAILED (contacts) and never stops the remaining sends.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final AlertEventPublisher eventPublisher;
    private final NotificationGateway notificationGateway;
    private final AlertContactNotificationRepository contactNotificationRepository;
    private final Clock clock;

    @Value("${notification.default-country-code:+91}")
    private String defaultCountryCode;

    @Value("${notification.location-link-base:https://www.google.com/maps?q=}")
    private String locationLinkBase;

    /**
     * Publishes new_alert to each matched volunteer.
     *
     * @return number of volunteers the event was handed to
     */
    public int notifyVolunteers(Alert alert, AppUser requester, List<VolunteerMatch> matches) {
        int published = 0;
        for (VolunteerMatch match : matches) {
            Volunteer volunteer = match.getVolunteer();
            try {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("alertId", alert.getId());
                payload.put("latitude", alert.getLatitude());
                payload.put("longitude", alert.getLongitude());
                payload.put("address", alert.getAddress());
                payload.put("distanceMeters", match.getDistanceMeters());
                payload.put("userName", requester.getName());
                payload.put("message", alert.getMessage());
                payload.put("type", alert.getType());
                payload.put("priority", alert.getPriority());

                eventPublisher.publish(AlertEventPublisher.volunteerChannel(volunteer.getUserId()),
                        AlertEventType.NEW_ALERT, payload);
                published++;
            } catch (Exception e) {
                log.warn("DISPATCH: new_alert to volunteer #{} failed for alert #{} — {}",
                        volunteer.getId(), alert.getId(), e.getMessage());
            }
        }
        log.info("DISPATCH: alert #{} pushed to {}/{} volunteers", alert.getId(), published, matches.size());
        return published;
    }

    /**
     * Sends SMS to every contact and a call to the primary one, then persists one
     * AlertContactNotification per attempt.
     */
    public List<AlertContactNotification> notifyEmergencyContacts(Alert alert, AppUser requester,
                                                                  List<EmergencyContact> contacts) {
        String sms = buildSmsText(requester, alert);
        String script = buildCallScript(requester);

        List<AlertContactNotification> results = new ArrayList<>();
        for (EmergencyContact contact : contacts) {
            results.add(attempt(alert, contact, ContactChannel.SMS, sms));
            if (contact.isPrimaryContact()) {
                results.add(attempt(alert, contact, ContactChannel.CALL, script));
            }
        }

        List<AlertContactNotification> saved = contactNotificationRepository.saveAll(results);
        long failed = saved.stream().filter(r -> r.getStatus() == DeliveryStatus.FAILED).count();
        log.info("DISPATCH: alert #{} — {} contact notification(s), {} failed",
                alert.getId(), saved.size(), failed);
        return saved;
    }

    String buildSmsText(AppUser requester, Alert alert) {
        return "EMERGENCY! " + requester.getName() + " triggered SOS on SafeHer and needs help. "
                + "Location: " + locationLinkBase + alert.getLatitude() + "," + alert.getLongitude();
    }

    String buildCallScript(AppUser requester) {
        return "This is an emergency alert from SafeHer. " + requester.getName()
                + " has triggered an SOS and needs immediate help. "
                + "Please check your text messages for their live location.";
    }

    private AlertContactNotification attempt(Alert alert, EmergencyContact contact,
                                             ContactChannel channel, String text) {
        DeliveryStatus status;
        String failureReason = null;
        try {
            String phone = PhoneUtil.normalize(contact.getPhone(), defaultCountryCode);
            status = channel == ContactChannel.CALL
                    ? notificationGateway.call(phone, text)
                    : notificationGateway.sendSms(phone, text);
            if (status == DeliveryStatus.FAILED) {
                failureReason = "Gateway rejected " + channel;
            }
        } catch (Exception e) {
            log.warn("DISPATCH: {} to contact #{} failed for alert #{} — {}",
                    channel, contact.getId(), alert.getId(), e.getMessage());
            status = DeliveryStatus.FAILED;
            failureReason = e.getMessage();
        }

        return AlertContactNotification.builder()
                .alertId(alert.getId())
                .contactId(contact.getId())
                .channel(channel)
                .status(status)
                .notifiedAt(LocalDateTime.now(clock))
                .failureReason(failureReason)
                .build();
    }
}
