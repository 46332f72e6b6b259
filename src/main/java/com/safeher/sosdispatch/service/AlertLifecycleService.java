package com.safeher.sosdispatch.service;

import com.safeher.sosdispatch.dto.AlertCreationResult;
import com.safeher.sosdispatch.dto.CreateAlertRequest;
import com.safeher.sosdispatch.dto.FeedbackRequest;
import com.safeher.sosdispatch.dto.ResolveAlertRequest;
import com.safeher.sosdispatch.entity.*;
import com.safeher.sosdispatch.exception.ConflictException;
import com.safeher.sosdispatch.exception.ForbiddenException;
import com.safeher.sosdispatch.exception.NotFoundException;
import com.safeher.sosdispatch.exception.ValidationException;
import com.safeher.sosdispatch.repository.*;
import com.safeher.sosdispatch.service.matching.VolunteerMatch;
import com.safeher.sosdispatch.service.matching.VolunteerMatcher;
import com.safeher.sosdispatch.service.notification.AlertCreatedEvent;
import com.safeher.sosdispatch.service.notification.AlertEventPublisher;
import com.safeher.sosdispatch.service.notification.AlertEventType;
import com.safeher.sosdispatch.service.notification.NotificationDispatcher;
import com.safeher.sosdispatch.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Alert state machine.
 *
 *   ACTIVE ──accept──▶ RESPONDING ──resolve──▶ RESOLVED
 *     │                   │
 *     ├──────cancel───────┴──▶ CANCELLED
 *     └──resolve──▶ RESOLVED          (sweeper: PENDING/ACTIVE/RESPONDING ──▶ EXPIRED)
 *
 * Every status change goes through a conditional UPDATE in AlertRepository, so the
 * precondition check and the write are a single atomic step. A request that loses the
 * race gets a ConflictException and the existing state is left untouched.
 *
 * Each transition appends exactly one timeline entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertLifecycleService {

    private final AlertRepository alertRepository;
    private final AlertVolunteerNotificationRepository volunteerNotificationRepository;
    private final AlertTimelineRepository timelineRepository;
    private final AlertLocationPointRepository locationPointRepository;
    private final VolunteerRepository volunteerRepository;
    private final EmergencyContactService emergencyContactService;
    private final CacheableDataService cacheableDataService;
    private final VolunteerMatcher volunteerMatcher;
    private final NotificationDispatcher notificationDispatcher;
    private final AlertEventPublisher alertEventPublisher;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final ReputationService reputationService;
    private final EtaEstimator etaEstimator;
    private final Clock clock;

    // ────────────────────────────────────────────────────────────────────────
    // create
    // ────────────────────────────────────────────────────────────────────────

    /**
     * Raises an SOS alert.
     *
     * Steps:
     * 1. Validate coordinates and load the requester
     * 2. Persist the alert as ACTIVE / HIGH with a CREATED timeline entry
     * 3. Match volunteers and record them as NOTIFIED
     * 4. Push new_alert to every matched volunteer
     * 5. Queue the emergency-contact SMS/call fan-out for after commit
     */
    @Transactional
    public AlertCreationResult createAlert(Long userId, CreateAlertRequest request) {
        if (request == null || !GeoUtil.isValidCoordinate(request.getLatitude(), request.getLongitude())) {
            throw new ValidationException("Valid location (latitude, longitude) is required");
        }
        AppUser requester = cacheableDataService.getUser(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));

        LocalDateTime now = LocalDateTime.now(clock);
        Alert alert = alertRepository.save(Alert.builder()
                .userId(userId)
                .latitude(request.getLatitude())
                .longitude(request.getLongitude())
                .address(request.getAddress())
                .locationUpdatedAt(now)
                .message(request.getMessage())
                .type(request.getType() != null ? request.getType() : AlertType.SOS)
                .status(AlertStatus.ACTIVE)
                .priority(AlertPriority.HIGH)
                .createdAt(now)
                .updatedAt(now)
                .build());
        appendTimeline(alert.getId(), TimelineAction.CREATED, "Emergency alert created", userId, now);

        List<VolunteerMatch> matches = volunteerMatcher.match(alert.getLatitude(), alert.getLongitude());
        volunteerNotificationRepository.saveAll(matches.stream()
                .map(m -> AlertVolunteerNotification.builder()
                        .alertId(alert.getId())
                        .volunteerId(m.getVolunteer().getId())
                        .notifiedAt(now)
                        .distanceMeters(m.getDistanceMeters())
                        .status(VolunteerResponseStatus.NOTIFIED)
                        .build())
                .toList());

        notificationDispatcher.notifyVolunteers(alert, requester, matches);

        int contacts = emergencyContactService.findActiveContacts(userId).size();
        applicationEventPublisher.publishEvent(new AlertCreatedEvent(alert.getId(), userId));

        log.info("ALERT: #{} created by user #{} at ({}, {}) — {} volunteer(s) matched, {} contact(s) queued",
                alert.getId(), userId, alert.getLatitude(), alert.getLongitude(), matches.size(), contacts);

        return AlertCreationResult.builder()
                .alertId(alert.getId())
                .volunteersNotified(matches.size())
                .contactsNotified(contacts)
                .build();
    }

    // ────────────────────────────────────────────────────────────────────────
    // accept / decline
    // ────────────────────────────────────────────────────────────────────────

    @Transactional
    public Alert acceptAlert(Long alertId, Long userId) {
        Alert alert = findAlert(alertId);
        if (alert.getStatus() != AlertStatus.ACTIVE) {
            throw new ConflictException("Alert is no longer active");
        }
        Volunteer volunteer = volunteerRepository.findByUserId(userId)
                .orElseThrow(() -> new ForbiddenException("Volunteer profile not found"));

        LocalDateTime now = LocalDateTime.now(clock);
        AcceptOutcome outcome = tryAccept(alert, volunteer, now);
        switch (outcome) {
            case NOT_ELIGIBLE:
                throw new ForbiddenException("You were not notified for this alert");
            case ALREADY_TAKEN:
                log.info("ALERT: #{} accept by volunteer #{} lost the race", alertId, volunteer.getId());
                throw new ConflictException("Alert is no longer active");
            default:
                break;
        }

        String volunteerName = cacheableDataService.getUser(userId).map(AppUser::getName).orElse("A volunteer");
        appendTimeline(alertId, TimelineAction.ACCEPTED,
                "Volunteer " + volunteerName + " accepted the alert", userId, now);

        Alert accepted = findAlert(alertId);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alertId", alertId);
        payload.put("volunteerId", volunteer.getId());
        payload.put("volunteerName", volunteerName);
        payload.put("distanceMeters", accepted.getRespondingDistanceMeters());
        payload.put("estimatedMinutes", etaEstimator.estimateMinutes(accepted.getRespondingDistanceMeters()));
        publishSafely(AlertEventPublisher.userChannel(accepted.getUserId()), AlertEventType.VOLUNTEER_RESPONDING, payload);

        log.info("ALERT: #{} accepted by volunteer #{} — response time {}s",
                alertId, volunteer.getId(), accepted.getResponseTimeSeconds());
        return accepted;
    }

    /**
     * The atomic half of accept: eligibility check, then the conditional
     * ACTIVE → RESPONDING update.
     */
    AcceptOutcome tryAccept(Alert alert, Volunteer volunteer, LocalDateTime now) {
        Optional<AlertVolunteerNotification> entry =
                volunteerNotificationRepository.findByAlertIdAndVolunteerId(alert.getId(), volunteer.getId());
        if (entry.isEmpty()) {
            return AcceptOutcome.NOT_ELIGIBLE;
        }

        long responseTime = secondsBetween(alert.getCreatedAt(), now);
        boolean won = alertRepository.acceptIfActive(alert.getId(), volunteer.getId(), now,
                entry.get().getDistanceMeters(), responseTime);
        if (!won) {
            return AcceptOutcome.ALREADY_TAKEN;
        }

        AlertVolunteerNotification accepted = entry.get();
        accepted.setStatus(VolunteerResponseStatus.ACCEPTED);
        volunteerNotificationRepository.save(accepted);
        return AcceptOutcome.ACCEPTED;
    }

    /**
     * Marks the caller's notification DECLINED and counts it once. Declining twice is a no-op.
     */
    @Transactional
    public void declineAlert(Long alertId, Long userId) {
        findAlert(alertId);
        Volunteer volunteer = volunteerRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("Volunteer profile not found"));

        AlertVolunteerNotification entry = volunteerNotificationRepository
                .findByAlertIdAndVolunteerId(alertId, volunteer.getId())
                .orElseThrow(() -> new ForbiddenException("You were not notified for this alert"));

        if (entry.getStatus() == VolunteerResponseStatus.ACCEPTED) {
            throw new ConflictException("You have already accepted this alert");
        }
        if (entry.getStatus() == VolunteerResponseStatus.DECLINED) {
            log.debug("ALERT: #{} already declined by volunteer #{}", alertId, volunteer.getId());
            return;
        }

        entry.setStatus(VolunteerResponseStatus.DECLINED);
        volunteerNotificationRepository.save(entry);
        volunteerRepository.incrementDeclinedAlerts(volunteer.getId());
        log.info("ALERT: #{} declined by volunteer #{}", alertId, volunteer.getId());
    }

    // ────────────────────────────────────────────────────────────────────────
    // cancel / resolve
    // ────────────────────────────────────────────────────────────────────────

    @Transactional
    public Alert cancelAlert(Long alertId, Long userId) {
        Alert alert = findAlert(alertId);
        if (!alert.isOwnedBy(userId)) {
            throw new ForbiddenException("Not authorized to cancel this alert");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (alertRepository.transitionStatus(alertId, AlertStatus.OPEN, AlertStatus.CANCELLED, now) != 1) {
            throw new ConflictException("Alert is already closed");
        }
        appendTimeline(alertId, TimelineAction.CANCELLED, "Alert cancelled by user", userId, now);

        Alert cancelled = findAlert(alertId);
        notifyResponder(cancelled, AlertEventType.ALERT_CANCELLED, Map.of("alertId", alertId));
        log.info("ALERT: #{} cancelled by owner", alertId);
        return cancelled;
    }

    /**
     * Closes the alert as RESOLVED. Allowed for the owner, the responding volunteer or an admin.
     * When the resolver is the responding volunteer the resolution counts toward their reputation,
     * including the rating if one was given.
     */
    @Transactional
    public Alert resolveAlert(Long alertId, Long userId, ResolveAlertRequest request) {
        Integer rating = request != null ? request.getRating() : null;
        String notes = request != null ? request.getNotes() : null;
        String feedback = request != null && request.getFeedback() != null && !request.getFeedback().isBlank()
                ? request.getFeedback() : null;
        validateRating(rating);

        Alert alert = findAlert(alertId);
        boolean isOwner = alert.isOwnedBy(userId);
        boolean isAdmin = cacheableDataService.getUser(userId).map(AppUser::isAdmin).orElse(false);
        Optional<Volunteer> callerVolunteer = volunteerRepository.findByUserId(userId);
        boolean isResponder = callerVolunteer.isPresent()
                && callerVolunteer.get().getId().equals(alert.getRespondingVolunteerId());

        if (!isOwner && !isResponder && !isAdmin) {
            throw new ForbiddenException("Not authorized to resolve this alert");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        long totalDuration = secondsBetween(alert.getCreatedAt(), now);
        if (alert.getResponseTimeSeconds() != null) {
            totalDuration = Math.max(totalDuration, alert.getResponseTimeSeconds());
        }
        boolean foldRating = isResponder && rating != null;

        if (!alertRepository.resolveIfOpen(alertId, userId, now, notes, rating, feedback, foldRating, totalDuration)) {
            throw new ConflictException("Alert is already closed");
        }
        appendTimeline(alertId, TimelineAction.RESOLVED,
                isResponder ? "Alert resolved by responding volunteer" : "Alert resolved", userId, now);

        if (isResponder) {
            // Re-read: the conditional update cleared the persistence context
            volunteerRepository.findById(callerVolunteer.get().getId())
                    .ifPresent(v -> reputationService.recordSuccessfulResponse(
                            v, alert.getResponseTimeSeconds(), rating));
        }

        log.info("ALERT: #{} resolved by user #{} after {}s", alertId, userId, totalDuration);
        return findAlert(alertId);
    }

    // ────────────────────────────────────────────────────────────────────────
    // feedback / live location
    // ────────────────────────────────────────────────────────────────────────

    /**
     * Owner feedback on a resolved alert. A rating is folded into the responder's average;
     * if a rating was already folded for this alert it is replaced rather than added.
     */
    @Transactional
    public Alert submitFeedback(Long alertId, Long userId, FeedbackRequest request) {
        Integer rating = request != null ? request.getRating() : null;
        String feedback = request != null ? request.getFeedback() : null;
        if (rating == null && (feedback == null || feedback.isBlank())) {
            throw new ValidationException("Rating or feedback is required");
        }
        validateRating(rating);

        Alert alert = findAlert(alertId);
        if (!alert.isOwnedBy(userId)) {
            throw new ForbiddenException("Not authorized to give feedback on this alert");
        }
        if (alert.getStatus() != AlertStatus.RESOLVED) {
            throw new ForbiddenException("Feedback can only be given on a resolved alert");
        }

        Integer previouslyFolded = Boolean.TRUE.equals(alert.getRatingRecorded()) ? alert.getRating() : null;
        if (feedback != null && !feedback.isBlank()) {
            alert.setFeedback(feedback);
        }
        if (rating != null) {
            alert.setRating(rating);
            if (alert.getRespondingVolunteerId() != null) {
                Optional<Volunteer> responder = volunteerRepository.findById(alert.getRespondingVolunteerId());
                if (responder.isPresent()) {
                    reputationService.applyFeedbackRating(responder.get(), rating, previouslyFolded);
                    alert.setRatingRecorded(true);
                }
            }
        }
        alert.setUpdatedAt(LocalDateTime.now(clock));
        log.info("ALERT: #{} feedback received (rating={})", alertId, rating);
        return alertRepository.save(alert);
    }

    @Transactional
    public Alert updateLiveLocation(Long alertId, Long userId, Double latitude, Double longitude) {
        if (!GeoUtil.isValidCoordinate(latitude, longitude)) {
            throw new ValidationException("Valid location (latitude, longitude) is required");
        }
        Alert alert = findAlert(alertId);
        if (!alert.isOwnedBy(userId)) {
            throw new ForbiddenException("Not authorized");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (alertRepository.updateLocationIfOpen(alertId, latitude, longitude, now, AlertStatus.OPEN) != 1) {
            throw new ConflictException("Alert is already closed");
        }
        locationPointRepository.save(AlertLocationPoint.builder()
                .alertId(alertId)
                .latitude(latitude)
                .longitude(longitude)
                .recordedAt(now)
                .build());

        Alert updated = findAlert(alertId);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alertId", alertId);
        payload.put("latitude", latitude);
        payload.put("longitude", longitude);
        payload.put("timestamp", now.toString());
        notifyResponder(updated, AlertEventType.LOCATION_UPDATE, payload);

        log.debug("ALERT: #{} location → ({}, {})", alertId, latitude, longitude);
        return updated;
    }

    // ────────────────────────────────────────────────────────────────────────
    // helpers
    // ────────────────────────────────────────────────────────────────────────

    private Alert findAlert(Long alertId) {
        return alertRepository.findById(alertId)
                .orElseThrow(() -> new NotFoundException("Alert not found: " + alertId));
    }

    private void appendTimeline(Long alertId, TimelineAction action, String description,
                                Long actorUserId, LocalDateTime at) {
        timelineRepository.save(AlertTimelineEntry.builder()
                .alertId(alertId)
                .action(action)
                .description(description)
                .performedBy(actorUserId)
                .timestamp(at)
                .build());
    }

    private void notifyResponder(Alert alert, AlertEventType event, Map<String, Object> payload) {
        if (alert.getRespondingVolunteerId() == null) {
            return;
        }
        volunteerRepository.findById(alert.getRespondingVolunteerId())
                .ifPresent(v -> publishSafely(AlertEventPublisher.volunteerChannel(v.getUserId()), event, payload));
    }

    private void publishSafely(String subscriberId, AlertEventType event, Map<String, Object> payload) {
        try {
            alertEventPublisher.publish(subscriberId, event, payload);
        } catch (Exception e) {
            log.warn("DISPATCH: {} to {} failed — {}", event.getWireName(), subscriberId, e.getMessage());
        }
    }

    private static void validateRating(Integer rating) {
        if (rating != null && (rating < 1 || rating > 5)) {
            throw new ValidationException("Rating must be between 1 and 5");
        }
    }

    /** Whole seconds, floored, never negative */
    private static long secondsBetween(LocalDateTime from, LocalDateTime to) {
        if (from == null || to == null) {
            return 0;
        }
        return Math.max(0, Duration.between(from, to).getSeconds());
    }
}
