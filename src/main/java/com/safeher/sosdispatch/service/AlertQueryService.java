package com.safeher.sosdispatch.service;

import com.safeher.sosdispatch.dto.AlertResponse;
import com.safeher.sosdispatch.dto.NearbyAlertResponse;
import com.safeher.sosdispatch.dto.ResponseHistoryItem;
import com.safeher.sosdispatch.entity.Alert;
import com.safeher.sosdispatch.entity.AlertStatus;
import com.safeher.sosdispatch.entity.AlertVolunteerNotification;
import com.safeher.sosdispatch.entity.AppUser;
import com.safeher.sosdispatch.entity.Volunteer;
import com.safeher.sosdispatch.exception.ForbiddenException;
import com.safeher.sosdispatch.exception.NotFoundException;
import com.safeher.sosdispatch.exception.ValidationException;
import com.safeher.sosdispatch.repository.*;
import com.safeher.sosdispatch.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side of the alert aggregate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertQueryService {

    private final AlertRepository alertRepository;
    private final AlertVolunteerNotificationRepository volunteerNotificationRepository;
    private final AlertContactNotificationRepository contactNotificationRepository;
    private final AlertTimelineRepository timelineRepository;
    private final AlertLocationPointRepository locationPointRepository;
    private final VolunteerRepository volunteerRepository;
    private final CacheableDataService cacheableDataService;

    @Value("${alert.matching.search-radius-km:5}")
    private double searchRadiusKm;

    @Value("${alert.history.max-page-size:50}")
    private int maxHistoryPageSize;

    /**
     * Full alert with its notification lists, timeline and location history.
     * Visible to the owner, an admin and the responding volunteer.
     */
    @Transactional(readOnly = true)
    public AlertResponse getAlert(Long alertId, Long userId) {
        Alert alert = alertRepository.findById(alertId)
                .orElseThrow(() -> new NotFoundException("Alert not found: " + alertId));

        boolean isOwner = alert.isOwnedBy(userId);
        boolean isAdmin = cacheableDataService.getUser(userId).map(AppUser::isAdmin).orElse(false);
        boolean isResponder = alert.getRespondingVolunteerId() != null
                && volunteerRepository.findByUserId(userId)
                        .map(v -> v.getId().equals(alert.getRespondingVolunteerId()))
                        .orElse(false);

        if (!isOwner && !isAdmin && !isResponder) {
            throw new ForbiddenException("Not authorized to view this alert");
        }

        return AlertResponse.withDetails(alert,
                volunteerNotificationRepository.findByAlertIdOrderByIdAsc(alertId),
                contactNotificationRepository.findByAlertIdOrderByIdAsc(alertId),
                timelineRepository.findByAlertIdOrderByIdAsc(alertId),
                locationPointRepository.findByAlertIdOrderByRecordedAtAsc(alertId));
    }

    /**
     * Latest 20 alerts raised by the user, newest first, optionally filtered by status.
     */
    @Transactional(readOnly = true)
    public List<AlertResponse> getMyAlerts(Long userId, AlertStatus status) {
        List<Alert> alerts = status != null
                ? alertRepository.findTop20ByUserIdAndStatusOrderByCreatedAtDesc(userId, status)
                : alertRepository.findTop20ByUserIdOrderByCreatedAtDesc(userId);
        return alerts.stream().map(AlertResponse::from).toList();
    }

    /**
     * The user's most recent alert that is still ACTIVE or RESPONDING.
     */
    @Transactional(readOnly = true)
    public Optional<AlertResponse> getActiveAlert(Long userId) {
        return alertRepository.findFirstByUserIdAndStatusInOrderByCreatedAtDesc(userId, AlertStatus.OPEN)
                .map(AlertResponse::from);
    }

    /**
     * Resolved alerts of the user that had a responder and still await a rating or feedback.
     */
    @Transactional(readOnly = true)
    public List<AlertResponse> getPendingFeedback(Long userId) {
        return alertRepository.findPendingFeedback(userId).stream().map(AlertResponse::from).toList();
    }

    /**
     * Alerts the calling volunteer was notified about, newest first, with the volunteer's own
     * response on each. {@code page} is 1-based.
     */
    @Transactional(readOnly = true)
    public Page<ResponseHistoryItem> getResponseHistory(Long userId, int page, int limit) {
        if (page < 1) {
            throw new ValidationException("Page must be 1 or greater");
        }
        if (limit < 1 || limit > maxHistoryPageSize) {
            throw new ValidationException("Limit must be between 1 and " + maxHistoryPageSize);
        }
        Volunteer volunteer = volunteerRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("Volunteer profile not found"));
        Long volunteerId = volunteer.getId();

        Page<Alert> alerts = alertRepository.findNotifiedToVolunteer(volunteerId, PageRequest.of(page - 1, limit));
        Map<Long, AlertVolunteerNotification> byAlert = alerts.isEmpty()
                ? Map.of()
                : volunteerNotificationRepository
                        .findByVolunteerIdAndAlertIdIn(volunteerId,
                                alerts.getContent().stream().map(Alert::getId).toList())
                        .stream()
                        .collect(Collectors.toMap(AlertVolunteerNotification::getAlertId, Function.identity()));

        log.debug("VOLUNTEER: #{} history page {} ({} of {} alert(s))",
                volunteerId, page, alerts.getNumberOfElements(), alerts.getTotalElements());
        return alerts.map(a -> ResponseHistoryItem.of(a, byAlert.get(a.getId()), volunteerId));
    }

    /**
     * ACTIVE alerts within the search radius of the given point, nearest first. Volunteers only.
     */
    @Transactional(readOnly = true)
    public List<NearbyAlertResponse> getNearbyAlerts(Long userId, Double latitude, Double longitude) {
        if (!GeoUtil.isValidCoordinate(latitude, longitude)) {
            throw new ValidationException("Location is required");
        }
        Optional<Volunteer> volunteer = volunteerRepository.findByUserId(userId);
        if (volunteer.isEmpty()) {
            throw new ForbiddenException("Only volunteers can browse nearby alerts");
        }

        double radiusMeters = searchRadiusKm * 1000;
        double[] box = GeoUtil.boundingBox(latitude, longitude, radiusMeters);

        List<NearbyAlertResponse> nearby = alertRepository
                .findByStatusWithinBounds(AlertStatus.ACTIVE, box[0], box[1], box[2], box[3])
                .stream()
                .map(a -> NearbyAlertResponse.builder()
                        .alertId(a.getId())
                        .latitude(a.getLatitude())
                        .longitude(a.getLongitude())
                        .address(a.getAddress())
                        .type(a.getType())
                        .priority(a.getPriority())
                        .message(a.getMessage())
                        .distanceMeters(GeoUtil.calculateDistanceMeters(
                                latitude, longitude, a.getLatitude(), a.getLongitude()))
                        .createdAt(a.getCreatedAt())
                        .build())
                .filter(r -> r.getDistanceMeters() <= radiusMeters)
                .sorted(Comparator.comparingLong(NearbyAlertResponse::getDistanceMeters))
                .toList();

        log.debug("ALERT: {} active alert(s) near volunteer #{}", nearby.size(), volunteer.get().getId());
        return nearby;
    }
}
