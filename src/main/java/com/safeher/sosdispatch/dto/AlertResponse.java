package com.safeher.sosdispatch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.safeher.sosdispatch.entity.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Full alert view returned by the read endpoints.
 *
 * Child lists are only populated by {@link #withDetails}; list views use {@link #from}
 * and leave them null.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlertResponse {

    private Long id;
    private Long userId;
    private Double latitude;
    private Double longitude;
    private String address;
    private LocalDateTime locationUpdatedAt;
    private AlertStatus status;
    private AlertPriority priority;
    private AlertType type;
    private String message;

    private Long respondingVolunteerId;
    private LocalDateTime acceptedAt;
    private Long respondingDistanceMeters;

    private Long resolvedBy;
    private LocalDateTime resolvedAt;
    private String resolutionNotes;
    private Integer rating;
    private String feedback;

    private Long responseTimeSeconds;
    private Long totalDurationSeconds;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    private List<NotifiedVolunteer> notifiedVolunteers;
    private List<NotifiedContact> notifiedContacts;
    private List<TimelineItem> timeline;
    private List<LocationItem> locationHistory;

    public static AlertResponse from(Alert alert) {
        return AlertResponse.builder()
                .id(alert.getId())
                .userId(alert.getUserId())
                .latitude(alert.getLatitude())
                .longitude(alert.getLongitude())
                .address(alert.getAddress())
                .locationUpdatedAt(alert.getLocationUpdatedAt())
                .status(alert.getStatus())
                .priority(alert.getPriority())
                .type(alert.getType())
                .message(alert.getMessage())
                .respondingVolunteerId(alert.getRespondingVolunteerId())
                .acceptedAt(alert.getAcceptedAt())
                .respondingDistanceMeters(alert.getRespondingDistanceMeters())
                .resolvedBy(alert.getResolvedBy())
                .resolvedAt(alert.getResolvedAt())
                .resolutionNotes(alert.getResolutionNotes())
                .rating(alert.getRating())
                .feedback(alert.getFeedback())
                .responseTimeSeconds(alert.getResponseTimeSeconds())
                .totalDurationSeconds(alert.getTotalDurationSeconds())
                .createdAt(alert.getCreatedAt())
                .updatedAt(alert.getUpdatedAt())
                .build();
    }

    public static AlertResponse withDetails(Alert alert,
                                            List<AlertVolunteerNotification> volunteers,
                                            List<AlertContactNotification> contacts,
                                            List<AlertTimelineEntry> timeline,
                                            List<AlertLocationPoint> locations) {
        AlertResponse r = from(alert);
        r.setNotifiedVolunteers(volunteers.stream()
                .map(n -> new NotifiedVolunteer(n.getVolunteerId(), n.getDistanceMeters(),
                        n.getStatus(), n.getNotifiedAt()))
                .toList());
        r.setNotifiedContacts(contacts.stream()
                .map(n -> new NotifiedContact(n.getContactId(), n.getChannel(), n.getStatus(),
                        n.getNotifiedAt(), n.getFailureReason()))
                .toList());
        r.setTimeline(timeline.stream()
                .map(t -> new TimelineItem(t.getAction(), t.getDescription(),
                        t.getPerformedBy(), t.getTimestamp()))
                .toList());
        r.setLocationHistory(locations.stream()
                .map(p -> new LocationItem(p.getLatitude(), p.getLongitude(), p.getRecordedAt()))
                .toList());
        return r;
    }

    @Getter
    @AllArgsConstructor
    public static class NotifiedVolunteer {
        private final Long volunteerId;
        private final Long distanceMeters;
        private final VolunteerResponseStatus status;
        private final LocalDateTime notifiedAt;
    }

    @Getter
    @AllArgsConstructor
    public static class NotifiedContact {
        private final Long contactId;
        private final ContactChannel channel;
        private final DeliveryStatus status;
        private final LocalDateTime notifiedAt;
        private final String failureReason;
    }

    @Getter
    @AllArgsConstructor
    public static class TimelineItem {
        private final TimelineAction action;
        private final String description;
        private final Long performedBy;
        private final LocalDateTime timestamp;
    }

    @Getter
    @AllArgsConstructor
    public static class LocationItem {
        private final Double latitude;
        private final Double longitude;
        private final LocalDateTime recordedAt;
    }
}
