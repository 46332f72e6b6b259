package com.safeher.sosdispatch.dto;

import com.safeher.sosdispatch.entity.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One alert in a volunteer's response history, seen from that volunteer's side.
 */
@Getter
@AllArgsConstructor
@Builder
public class ResponseHistoryItem {

    private final Long alertId;
    private final AlertType type;
    private final AlertPriority priority;
    private final AlertStatus alertStatus;
    private final String address;
    private final LocalDateTime createdAt;

    private final LocalDateTime notifiedAt;
    private final VolunteerResponseStatus responseStatus;
    private final Long distanceMeters;

    /** True when this volunteer was the accepted responder */
    private final boolean responder;
    private final Long responseTimeSeconds;
    private final LocalDateTime resolvedAt;
    private final Integer rating;

    public static ResponseHistoryItem of(Alert alert, AlertVolunteerNotification notification, Long volunteerId) {
        boolean responder = volunteerId.equals(alert.getRespondingVolunteerId());
        return ResponseHistoryItem.builder()
                .alertId(alert.getId())
                .type(alert.getType())
                .priority(alert.getPriority())
                .alertStatus(alert.getStatus())
                .address(alert.getAddress())
                .createdAt(alert.getCreatedAt())
                .notifiedAt(notification != null ? notification.getNotifiedAt() : null)
                .responseStatus(notification != null ? notification.getStatus() : null)
                .distanceMeters(notification != null ? notification.getDistanceMeters() : null)
                .responder(responder)
                .responseTimeSeconds(responder ? alert.getResponseTimeSeconds() : null)
                .resolvedAt(responder ? alert.getResolvedAt() : null)
                .rating(responder ? alert.getRating() : null)
                .build();
    }
}
