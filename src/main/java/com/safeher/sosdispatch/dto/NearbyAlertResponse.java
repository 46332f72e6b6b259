package com.safeher.sosdispatch.dto;

import com.safeher.sosdispatch.entity.AlertPriority;
import com.safeher.sosdispatch.entity.AlertType;
import lombok.*;

import java.time.LocalDateTime;

/**
 * An ACTIVE alert near the calling volunteer, with its distance in whole meters.
 */
@Getter
@AllArgsConstructor
@Builder
public class NearbyAlertResponse {

    private final Long alertId;
    private final Double latitude;
    private final Double longitude;
    private final String address;
    private final AlertType type;
    private final AlertPriority priority;
    private final String message;
    private final long distanceMeters;
    private final LocalDateTime createdAt;
}
