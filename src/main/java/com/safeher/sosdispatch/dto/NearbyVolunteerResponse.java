package com.safeher.sosdispatch.dto;

import lombok.*;

/**
 * An on-duty volunteer near a point, with public reputation figures. No contact details.
 */
@Getter
@AllArgsConstructor
@Builder
public class NearbyVolunteerResponse {

    private final Long volunteerId;
    private final String name;
    private final Double latitude;
    private final Double longitude;
    private final Long distanceMeters;
    private final double avgRating;
    private final int successfulAssists;
}
