package com.safeher.sosdispatch.dto;

import com.safeher.sosdispatch.entity.Volunteer;
import com.safeher.sosdispatch.entity.VolunteerBadge;
import com.safeher.sosdispatch.entity.VolunteerStatus;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

@Getter
@AllArgsConstructor
@Builder
public class VolunteerProfileResponse {

    private final Long id;
    private final Long userId;
    private final boolean verified;
    private final VolunteerStatus status;
    private final boolean onDuty;
    private final Double latitude;
    private final Double longitude;
    private final LocalDateTime locationUpdatedAt;

    private final int totalResponses;
    private final int successfulAssists;
    private final int declinedAlerts;
    private final double avgResponseTimeSeconds;
    private final double avgRating;
    private final int ratingCount;
    private final List<String> badges;

    public static VolunteerProfileResponse from(Volunteer v) {
        return VolunteerProfileResponse.builder()
                .id(v.getId())
                .userId(v.getUserId())
                .verified(v.isVerified())
                .status(v.getStatus())
                .onDuty(v.isOnDuty())
                .latitude(v.getLatitude())
                .longitude(v.getLongitude())
                .locationUpdatedAt(v.getLocationUpdatedAt())
                .totalResponses(v.getTotalResponses())
                .successfulAssists(v.getSuccessfulAssists())
                .declinedAlerts(v.getDeclinedAlerts())
                .avgResponseTimeSeconds(v.getAvgResponseTimeSeconds())
                .avgRating(v.getAvgRating())
                .ratingCount(v.getRatingCount())
                .badges(v.getBadges().stream().map(VolunteerBadge::getName).toList())
                .build();
    }
}
