package com.safeher.sosdispatch.service.matching;

import com.safeher.sosdispatch.entity.Volunteer;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A candidate responder and its distance to the alert in whole meters
 * (null when the volunteer has not reported a location).
 */
@Getter
@AllArgsConstructor
public class VolunteerMatch {

    private final Volunteer volunteer;
    private final Long distanceMeters;
}
