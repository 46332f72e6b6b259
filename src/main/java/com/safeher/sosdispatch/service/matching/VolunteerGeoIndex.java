package com.safeher.sosdispatch.service.matching;

import java.util.List;

/**
 * Nearest-neighbour lookup over eligible volunteers (verified, ACTIVE, on duty).
 */
public interface VolunteerGeoIndex {

    /**
     * @return at most {@code limit} eligible volunteers within {@code radiusMeters},
     *         nearest first; empty when none qualify
     */
    List<VolunteerMatch> findNearby(double latitude, double longitude, double radiusMeters, int limit);
}
