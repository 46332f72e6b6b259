package com.safeher.sosdispatch.service.matching;

import com.safeher.sosdispatch.entity.VolunteerStatus;
import com.safeher.sosdispatch.repository.VolunteerRepository;
import com.safeher.sosdispatch.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Geo index over the volunteers table.
 *
 * Step 1: bounding-box query (indexable range predicates on latitude/longitude)
 * Step 2: exact Haversine filter, since the box corners lie outside the circle
 * Step 3: sort ascending by distance, cap at limit
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaVolunteerGeoIndex implements VolunteerGeoIndex {

    private final VolunteerRepository volunteerRepository;

    @Override
    public List<VolunteerMatch> findNearby(double latitude, double longitude, double radiusMeters, int limit) {
        double[] box = GeoUtil.boundingBox(latitude, longitude, radiusMeters);

        List<VolunteerMatch> matches = volunteerRepository
                .findEligibleWithinBounds(VolunteerStatus.ACTIVE, box[0], box[1], box[2], box[3])
                .stream()
                .map(v -> new VolunteerMatch(v, GeoUtil.calculateDistanceMeters(
                        latitude, longitude, v.getLatitude(), v.getLongitude())))
                .filter(m -> m.getDistanceMeters() <= radiusMeters)
                .sorted(Comparator.comparingLong(VolunteerMatch::getDistanceMeters))
                .limit(limit)
                .toList();

        log.debug("MATCH: geo index found {} volunteer(s) within {} m of ({}, {})",
                matches.size(), radiusMeters, latitude, longitude);
        return matches;
    }
}
