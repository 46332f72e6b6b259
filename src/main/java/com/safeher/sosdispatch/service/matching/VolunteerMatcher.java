package com.safeher.sosdispatch.service.matching;

import com.safeher.sosdispatch.entity.Volunteer;
import com.safeher.sosdispatch.entity.VolunteerStatus;
import com.safeher.sosdispatch.repository.VolunteerRepository;
import com.safeher.sosdispatch.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Selects the volunteers to notify for an alert.
 *
 * Primary path: geo index, nearest first within the search radius.
 * Fallback (index threw or found nobody): any eligible volunteers ordered by id, so an
 * alert always reaches someone when eligible volunteers exist at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VolunteerMatcher {

    private static final Comparator<VolunteerMatch> BY_KNOWN_DISTANCE =
            Comparator.comparing(VolunteerMatch::getDistanceMeters,
                    Comparator.nullsLast(Comparator.naturalOrder()));

    private final VolunteerGeoIndex volunteerGeoIndex;
    private final VolunteerRepository volunteerRepository;

    @Value("${alert.matching.search-radius-km:5}")
    private double searchRadiusKm;

    @Value("${alert.matching.max-volunteers:10}")
    private int maxVolunteers;

    public List<VolunteerMatch> match(double latitude, double longitude) {
        return match(latitude, longitude, maxVolunteers);
    }

    public List<VolunteerMatch> match(double latitude, double longitude, int maxCount) {
        if (maxCount <= 0) {
            return List.of();
        }

        try {
            List<VolunteerMatch> nearby = volunteerGeoIndex.findNearby(
                    latitude, longitude, searchRadiusKm * 1000, maxCount);
            if (!nearby.isEmpty()) {
                log.info("MATCH: {} volunteer(s) within {} km", nearby.size(), searchRadiusKm);
                return nearby;
            }
            log.info("MATCH: no volunteer within {} km of ({}, {}) — using fallback",
                    searchRadiusKm, latitude, longitude);
        } catch (Exception e) {
            log.warn("MATCH: geo index unavailable — using fallback: {}", e.getMessage());
        }

        return fallback(latitude, longitude, maxCount);
    }

    private List<VolunteerMatch> fallback(double latitude, double longitude, int maxCount) {
        List<Volunteer> eligible = volunteerRepository.findEligible(
                VolunteerStatus.ACTIVE, PageRequest.of(0, maxCount));

        // Stream.sorted is stable, so volunteers with equal or unknown distance keep id order
        List<VolunteerMatch> matches = eligible.stream()
                .map(v -> new VolunteerMatch(v, v.hasLocation()
                        ? GeoUtil.calculateDistanceMeters(latitude, longitude, v.getLatitude(), v.getLongitude())
                        : null))
                .sorted(BY_KNOWN_DISTANCE)
                .toList();

        log.info("MATCH: fallback selected {} volunteer(s)", matches.size());
        return matches;
    }
}
