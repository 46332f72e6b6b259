package com.safeher.sosdispatch.service;

import com.safeher.sosdispatch.dto.NearbyVolunteerResponse;
import com.safeher.sosdispatch.entity.AppUser;
import com.safeher.sosdispatch.entity.Volunteer;
import com.safeher.sosdispatch.exception.ForbiddenException;
import com.safeher.sosdispatch.exception.NotFoundException;
import com.safeher.sosdispatch.exception.ValidationException;
import com.safeher.sosdispatch.repository.VolunteerRepository;
import com.safeher.sosdispatch.service.matching.VolunteerGeoIndex;
import com.safeher.sosdispatch.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Volunteer self-service: duty toggle, position reports and profile, plus the
 * nearby-volunteers view.
 * Duty status and location are what make a volunteer matchable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VolunteerService {

    private static final String DEFAULT_VOLUNTEER_NAME = "SafeHer Volunteer";
    private static final int NEARBY_LIMIT = 20;

    private final VolunteerRepository volunteerRepository;
    private final VolunteerGeoIndex volunteerGeoIndex;
    private final CacheableDataService cacheableDataService;
    private final Clock clock;

    @Value("${volunteer.nearby.default-radius-meters:5000}")
    private double defaultNearbyRadiusMeters;

    @Value("${volunteer.nearby.max-radius-meters:50000}")
    private double maxNearbyRadiusMeters;

    @Transactional(readOnly = true)
    public Volunteer getProfile(Long userId) {
        Volunteer volunteer = findByUser(userId);
        volunteer.getBadges().size(); // initialise lazy badges inside the transaction
        return volunteer;
    }

    /**
     * Flips on/off duty. Only verified volunteers may go on duty.
     */
    @Transactional
    public Volunteer toggleDuty(Long userId) {
        Volunteer volunteer = findByUser(userId);
        if (!volunteer.isVerified()) {
            throw new ForbiddenException("Your volunteer account is pending verification");
        }
        volunteer.setOnDuty(!volunteer.isOnDuty());
        volunteerRepository.save(volunteer);
        log.info("VOLUNTEER: #{} is now {}", volunteer.getId(), volunteer.isOnDuty() ? "ON duty" : "OFF duty");
        return volunteer;
    }

    @Transactional
    public void updateLocation(Long userId, Double latitude, Double longitude) {
        if (!GeoUtil.isValidCoordinate(latitude, longitude)) {
            throw new ValidationException("Valid latitude and longitude are required");
        }
        Volunteer volunteer = findByUser(userId);
        volunteerRepository.updateLocation(volunteer.getId(), latitude, longitude, LocalDateTime.now(clock));
        log.debug("VOLUNTEER: #{} location → ({}, {})", volunteer.getId(), latitude, longitude);
    }

    /**
     * Up to 20 matchable volunteers within {@code radiusMeters} of the point, nearest first.
     * A null radius falls back to the configured default.
     */
    @Transactional(readOnly = true)
    public List<NearbyVolunteerResponse> findNearbyVolunteers(Double latitude, Double longitude, Double radiusMeters) {
        if (!GeoUtil.isValidCoordinate(latitude, longitude)) {
            throw new ValidationException("Valid latitude and longitude are required");
        }
        double radius = radiusMeters != null ? radiusMeters : defaultNearbyRadiusMeters;
        if (!(radius > 0) || radius > maxNearbyRadiusMeters) {
            throw new ValidationException("Radius must be greater than 0 and at most "
                    + (long) maxNearbyRadiusMeters + " meters");
        }

        List<NearbyVolunteerResponse> nearby = volunteerGeoIndex.findNearby(latitude, longitude, radius, NEARBY_LIMIT)
                .stream()
                .map(m -> {
                    Volunteer v = m.getVolunteer();
                    return NearbyVolunteerResponse.builder()
                            .volunteerId(v.getId())
                            .name(cacheableDataService.getUser(v.getUserId())
                                    .map(AppUser::getName)
                                    .filter(name -> !name.isBlank())
                                    .orElse(DEFAULT_VOLUNTEER_NAME))
                            .latitude(v.getLatitude())
                            .longitude(v.getLongitude())
                            .distanceMeters(m.getDistanceMeters())
                            .avgRating(v.getAvgRating())
                            .successfulAssists(v.getSuccessfulAssists())
                            .build();
                })
                .toList();

        log.debug("VOLUNTEER: {} on-duty volunteer(s) within {} m of ({}, {})", nearby.size(), (long) radius,
                latitude, longitude);
        return nearby;
    }

    private Volunteer findByUser(Long userId) {
        return volunteerRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("Volunteer profile not found"));
    }
}
