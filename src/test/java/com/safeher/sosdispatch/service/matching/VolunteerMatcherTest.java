package com.safeher.sosdispatch.service.matching;

import com.safeher.sosdispatch.entity.Volunteer;
import com.safeher.sosdispatch.entity.VolunteerStatus;
import com.safeher.sosdispatch.repository.VolunteerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for VolunteerMatcher.
 *
 * Geo index path, fallback when the index is empty or throws, the result cap,
 * and nulls-last ordering of volunteers without a location.
 */
@ExtendWith(MockitoExtension.class)
class VolunteerMatcherTest {

    @Mock private VolunteerGeoIndex   volunteerGeoIndex;
    @Mock private VolunteerRepository volunteerRepository;

    private VolunteerMatcher matcher;

    private static final double LAT = 12.9716;
    private static final double LON = 77.5946;

    @BeforeEach
    void setUp() {
        matcher = new VolunteerMatcher(volunteerGeoIndex, volunteerRepository);
        ReflectionTestUtils.setField(matcher, "searchRadiusKm", 5.0);
        ReflectionTestUtils.setField(matcher, "maxVolunteers", 10);
    }

    private Volunteer volunteer(long id, Double lat, Double lon) {
        return Volunteer.builder().id(id).userId(100 + id).verified(true)
                .status(VolunteerStatus.ACTIVE).onDuty(true).latitude(lat).longitude(lon).build();
    }

    @Test
    @DisplayName("Geo index results are returned as-is when non-empty")
    void match_geoIndexHit_usesIndex() {
        List<VolunteerMatch> nearby = List.of(new VolunteerMatch(volunteer(1, LAT, LON), 0L));
        when(volunteerGeoIndex.findNearby(LAT, LON, 5000.0, 10)).thenReturn(nearby);

        assertThat(matcher.match(LAT, LON)).isSameAs(nearby);
        verifyNoInteractions(volunteerRepository);
    }

    @Test
    @DisplayName("Empty geo result → fallback list ordered by distance, unknown locations last")
    void match_noneNearby_fallbackNullsLast() {
        when(volunteerGeoIndex.findNearby(anyDouble(), anyDouble(), anyDouble(), anyInt())).thenReturn(List.of());
        Volunteer noLocation = volunteer(1, null, null);
        Volunteer far = volunteer(2, 13.5, 77.5946);
        Volunteer nearer = volunteer(3, 13.1, 77.5946);
        when(volunteerRepository.findEligible(VolunteerStatus.ACTIVE, PageRequest.of(0, 10)))
                .thenReturn(List.of(noLocation, far, nearer));

        List<VolunteerMatch> result = matcher.match(LAT, LON);

        assertThat(result).extracting(m -> m.getVolunteer().getId()).containsExactly(3L, 2L, 1L);
        assertThat(result.get(2).getDistanceMeters()).isNull();
        assertThat(result.get(0).getDistanceMeters()).isPositive();
    }

    @Test
    @DisplayName("Geo index failure → fallback still returns eligible volunteers")
    void match_indexThrows_fallback() {
        when(volunteerGeoIndex.findNearby(anyDouble(), anyDouble(), anyDouble(), anyInt()))
                .thenThrow(new IllegalStateException("index down"));
        when(volunteerRepository.findEligible(VolunteerStatus.ACTIVE, PageRequest.of(0, 10)))
                .thenReturn(List.of(volunteer(4, LAT, LON)));

        assertThat(matcher.match(LAT, LON)).hasSize(1);
    }

    @Test
    @DisplayName("Explicit cap is passed through to index and fallback")
    void match_customCap() {
        when(volunteerGeoIndex.findNearby(LAT, LON, 5000.0, 2)).thenReturn(List.of());
        when(volunteerRepository.findEligible(VolunteerStatus.ACTIVE, PageRequest.of(0, 2)))
                .thenReturn(List.of(volunteer(1, LAT, LON), volunteer(2, LAT, LON)));

        assertThat(matcher.match(LAT, LON, 2)).hasSize(2);
    }

    @Test
    void match_zeroCap_empty() {
        assertThat(matcher.match(LAT, LON, 0)).isEmpty();
        verifyNoInteractions(volunteerGeoIndex, volunteerRepository);
    }
}
