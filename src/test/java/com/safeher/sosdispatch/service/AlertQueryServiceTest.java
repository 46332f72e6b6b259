package com.safeher.sosdispatch.service;

import com.safeher.sosdispatch.dto.AlertResponse;
import com.safeher.sosdispatch.dto.NearbyAlertResponse;
import com.safeher.sosdispatch.dto.ResponseHistoryItem;
import com.safeher.sosdispatch.entity.*;
import com.safeher.sosdispatch.exception.ForbiddenException;
import com.safeher.sosdispatch.exception.NotFoundException;
import com.safeher.sosdispatch.exception.ValidationException;
import com.safeher.sosdispatch.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertQueryServiceTest {

    @Mock private AlertRepository                      alertRepository;
    @Mock private AlertVolunteerNotificationRepository volunteerNotificationRepository;
    @Mock private AlertContactNotificationRepository   contactNotificationRepository;
    @Mock private AlertTimelineRepository              timelineRepository;
    @Mock private AlertLocationPointRepository         locationPointRepository;
    @Mock private VolunteerRepository                  volunteerRepository;
    @Mock private CacheableDataService                 cacheableDataService;

    @InjectMocks
    private AlertQueryService alertQueryService;

    private static final double LAT = 12.9716;
    private static final double LON = 77.5946;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(alertQueryService, "searchRadiusKm", 5.0);
        ReflectionTestUtils.setField(alertQueryService, "maxHistoryPageSize", 50);
    }

    private Alert alertAt(long id, double lat, double lon) {
        return Alert.builder().id(id).userId(10L).latitude(lat).longitude(lon)
                .status(AlertStatus.ACTIVE).priority(AlertPriority.HIGH).type(AlertType.SOS).build();
    }

    @Test
    @DisplayName("Nearby alerts: exact radius filter and nearest first")
    void getNearbyAlerts_filteredAndSorted() {
        when(volunteerRepository.findByUserId(20L)).thenReturn(Optional.of(Volunteer.builder().id(7L).userId(20L).build()));
        when(alertRepository.findByStatusWithinBounds(eq(AlertStatus.ACTIVE), anyDouble(), anyDouble(), anyDouble(), anyDouble()))
                .thenReturn(List.of(
                        alertAt(1, LAT + 0.036, LON),          // ~4 km
                        alertAt(2, LAT + 0.04, LON + 0.04),    // ~6.2 km, box corner
                        alertAt(3, LAT + 0.001, LON)));        // ~111 m

        List<NearbyAlertResponse> result = alertQueryService.getNearbyAlerts(20L, LAT, LON);

        assertThat(result).extracting(NearbyAlertResponse::getAlertId).containsExactly(3L, 1L);
    }

    @Test
    void getNearbyAlerts_notVolunteer_forbidden() {
        when(volunteerRepository.findByUserId(10L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> alertQueryService.getNearbyAlerts(10L, LAT, LON))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void getNearbyAlerts_missingLocation_validation() {
        assertThatThrownBy(() -> alertQueryService.getNearbyAlerts(20L, null, LON))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Alert details hidden from users who are not owner, admin or responder")
    void getAlert_stranger_forbidden() {
        when(alertRepository.findById(100L)).thenReturn(Optional.of(alertAt(100, LAT, LON)));

        assertThatThrownBy(() -> alertQueryService.getAlert(100L, 99L))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void getAlert_owner_includesDetails() {
        when(alertRepository.findById(100L)).thenReturn(Optional.of(alertAt(100, LAT, LON)));
        when(timelineRepository.findByAlertIdOrderByIdAsc(100L)).thenReturn(List.of(
                AlertTimelineEntry.builder().id(1L).alertId(100L).action(TimelineAction.CREATED)
                        .description("Emergency alert created").performedBy(10L).build()));

        AlertResponse response = alertQueryService.getAlert(100L, 10L);

        assertThat(response.getId()).isEqualTo(100L);
        assertThat(response.getTimeline()).hasSize(1);
        assertThat(response.getNotifiedVolunteers()).isEmpty();
    }

    @Test
    void getActiveAlert_delegatesWithOpenStatuses() {
        when(alertRepository.findFirstByUserIdAndStatusInOrderByCreatedAtDesc(10L, AlertStatus.OPEN))
                .thenReturn(Optional.empty());

        assertThat(alertQueryService.getActiveAlert(10L)).isEmpty();
    }

    // ── Pending feedback ─────────────────────────────────────────────────────

    @Test
    @DisplayName("Pending feedback lists the owner's unrated resolved alerts")
    void getPendingFeedback_mapsRepositoryResult() {
        Alert resolved = alertAt(100, LAT, LON);
        resolved.setStatus(AlertStatus.RESOLVED);
        resolved.setRespondingVolunteerId(7L);
        when(alertRepository.findPendingFeedback(10L)).thenReturn(List.of(resolved));

        List<AlertResponse> result = alertQueryService.getPendingFeedback(10L);

        assertThat(result).extracting(AlertResponse::getId).containsExactly(100L);
    }

    // ── Response history ─────────────────────────────────────────────────────

    @Test
    @DisplayName("History shows each alert with the volunteer's own response; responder fields only when they responded")
    void getResponseHistory_mapsOwnResponse() {
        when(volunteerRepository.findByUserId(20L)).thenReturn(Optional.of(Volunteer.builder().id(7L).userId(20L).build()));
        Alert accepted = alertAt(100, LAT, LON);
        accepted.setStatus(AlertStatus.RESOLVED);
        accepted.setRespondingVolunteerId(7L);
        accepted.setResponseTimeSeconds(90L);
        accepted.setRating(5);
        Alert declined = alertAt(101, LAT, LON);
        declined.setStatus(AlertStatus.RESOLVED);
        declined.setRespondingVolunteerId(8L);
        declined.setRating(4);
        Page<Alert> page = new PageImpl<>(List.of(accepted, declined), PageRequest.of(1, 2), 5);
        when(alertRepository.findNotifiedToVolunteer(7L, PageRequest.of(1, 2))).thenReturn(page);
        LocalDateTime notifiedAt = LocalDateTime.of(2026, 3, 1, 9, 0);
        when(volunteerNotificationRepository.findByVolunteerIdAndAlertIdIn(7L, List.of(100L, 101L))).thenReturn(List.of(
                AlertVolunteerNotification.builder().alertId(100L).volunteerId(7L).notifiedAt(notifiedAt)
                        .distanceMeters(450L).status(VolunteerResponseStatus.ACCEPTED).build(),
                AlertVolunteerNotification.builder().alertId(101L).volunteerId(7L).notifiedAt(notifiedAt)
                        .distanceMeters(900L).status(VolunteerResponseStatus.DECLINED).build()));

        Page<ResponseHistoryItem> history = alertQueryService.getResponseHistory(20L, 2, 2);

        assertThat(history.getTotalElements()).isEqualTo(5);
        assertThat(history.getTotalPages()).isEqualTo(3);
        ResponseHistoryItem first = history.getContent().get(0);
        assertThat(first.isResponder()).isTrue();
        assertThat(first.getResponseStatus()).isEqualTo(VolunteerResponseStatus.ACCEPTED);
        assertThat(first.getResponseTimeSeconds()).isEqualTo(90L);
        assertThat(first.getRating()).isEqualTo(5);
        ResponseHistoryItem second = history.getContent().get(1);
        assertThat(second.isResponder()).isFalse();
        assertThat(second.getResponseStatus()).isEqualTo(VolunteerResponseStatus.DECLINED);
        assertThat(second.getDistanceMeters()).isEqualTo(900L);
        assertThat(second.getRating()).isNull();
    }

    @Test
    void getResponseHistory_noVolunteerProfile_notFound() {
        when(volunteerRepository.findByUserId(10L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> alertQueryService.getResponseHistory(10L, 1, 10))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("History rejects page 0 and oversized limits before any read")
    void getResponseHistory_badPaging_validation() {
        assertThatThrownBy(() -> alertQueryService.getResponseHistory(20L, 0, 10))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> alertQueryService.getResponseHistory(20L, 1, 51))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(volunteerRepository, alertRepository);
    }
}
