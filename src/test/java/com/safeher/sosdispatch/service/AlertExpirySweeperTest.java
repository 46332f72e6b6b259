package com.safeher.sosdispatch.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AlertExpirySweeper: cutoffs derived from the clock, and the two passes
 * running independently of each other's failures.
 */
@ExtendWith(MockitoExtension.class)
class AlertExpirySweeperTest {

    @Mock
    private AlertRetentionService alertRetentionService;

    private AlertExpirySweeper sweeper;

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0, 0);

    @BeforeEach
    void setUp() {
        sweeper = new AlertExpirySweeper(alertRetentionService,
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
        ReflectionTestUtils.setField(sweeper, "expireAfterHours", 24L);
        ReflectionTestUtils.setField(sweeper, "retentionDays", 7L);
    }

    @Test
    @DisplayName("Sweep uses now − 24h for expiry and now − 7d for deletion")
    void sweep_cutoffs() {
        when(alertRetentionService.expireAlertsCreatedBefore(NOW.minusHours(24), NOW)).thenReturn(2);
        when(alertRetentionService.deleteAlertsCreatedBefore(NOW.minusDays(7))).thenReturn(1);

        sweeper.sweep();

        verify(alertRetentionService).expireAlertsCreatedBefore(NOW.minusHours(24), NOW);
        verify(alertRetentionService).deleteAlertsCreatedBefore(NOW.minusDays(7));
    }

    @Test
    @DisplayName("Expiry pass failing does not skip the retention pass")
    void sweep_expiryFails_retentionStillRuns() {
        when(alertRetentionService.expireAlertsCreatedBefore(any(), any()))
                .thenThrow(new IllegalStateException("db unavailable"));

        sweeper.sweep();

        verify(alertRetentionService).deleteAlertsCreatedBefore(NOW.minusDays(7));
    }

    @Test
    @DisplayName("Retention pass failing is logged, not rethrown")
    void sweep_retentionFails_swallowedForNextRun() {
        when(alertRetentionService.deleteAlertsCreatedBefore(any()))
                .thenThrow(new IllegalStateException("db unavailable"));

        sweeper.sweep();

        verify(alertRetentionService).expireAlertsCreatedBefore(NOW.minusHours(24), NOW);
    }
}
