package com.safeher.sosdispatch.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Background housekeeping, once at startup and then every 6 hours by default.
 *
 *  (a) expire  - open alerts older than alert.sweeper.expire-after-hours (24) → EXPIRED
 *  (b) delete  - any alert older than alert.sweeper.retention-days (7) is removed
 *
 * The two passes are guarded separately: a failure in one is logged and does not skip the
 * other, and the next run retries.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertExpirySweeper {

    private final AlertRetentionService alertRetentionService;
    private final Clock clock;

    @Value("${alert.sweeper.expire-after-hours:24}")
    private long expireAfterHours;

    @Value("${alert.sweeper.retention-days:7}")
    private long retentionDays;

    @Scheduled(fixedDelayString = "${alert.sweeper.interval-ms:21600000}",
               initialDelayString = "${alert.sweeper.initial-delay-ms:0}")
    public void sweep() {
        LocalDateTime now = LocalDateTime.now(clock);
        expireStaleAlerts(now);
        deleteExpiredRetention(now);
    }

    void expireStaleAlerts(LocalDateTime now) {
        try {
            int expired = alertRetentionService.expireAlertsCreatedBefore(now.minusHours(expireAfterHours), now);
            if (expired > 0) {
                log.info("SWEEP: expired {} stale alert(s) older than {}h", expired, expireAfterHours);
            } else {
                log.debug("SWEEP: no stale alerts to expire");
            }
        } catch (Exception e) {
            log.error("SWEEP: expiry pass failed, will retry next run — {}", e.getMessage(), e);
        }
    }

    void deleteExpiredRetention(LocalDateTime now) {
        try {
            int deleted = alertRetentionService.deleteAlertsCreatedBefore(now.minusDays(retentionDays));
            if (deleted > 0) {
                log.info("SWEEP: deleted {} alert(s) older than {} days", deleted, retentionDays);
            } else {
                log.debug("SWEEP: nothing past retention");
            }
        } catch (Exception e) {
            log.error("SWEEP: retention pass failed, will retry next run — {}", e.getMessage(), e);
        }
    }
}
