package com.safeher.sosdispatch.service;

import com.safeher.sosdispatch.entity.AlertStatus;
import com.safeher.sosdispatch.entity.AlertTimelineEntry;
import com.safeher.sosdispatch.entity.TimelineAction;
import com.safeher.sosdispatch.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * The two sweeps behind AlertExpirySweeper, each in its own transaction.
 * Both are idempotent: re-running after an interruption only finds what is left.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertRetentionService {

    private static final int DELETE_BATCH_SIZE = 500;

    private final AlertRepository alertRepository;
    private final AlertVolunteerNotificationRepository volunteerNotificationRepository;
    private final AlertContactNotificationRepository contactNotificationRepository;
    private final AlertTimelineRepository timelineRepository;
    private final AlertLocationPointRepository locationPointRepository;

    /**
     * PENDING / ACTIVE / RESPONDING alerts created before {@code cutoff} become EXPIRED.
     *
     * @return number of alerts expired
     */
    @Transactional
    public int expireAlertsCreatedBefore(LocalDateTime cutoff, LocalDateTime now) {
        List<Long> staleIds = alertRepository.findIdsByStatusInAndCreatedBefore(AlertStatus.EXPIRABLE, cutoff);
        int expired = 0;
        for (Long id : staleIds) {
            // Conditional: an alert resolved or cancelled since the SELECT is left alone
            if (alertRepository.transitionStatus(id, AlertStatus.EXPIRABLE, AlertStatus.EXPIRED, now) == 1) {
                timelineRepository.save(AlertTimelineEntry.builder()
                        .alertId(id)
                        .action(TimelineAction.EXPIRED)
                        .description("Alert expired without resolution")
                        .performedBy(null)
                        .timestamp(now)
                        .build());
                expired++;
            }
        }
        return expired;
    }

    /**
     * Permanently deletes alerts of any status created before {@code cutoff}, together with
     * their notifications, timeline and location history.
     *
     * @return number of alerts deleted
     */
    @Transactional
    public int deleteAlertsCreatedBefore(LocalDateTime cutoff) {
        List<Long> ids = alertRepository.findIdsCreatedBefore(cutoff);
        int deleted = 0;
        for (int from = 0; from < ids.size(); from += DELETE_BATCH_SIZE) {
            List<Long> batch = ids.subList(from, Math.min(from + DELETE_BATCH_SIZE, ids.size()));
            volunteerNotificationRepository.deleteByAlertIdIn(batch);
            contactNotificationRepository.deleteByAlertIdIn(batch);
            timelineRepository.deleteByAlertIdIn(batch);
            locationPointRepository.deleteByAlertIdIn(batch);
            deleted += alertRepository.deleteAllByIdIn(batch);
        }
        return deleted;
    }
}
