package com.safeher.sosdispatch.service;

import com.safeher.sosdispatch.entity.*;
import com.safeher.sosdispatch.exception.ConflictException;
import com.safeher.sosdispatch.repository.AlertRepository;
import com.safeher.sosdispatch.repository.AlertTimelineRepository;
import com.safeher.sosdispatch.repository.AlertVolunteerNotificationRepository;
import com.safeher.sosdispatch.repository.VolunteerRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Several notified volunteers accept the same alert at the same instant, each on its own
 * thread and transaction, against the real H2 database.
 *
 * Exactly one accept may win; every other caller gets a ConflictException and the stored
 * responder is the winner.
 */
@SpringBootTest
class ConcurrentAcceptTest {

    private static final int VOLUNTEERS = 8;
    private static final long OWNER_ID = 400L;
    private static final long FIRST_VOLUNTEER_USER_ID = 500L;

    @Autowired private AlertLifecycleService                alertLifecycleService;
    @Autowired private AlertRepository                      alertRepository;
    @Autowired private AlertVolunteerNotificationRepository volunteerNotificationRepository;
    @Autowired private AlertTimelineRepository              timelineRepository;
    @Autowired private VolunteerRepository                  volunteerRepository;

    @AfterEach
    void cleanUp() {
        timelineRepository.deleteAllInBatch();
        volunteerNotificationRepository.deleteAllInBatch();
        alertRepository.deleteAllInBatch();
        volunteerRepository.deleteAllInBatch();
    }

    @Test
    @DisplayName("Simultaneous accepts → one RESPONDING winner, everyone else Conflict")
    void acceptAlert_simultaneous_singleWinner() throws Exception {
        LocalDateTime createdAt = LocalDateTime.now().minusMinutes(1);
        Alert alert = alertRepository.saveAndFlush(Alert.builder()
                .userId(OWNER_ID)
                .latitude(12.9716)
                .longitude(77.5946)
                .status(AlertStatus.ACTIVE)
                .priority(AlertPriority.HIGH)
                .type(AlertType.SOS)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build());

        List<Volunteer> volunteers = new ArrayList<>();
        for (int i = 0; i < VOLUNTEERS; i++) {
            Volunteer volunteer = volunteerRepository.saveAndFlush(Volunteer.builder()
                    .userId(FIRST_VOLUNTEER_USER_ID + i)
                    .verified(true)
                    .status(VolunteerStatus.ACTIVE)
                    .onDuty(true)
                    .latitude(12.9716)
                    .longitude(77.5946 + 0.001 * (i + 1))
                    .build());
            volunteerNotificationRepository.saveAndFlush(AlertVolunteerNotification.builder()
                    .alertId(alert.getId())
                    .volunteerId(volunteer.getId())
                    .notifiedAt(createdAt)
                    .distanceMeters(110L * (i + 1))
                    .status(VolunteerResponseStatus.NOTIFIED)
                    .build());
            volunteers.add(volunteer);
        }

        ExecutorService pool = Executors.newFixedThreadPool(VOLUNTEERS);
        CountDownLatch ready = new CountDownLatch(VOLUNTEERS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Long>> outcomes = new ArrayList<>();
        try {
            for (Volunteer volunteer : volunteers) {
                outcomes.add(pool.submit(() -> {
                    ready.countDown();
                    start.await();
                    try {
                        alertLifecycleService.acceptAlert(alert.getId(), volunteer.getUserId());
                        return volunteer.getId();
                    } catch (ConflictException e) {
                        return null;
                    }
                }));
            }
            assertThat(ready.await(10, TimeUnit.SECONDS)).isTrue();
            start.countDown();

            List<Long> winners = new ArrayList<>();
            int conflicts = 0;
            for (Future<Long> outcome : outcomes) {
                Long winner = outcome.get(30, TimeUnit.SECONDS);
                if (winner != null) {
                    winners.add(winner);
                } else {
                    conflicts++;
                }
            }

            assertThat(winners).hasSize(1);
            assertThat(conflicts).isEqualTo(VOLUNTEERS - 1);

            Alert stored = alertRepository.findById(alert.getId()).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(AlertStatus.RESPONDING);
            assertThat(stored.getRespondingVolunteerId()).isEqualTo(winners.get(0));
            assertThat(volunteerNotificationRepository.findByAlertIdOrderByIdAsc(alert.getId()))
                    .filteredOn(n -> n.getStatus() == VolunteerResponseStatus.ACCEPTED)
                    .extracting(AlertVolunteerNotification::getVolunteerId)
                    .containsExactly(winners.get(0));
        } finally {
            pool.shutdownNow();
        }
    }
}
