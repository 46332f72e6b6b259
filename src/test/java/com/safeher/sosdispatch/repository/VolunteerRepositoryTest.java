package com.safeher.sosdispatch.repository;

import com.safeher.sosdispatch.entity.Volunteer;
import com.safeher.sosdispatch.entity.VolunteerStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class VolunteerRepositoryTest {

    @Autowired
    private VolunteerRepository volunteerRepository;

    private Volunteer save(long userId, boolean verified, boolean onDuty, VolunteerStatus status, Double lat, Double lon) {
        return volunteerRepository.saveAndFlush(Volunteer.builder()
                .userId(userId).verified(verified).onDuty(onDuty).status(status)
                .latitude(lat).longitude(lon).build());
    }

    @Test
    void findEligibleWithinBounds_onlyVerifiedOnDutyActiveWithLocation() {
        Long eligible = save(1, true, true, VolunteerStatus.ACTIVE, 12.97, 77.59).getId();
        save(2, true, false, VolunteerStatus.ACTIVE, 12.97, 77.59);
        save(3, false, true, VolunteerStatus.ACTIVE, 12.97, 77.59);
        save(4, true, true, VolunteerStatus.SUSPENDED, 12.97, 77.59);
        save(5, true, true, VolunteerStatus.ACTIVE, null, null);
        save(6, true, true, VolunteerStatus.ACTIVE, 28.61, 77.20);

        assertThat(volunteerRepository.findEligibleWithinBounds(VolunteerStatus.ACTIVE, 12.9, 13.0, 77.5, 77.7))
                .extracting(Volunteer::getId)
                .containsExactly(eligible);
    }

    @Test
    void findEligible_includesVolunteersWithoutLocation_orderedById() {
        Long a = save(1, true, true, VolunteerStatus.ACTIVE, null, null).getId();
        Long b = save(2, true, true, VolunteerStatus.ACTIVE, 28.61, 77.20).getId();
        save(3, true, false, VolunteerStatus.ACTIVE, 12.97, 77.59);

        assertThat(volunteerRepository.findEligible(VolunteerStatus.ACTIVE, PageRequest.of(0, 10)))
                .extracting(Volunteer::getId)
                .containsExactly(a, b);
    }

    @Test
    void incrementDeclinedAlerts_addsOne() {
        Long id = save(1, true, true, VolunteerStatus.ACTIVE, 12.97, 77.59).getId();

        volunteerRepository.incrementDeclinedAlerts(id);
        volunteerRepository.incrementDeclinedAlerts(id);

        assertThat(volunteerRepository.findById(id).orElseThrow().getDeclinedAlerts()).isEqualTo(2);
    }
}
