package com.safeher.sosdispatch.config;

import com.safeher.sosdispatch.entity.*;
import com.safeher.sosdispatch.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Data loader that runs on application startup.
 * Inserts a requester with emergency contacts, three volunteers around Bangalore MG Road
 * and an admin, so the dispatch flow can be exercised end to end.
 *
 * Disable with app.seed-data=false.
 */
@Component
@ConditionalOnProperty(name = "app.seed-data", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DataLoader implements CommandLineRunner {

    private final AppUserRepository appUserRepository;
    private final VolunteerRepository volunteerRepository;
    private final EmergencyContactRepository emergencyContactRepository;
    private final Clock clock;

    @Override
    public void run(String... args) throws Exception {
        log.info("Starting data initialization...");

        if (appUserRepository.count() > 0) {
            log.info("Data already exists, skipping initialization");
            return;
        }

        LocalDateTime now = LocalDateTime.now(clock);

        // Requester
        AppUser priya = appUserRepository.save(AppUser.builder()
                .name("Priya Sharma")
                .email("priya@safeher.app")
                .phone("9876543210")
                .role(UserRole.USER)
                .build());
        log.info("User created: {} (id={})", priya.getName(), priya.getId());

        emergencyContactRepository.save(EmergencyContact.builder()
                .userId(priya.getId())
                .name("Anita Sharma")
                .phone("9876500001")
                .relation("Mother")
                .primaryContact(true)
                .active(true)
                .createdAt(now)
                .build());
        emergencyContactRepository.save(EmergencyContact.builder()
                .userId(priya.getId())
                .name("Rahul Verma")
                .phone("+91 98765 00002")
                .relation("Friend")
                .primaryContact(false)
                .active(true)
                .createdAt(now.plusSeconds(1))
                .build());
        log.info("Emergency contacts created for {}", priya.getName());

        // Volunteers at increasing distance from MG Road (12.9716, 77.5946)
        createVolunteer("Kavya Rao",   "kavya@safeher.app",  "9811100001", 12.9720, 77.5950, now);
        createVolunteer("Arjun Mehta", "arjun@safeher.app",  "9811100002", 12.9780, 77.6010, now);
        createVolunteer("Sneha Iyer",  "sneha@safeher.app",  "9811100003", 12.9900, 77.6200, now);

        appUserRepository.save(AppUser.builder()
                .name("Control Room")
                .email("admin@safeher.app")
                .phone("9800000000")
                .role(UserRole.ADMIN)
                .build());

        log.info("=================================================================");
        log.info("Sample data initialization completed!");
        log.info("Login with POST /auth/login {\"email\":\"priya@safeher.app\"} and POST /api/alerts");
        log.info("Volunteers: kavya@ / arjun@ / sneha@safeher.app   Admin: admin@safeher.app");
        log.info("=================================================================");
    }

    private void createVolunteer(String name, String email, String phone,
                                 double lat, double lon, LocalDateTime now) {
        AppUser user = appUserRepository.save(AppUser.builder()
                .name(name)
                .email(email)
                .phone(phone)
                .role(UserRole.VOLUNTEER)
                .build());
        Volunteer volunteer = volunteerRepository.save(Volunteer.builder()
                .userId(user.getId())
                .verified(true)
                .status(VolunteerStatus.ACTIVE)
                .onDuty(true)
                .latitude(lat)
                .longitude(lon)
                .locationUpdatedAt(now)
                .build());
        log.info("Volunteer created: {} (volunteer #{}) at ({}, {})", name, volunteer.getId(), lat, lon);
    }
}
