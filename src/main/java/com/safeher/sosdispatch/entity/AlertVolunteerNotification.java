package com.safeher.sosdispatch.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One row per volunteer notified for an alert.
 *
 * The unique constraint on (alert_id, volunteer_id) guarantees a volunteer appears at
 * most once on an alert's notified list.
 */
@Entity
@Table(
    name = "alert_volunteer_notifications",
    uniqueConstraints = @UniqueConstraint(
            name = "uk_alert_volunteer", columnNames = {"alert_id", "volunteer_id"}),
    indexes = @Index(name = "idx_avn_alert_id", columnList = "alert_id")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertVolunteerNotification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "alert_id", nullable = false)
    private Long alertId;

    @Column(name = "volunteer_id", nullable = false)
    private Long volunteerId;

    @Column(nullable = false)
    private LocalDateTime notifiedAt;

    /** Great-circle distance in whole meters; null when the volunteer had no location fix */
    private Long distanceMeters;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private VolunteerResponseStatus status;
}
