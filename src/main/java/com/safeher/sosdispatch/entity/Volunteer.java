package com.safeher.sosdispatch.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Responder profile.
 *
 * Running averages are stored next to their sample counts so each incremental update
 * stays exact: avgResponseTimeSeconds pairs with totalResponses, avgRating with ratingCount.
 */
@Entity
@Table(
    name = "volunteers",
    indexes = @Index(name = "idx_volunteer_eligibility", columnList = "status, on_duty, verified")
)
@DynamicUpdate
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Volunteer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Owning account; also the volunteer's pub/sub subscriber id */
    @Column(name = "user_id", nullable = false, unique = true)
    private Long userId;

    @Column(nullable = false)
    private boolean verified;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private VolunteerStatus status;

    @Column(name = "on_duty", nullable = false)
    private boolean onDuty;

    // Null until the volunteer reports a location fix
    private Double latitude;
    private Double longitude;
    private LocalDateTime locationUpdatedAt;

    // ── Stats ───────────────────────────────────────────────────────────────

    @Column(nullable = false)
    private int totalResponses;

    @Column(nullable = false)
    private int successfulAssists;

    @Column(nullable = false)
    private int declinedAlerts;

    @Column(nullable = false)
    private double avgResponseTimeSeconds;

    @Column(nullable = false)
    private double avgRating;

    @Column(nullable = false)
    private int ratingCount;

    @OneToMany(mappedBy = "volunteer", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("earnedAt ASC")
    @Builder.Default
    private List<VolunteerBadge> badges = new ArrayList<>();

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }

    public boolean hasBadge(String name) {
        return badges.stream().anyMatch(b -> b.getName().equals(name));
    }
}
