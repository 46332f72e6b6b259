package com.safeher.sosdispatch.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.LocalDateTime;

/**
 * Entity representing an SOS Alert: the central aggregate of the dispatch engine.
 *
 * Child collections (notified volunteers, notified contacts, timeline, location history)
 * live in their own tables keyed by alert_id so they can be appended without rewriting
 * the alert row.
 *
 * Status, responding volunteer and the derived metrics are written only through the
 * conditional updates in AlertRepository. @DynamicUpdate keeps ordinary saves from
 * flushing a stale status over a concurrent transition.
 */
@Entity
@Table(
    name = "alerts",
    indexes = {
        @Index(name = "idx_alert_status_created", columnList = "status, created_at"),
        @Index(name = "idx_alert_user_created",   columnList = "user_id, created_at")
    }
)
@DynamicUpdate
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Alert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** User who raised the alert */
    @Column(name = "user_id", nullable = false)
    private Long userId;

    // ── Location ────────────────────────────────────────────────────────────

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    private String address;

    private LocalDateTime locationUpdatedAt;

    // ── State ───────────────────────────────────────────────────────────────

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AlertStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AlertPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", nullable = false, length = 20)
    private AlertType type;

    @Column(length = 500)
    private String message;

    // ── Responding volunteer (set once by the accept CAS) ───────────────────

    @Column(name = "responding_volunteer_id")
    private Long respondingVolunteerId;

    private LocalDateTime acceptedAt;

    private Long respondingDistanceMeters;

    // ── Resolution ──────────────────────────────────────────────────────────

    private Long resolvedBy;

    private LocalDateTime resolvedAt;

    @Column(length = 1000)
    private String resolutionNotes;

    /** 1–5, supplied on resolve or via feedback */
    private Integer rating;

    @Column(length = 1000)
    private String feedback;

    /** True once the rating has been folded into the responder's running average */
    @Column(nullable = false)
    @Builder.Default
    private Boolean ratingRecorded = false;

    // ── Derived metrics (seconds) ───────────────────────────────────────────

    /** acceptedAt − createdAt */
    private Long responseTimeSeconds;

    /** resolvedAt − createdAt */
    private Long totalDurationSeconds;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        if (this.updatedAt == null) {
            this.updatedAt = this.createdAt;
        }
    }

    public boolean isOwnedBy(Long userId) {
        return userId != null && userId.equals(this.userId);
    }
}
