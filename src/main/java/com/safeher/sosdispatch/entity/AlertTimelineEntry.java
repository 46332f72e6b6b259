package com.safeher.sosdispatch.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Append-only audit trail of an alert's state transitions.
 *
 * Fields:
 *  - alertId     : which alert transitioned
 *  - action      : typed enum (TimelineAction)
 *  - description : human-readable summary
 *  - performedBy : acting user id, null for system actions (sweeper)
 *  - timestamp   : SERVER time of the transition
 */
@Entity
@Table(
    name = "alert_timeline",
    indexes = @Index(name = "idx_timeline_alert_id", columnList = "alert_id")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertTimelineEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "alert_id", nullable = false)
    private Long alertId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TimelineAction action;

    @Column(nullable = false)
    private String description;

    private Long performedBy;

    @Column(name = "event_timestamp", nullable = false)
    private LocalDateTime timestamp;
}
