package com.safeher.sosdispatch.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Delivery record for one emergency contact on one channel.
 *
 * A primary contact produces two rows per alert (SMS + CALL); everyone else one.
 */
@Entity
@Table(
    name = "alert_contact_notifications",
    indexes = @Index(name = "idx_acn_alert_id", columnList = "alert_id")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertContactNotification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "alert_id", nullable = false)
    private Long alertId;

    @Column(name = "contact_id", nullable = false)
    private Long contactId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private ContactChannel channel;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private DeliveryStatus status;

    @Column(nullable = false)
    private LocalDateTime notifiedAt;

    /** Populated only when status is FAILED */
    @Column(length = 500)
    private String failureReason;
}
