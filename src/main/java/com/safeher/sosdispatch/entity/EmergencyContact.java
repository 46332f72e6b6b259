package com.safeher.sosdispatch.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Emergency contact belonging to exactly one user.
 *
 * At most five active contacts per user, exactly one of them primary
 * (enforced by EmergencyContactService). Deletion is a soft delete via active=false.
 */
@Entity
@Table(
    name = "emergency_contacts",
    indexes = @Index(name = "idx_contact_user_id", columnList = "user_id")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmergencyContact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false, length = 50)
    private String name;

    @Column(nullable = false, length = 20)
    private String phone;

    @Column(length = 20)
    private String relation;

    /** Only the primary contact receives a voice call on SOS */
    @Column(name = "is_primary", nullable = false)
    private boolean primaryContact;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
