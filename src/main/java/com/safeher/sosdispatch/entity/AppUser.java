package com.safeher.sosdispatch.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Account record read by the dispatch engine for names, phone numbers and roles.
 * Profile management lives outside this service.
 */
@Entity
@Table(name = "app_users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppUser {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String name;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(nullable = false, length = 20)
    private String phone;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role;

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
