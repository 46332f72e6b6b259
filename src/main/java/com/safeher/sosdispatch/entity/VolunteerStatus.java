package com.safeher.sosdispatch.entity;

/**
 * Operational status of a volunteer account.
 */
public enum VolunteerStatus {
    PENDING,
    ACTIVE,
    INACTIVE,
    SUSPENDED
}
