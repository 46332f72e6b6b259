package com.safeher.sosdispatch.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of an SOS alert.
 *
 * PENDING → ACTIVE → RESPONDING → RESOLVED, with ACTIVE/RESPONDING → CANCELLED and
 * PENDING/ACTIVE/RESPONDING → EXPIRED (sweeper). RESOLVED, CANCELLED and EXPIRED are terminal.
 *
 * Stored as a String in the DB via @Enumerated(EnumType.STRING).
 */
public enum AlertStatus {

    PENDING,
    ACTIVE,
    RESPONDING,
    RESOLVED,
    CANCELLED,
    EXPIRED;

    /** States in which the owner may still cancel, resolve or move the alert */
    public static final Set<AlertStatus> OPEN = EnumSet.of(ACTIVE, RESPONDING);

    /** States the sweeper ages out once the alert is stale */
    public static final Set<AlertStatus> EXPIRABLE = EnumSet.of(PENDING, ACTIVE, RESPONDING);
}
