package com.safeher.sosdispatch.entity;

/**
 * Enum for alert timeline actions.
 *
 * One entry is appended per state transition, so the timeline reads as the
 * audit trail of the alert's state machine.
 */
public enum TimelineAction {

    /** Alert raised by the user, status ACTIVE */
    CREATED,

    /** A notified volunteer won the accept race, status RESPONDING */
    ACCEPTED,

    /** Owner withdrew the alert */
    CANCELLED,

    /** Owner, responding volunteer or admin closed the alert */
    RESOLVED,

    /** Aged out by the expiry sweeper */
    EXPIRED
}
