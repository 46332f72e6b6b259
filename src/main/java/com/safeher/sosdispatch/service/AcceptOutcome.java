package com.safeher.sosdispatch.service;

/**
 * Result of a volunteer's attempt to take an alert.
 */
public enum AcceptOutcome {

    /** This volunteer won the ACTIVE → RESPONDING transition */
    ACCEPTED,

    /** Someone else accepted first, or the alert closed in the meantime */
    ALREADY_TAKEN,

    /** The volunteer was never notified for this alert */
    NOT_ELIGIBLE
}
