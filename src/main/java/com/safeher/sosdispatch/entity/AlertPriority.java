package com.safeher.sosdispatch.entity;

/**
 * Descriptive priority tag. Not an input to the state machine.
 */
public enum AlertPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
