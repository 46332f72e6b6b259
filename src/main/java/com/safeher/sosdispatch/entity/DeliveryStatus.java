package com.safeher.sosdispatch.entity;

/**
 * Outcome of a single notification attempt, as reported by the gateway.
 */
public enum DeliveryStatus {
    SENT,
    DELIVERED,
    FAILED
}
