package com.safeher.sosdispatch.entity;

/**
 * Per-volunteer status on an alert's notified-volunteers list.
 */
public enum VolunteerResponseStatus {
    NOTIFIED,
    ACCEPTED,
    DECLINED,
    NO_RESPONSE
}
