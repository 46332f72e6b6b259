package com.safeher.sosdispatch.service.notification;

/**
 * Events pushed to subscribers. {@link #getWireName()} is the name clients listen for.
 */
public enum AlertEventType {

    /** To each matched volunteer */
    NEW_ALERT("new_alert"),

    /** To the alert owner, with an ETA */
    VOLUNTEER_RESPONDING("volunteer_responding"),

    /** To the responding volunteer */
    ALERT_CANCELLED("alert_cancelled"),

    /** To the responding volunteer */
    LOCATION_UPDATE("location_update");

    private final String wireName;

    AlertEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
