package com.safeher.sosdispatch.service.notification;

import java.util.Map;

/**
 * Publish/subscribe fan-out addressed by subscriber id. At-most-once, best effort,
 * no delivery receipt.
 */
public interface AlertEventPublisher {

    void publish(String subscriberId, AlertEventType event, Map<String, Object> payload);

    static String volunteerChannel(Long userId) {
        return "volunteer_" + userId;
    }

    static String userChannel(Long userId) {
        return "user_" + userId;
    }
}
