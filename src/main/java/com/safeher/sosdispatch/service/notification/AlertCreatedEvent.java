package com.safeher.sosdispatch.service.notification;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Published inside the alert-creation transaction; ContactNotificationListener picks it up
 * once that transaction has committed.
 */
@Getter
@AllArgsConstructor
public class AlertCreatedEvent {

    private final Long alertId;
    private final Long userId;
}
