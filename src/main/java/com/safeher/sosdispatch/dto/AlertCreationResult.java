package com.safeher.sosdispatch.dto;

import lombok.*;

/**
 * What the caller learns from alert creation: the id and how many recipients were reached.
 * contactsNotified counts the active contacts queued for SMS; delivery happens in the background.
 */
@Getter
@AllArgsConstructor
@Builder
public class AlertCreationResult {

    private final Long alertId;
    private final int volunteersNotified;
    private final int contactsNotified;
}
