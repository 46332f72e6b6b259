package com.safeher.sosdispatch.entity;

/**
 * Channel used to reach an emergency contact.
 */
public enum ContactChannel {
    SMS,
    CALL,
    PUSH,
    EMAIL
}
