package com.safeher.sosdispatch.entity;

/**
 * Kind of emergency reported by the user.
 */
public enum AlertType {
    SOS,
    MEDICAL,
    ACCIDENT,
    HARASSMENT,
    OTHER
}
