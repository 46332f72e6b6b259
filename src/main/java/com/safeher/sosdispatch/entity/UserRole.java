package com.safeher.sosdispatch.entity;

public enum UserRole {
    USER,
    VOLUNTEER,
    ADMIN
}
