package com.safeher.sosdispatch.exception;

/**
 * Unknown alert, volunteer profile, contact or user. Mapped to 404.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
