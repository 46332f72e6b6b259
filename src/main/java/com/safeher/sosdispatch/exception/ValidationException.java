package com.safeher.sosdispatch.exception;

/**
 * Rejected input (bad coordinates, rating outside 1–5). Mapped to 400.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
