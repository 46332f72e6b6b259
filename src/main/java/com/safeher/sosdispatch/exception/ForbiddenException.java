package com.safeher.sosdispatch.exception;

/**
 * Caller is not allowed to perform the operation on this resource. Mapped to 403.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
