package com.safeher.sosdispatch.exception;

/**
 * State-machine precondition no longer holds, e.g. a lost accept race. Mapped to 409.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
