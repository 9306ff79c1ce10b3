package com.purchasingpower.infragraph.exception;

/**
 * A concurrent transaction changed the same lifecycle object or rows first.
 * Retrying from a fresh read may succeed.
 */
public class ConflictException extends GraphVersioningException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }

    public ConflictException(String message, Throwable cause) {
        super(ErrorKind.CONFLICT, message, cause);
    }
}
