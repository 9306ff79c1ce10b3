package com.purchasingpower.infragraph.exception;

/**
 * Operation not allowed in the current lifecycle state, e.g. writing through a
 * closed edit session or applying a change set twice.
 */
public class InvalidStateException extends GraphVersioningException {

    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }
}
