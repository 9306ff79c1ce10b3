package com.purchasingpower.infragraph.exception;

/**
 * The backing store failed for a reason other than a detected conflict.
 */
public class StorePersistenceException extends GraphVersioningException {

    public StorePersistenceException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE, message, cause);
    }
}
