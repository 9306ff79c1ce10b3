package com.purchasingpower.infragraph.exception;

import lombok.Getter;

/**
 * Base class of every failure raised by the versioned graph.
 * Rolls back the enclosing tier transaction when thrown out of it.
 */
@Getter
public abstract class GraphVersioningException extends RuntimeException {

    private final ErrorKind kind;

    protected GraphVersioningException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected GraphVersioningException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
