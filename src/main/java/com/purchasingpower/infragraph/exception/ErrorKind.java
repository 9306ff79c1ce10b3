package com.purchasingpower.infragraph.exception;

/**
 * Coarse category of a versioning failure, for callers that map errors to responses.
 */
public enum ErrorKind {
    NOT_FOUND,
    INVALID_STATE,
    CONFLICT,
    PERSISTENCE,
    SERIALIZATION,
    VALIDATION
}
