package com.purchasingpower.infragraph.exception;

import lombok.Getter;

import java.util.List;

/**
 * A payload failed validation before it was written.
 */
@Getter
public class InvalidPayloadException extends GraphVersioningException {

    private final List<String> violations;

    public InvalidPayloadException(String message) {
        super(ErrorKind.VALIDATION, message);
        this.violations = List.of(message);
    }

    public InvalidPayloadException(String subject, List<String> violations) {
        super(ErrorKind.VALIDATION, "Invalid payload for " + subject + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
