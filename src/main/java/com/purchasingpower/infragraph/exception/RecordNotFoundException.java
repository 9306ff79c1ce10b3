package com.purchasingpower.infragraph.exception;

import lombok.Getter;

/**
 * No visible record, change set or edit session with the given id.
 */
@Getter
public class RecordNotFoundException extends GraphVersioningException {

    private final String subject;
    private final String id;

    public RecordNotFoundException(String subject, String id) {
        super(ErrorKind.NOT_FOUND, subject + " not found: " + id);
        this.subject = subject;
        this.id = id;
    }

    public RecordNotFoundException(String subject, String id, String context) {
        super(ErrorKind.NOT_FOUND, subject + " not found: " + id + " (" + context + ")");
        this.subject = subject;
        this.id = id;
    }
}
