package com.purchasingpower.infragraph.exception;

import lombok.Getter;

/**
 * A stored payload could not be encoded or decoded.
 */
@Getter
public class PayloadSerializationException extends GraphVersioningException {

    private final String objectId;

    public PayloadSerializationException(String objectId, String message) {
        super(ErrorKind.SERIALIZATION, "Payload of " + objectId + ": " + message);
        this.objectId = objectId;
    }

    public PayloadSerializationException(String objectId, String message, Throwable cause) {
        super(ErrorKind.SERIALIZATION, "Payload of " + objectId + ": " + message, cause);
        this.objectId = objectId;
    }
}
