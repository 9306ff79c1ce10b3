package com.purchasingpower.infragraph.service;

import com.purchasingpower.infragraph.model.payload.RecordPayload;

/**
 * Change applied to a draft. Receives a private copy of the currently visible
 * payload, or {@code null} when the object does not exist yet, and returns the
 * payload to store.
 */
@FunctionalInterface
public interface RecordMutation {

    RecordPayload apply(RecordPayload current);

    static RecordMutation replaceWith(RecordPayload payload) {
        return current -> payload;
    }
}
