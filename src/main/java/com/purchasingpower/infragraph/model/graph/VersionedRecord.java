package com.purchasingpower.infragraph.model.graph;

import com.purchasingpower.infragraph.exception.PayloadSerializationException;
import com.purchasingpower.infragraph.model.payload.EdgePayload;
import com.purchasingpower.infragraph.model.payload.RecordPayload;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A resolved Entity, Node or Edge as seen from one tier context.
 *
 * <p>{@link #getTierKey()} tells which tier the visible row came from. The payload
 * is a freshly decoded copy; changing it touches neither storage nor change events.
 */
@Value
@Builder
public class VersionedRecord {

    String objectId;

    RecordKind recordKind;

    String kind;

    TierKey tierKey;

    String workspaceId;

    RecordPayload payload;

    LocalDateTime createdAt;

    LocalDateTime updatedAt;

    public <P extends RecordPayload> P payloadAs(Class<P> type) {
        if (!type.isInstance(payload)) {
            throw new PayloadSerializationException(objectId,
                    "payload is " + kind + ", not " + type.getSimpleName());
        }
        return type.cast(payload);
    }

    public boolean isEdge() {
        return recordKind == RecordKind.EDGE;
    }

    public EdgePayload edge() {
        return payloadAs(EdgePayload.class);
    }
}
