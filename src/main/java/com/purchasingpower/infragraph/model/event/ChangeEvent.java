package com.purchasingpower.infragraph.model.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.infragraph.model.graph.RecordKind;
import com.purchasingpower.infragraph.model.graph.StoredRecord;
import com.purchasingpower.infragraph.model.graph.TierKey;
import com.purchasingpower.infragraph.model.payload.RecordPayload;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.LocalDateTime;

/**
 * Notification published after a tier transaction commits.
 *
 * Example usage:
 * <pre>
 * ChangeEvent event = ChangeEvent.written(savedRow);
 * ChangeEvent applied = ChangeEvent.lifecycle(ChangeEventType.CHANGE_SET_APPLIED, "ws-1",
 *         changeSetId, TierKey.changeSet(changeSetId));
 * </pre>
 *
 * A record event captures the row's JSON when it is written; each subscriber receives
 * its own payload decoded from that snapshot.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChangeEvent {

    ChangeEventType eventType;

    String workspaceId;

    /**
     * Kind of the record, or null for lifecycle events.
     */
    RecordKind recordKind;

    /**
     * Record id for record events, change set or edit session id for lifecycle events.
     */
    String objectId;

    /**
     * Tier the change landed in.
     */
    TierKey tierKey;

    /**
     * JSON of the written row, taken at write time; null for deletions and lifecycle events.
     */
    @JsonIgnore
    String payloadJson;

    /**
     * New payload, decoded from {@link #payloadJson} for one subscriber.
     */
    @With
    RecordPayload payload;

    boolean deleted;

    @Builder.Default
    LocalDateTime occurredAt = LocalDateTime.now();

    // ================================================================
    // Builder Helpers
    // ================================================================

    public static ChangeEvent written(StoredRecord row) {
        return ChangeEvent.builder()
                .eventType(ChangeEventType.RECORD_WRITTEN)
                .workspaceId(row.getWorkspaceId())
                .recordKind(row.getRecordKind())
                .objectId(row.getObjectId())
                .tierKey(row.tierKey())
                .payloadJson(row.getPayloadJson())
                .build();
    }

    public static ChangeEvent deleted(String workspaceId, RecordKind recordKind, String objectId, TierKey tierKey) {
        return ChangeEvent.builder()
                .eventType(ChangeEventType.RECORD_DELETED)
                .workspaceId(workspaceId)
                .recordKind(recordKind)
                .objectId(objectId)
                .tierKey(tierKey)
                .deleted(true)
                .build();
    }

    public static ChangeEvent lifecycle(ChangeEventType type, String workspaceId, String id, TierKey tierKey) {
        return ChangeEvent.builder()
                .eventType(type)
                .workspaceId(workspaceId)
                .objectId(id)
                .tierKey(tierKey)
                .build();
    }
}
