package com.purchasingpower.infragraph.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.infragraph.model.graph.RecordKind;
import com.purchasingpower.infragraph.model.graph.TierKey;
import com.purchasingpower.infragraph.model.payload.RecordPayload;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * How one record seen from a change set or edit session differs from Head.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecordChange {

    public enum ChangeType {
        ADDED,
        MODIFIED,
        REMOVED,
        UNCHANGED
    }

    private ChangeType changeType;
    private String objectId;
    private RecordKind recordKind;
    private String kind;            // application, system, node, edge, ...

    /**
     * Tier the compared (non-Head) row came from.
     */
    private TierKey sourceTier;

    // For MODIFIED records: what changed
    @Builder.Default
    private List<PropertyDiff> propertyDiffs = new ArrayList<>();

    // Snapshots
    private RecordPayload headPayload;
    private RecordPayload currentPayload;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PropertyDiff {
        private String property;
        private Object oldValue;
        private Object newValue;
    }
}
