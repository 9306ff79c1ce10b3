package com.purchasingpower.infragraph.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Summary statistics for a change set diff.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiffSummary {
    private int totalChanges;
    private int recordsAdded;
    private int recordsModified;
    private int recordsRemoved;

    // Breakdown by record kind: e.g., {"ENTITY": 2, "EDGE": 1}
    private Map<String, Integer> addedByKind;
    private Map<String, Integer> modifiedByKind;
    private Map<String, Integer> removedByKind;
}
