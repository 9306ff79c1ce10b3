package com.purchasingpower.infragraph.model.dto;

import com.purchasingpower.infragraph.model.changeset.ChangeSetStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything a change set would do to Head if applied now.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeSetDiff {
    private String changeSetId;
    private String changeSetName;
    private ChangeSetStatus status;
    private List<RecordChange> changes;
    private DiffSummary summary;
}
