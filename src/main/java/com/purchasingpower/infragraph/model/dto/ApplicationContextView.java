package com.purchasingpower.infragraph.model.dto;

import com.purchasingpower.infragraph.model.changeset.ChangeSet;
import com.purchasingpower.infragraph.model.graph.VersionedRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * What an editor needs to open an application: its name, the systems it can be
 * deployed to, change sets still open, and the applied revisions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplicationContextView {
    private String applicationId;
    private String applicationName;
    private List<VersionedRecord> systems;
    private List<ChangeSet> openChangeSets;
    private List<ChangeSet> revisions;
}
