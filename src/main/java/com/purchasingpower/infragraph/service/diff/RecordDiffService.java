package com.purchasingpower.infragraph.service.diff;

import com.purchasingpower.infragraph.model.dto.ChangeSetDiff;
import com.purchasingpower.infragraph.model.dto.RecordChange;
import com.purchasingpower.infragraph.model.graph.TierContext;

/**
 * Compares what a change set or edit session sees against Head.
 */
public interface RecordDiffService {

    /**
     * @throws com.purchasingpower.infragraph.exception.InvalidStateException for a Head context
     * @throws com.purchasingpower.infragraph.exception.RecordNotFoundException if neither side has the object
     */
    RecordChange diffAgainstHead(String objectId, TierContext context);

    /**
     * One change per row held in the change set tier, plus totals.
     */
    ChangeSetDiff diffChangeSet(String changeSetId);
}
