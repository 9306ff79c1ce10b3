package com.purchasingpower.infragraph.model.graph;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * Explicit read/write context threaded through every store call.
 *
 * <p>A context names the workspace and, optionally, the change set and edit
 * session whose rows take priority over Head. An edit session is always nested
 * in a change set, so an edit session id without a change set id is rejected.
 */
public record TierContext(String workspaceId, String changeSetId, String editSessionId) {

    public TierContext {
        Preconditions.checkArgument(workspaceId != null && !workspaceId.isBlank(), "workspaceId is required");
        Preconditions.checkArgument(editSessionId == null || changeSetId != null,
                "editSessionId %s given without a changeSetId", editSessionId);
    }

    public static TierContext head(String workspaceId) {
        return new TierContext(workspaceId, null, null);
    }

    public static TierContext changeSet(String workspaceId, String changeSetId) {
        Preconditions.checkNotNull(changeSetId, "changeSetId is required");
        return new TierContext(workspaceId, changeSetId, null);
    }

    public static TierContext editSession(String workspaceId, String changeSetId, String editSessionId) {
        Preconditions.checkNotNull(editSessionId, "editSessionId is required");
        return new TierContext(workspaceId, changeSetId, editSessionId);
    }

    public boolean isHead() {
        return changeSetId == null;
    }

    public boolean hasEditSession() {
        return editSessionId != null;
    }

    /**
     * Same context with the edit session layer removed: the ancestor chain a
     * copy-on-write draft starts from.
     */
    public TierContext withoutEditSession() {
        return new TierContext(workspaceId, changeSetId, null);
    }

    /**
     * Tiers visible in this context, highest priority first.
     */
    public List<TierKey> resolutionOrder() {
        List<TierKey> order = new ArrayList<>(3);
        if (editSessionId != null) {
            order.add(TierKey.editSession(editSessionId));
        }
        if (changeSetId != null) {
            order.add(TierKey.changeSet(changeSetId));
        }
        order.add(TierKey.HEAD);
        return order;
    }
}
