package com.purchasingpower.infragraph.service;

import com.purchasingpower.infragraph.model.changeset.EditSession;

import java.util.List;

/**
 * Lifecycle of edit sessions: open under a change set, save drafts into it, or cancel.
 */
public interface EditSessionService {

    EditSession create(String changeSetId, String workspaceId);

    EditSession get(String editSessionId);

    List<EditSession> listOpen(String changeSetId);

    /**
     * Copy every draft over the change set tier, drop the drafts and mark the session SAVED.
     */
    EditSession save(String editSessionId);

    /**
     * Drop every draft and mark the session CANCELED. The change set tier is not touched.
     */
    EditSession cancel(String editSessionId);
}
