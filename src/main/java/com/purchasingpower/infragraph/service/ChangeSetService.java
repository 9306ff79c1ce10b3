package com.purchasingpower.infragraph.service;

import com.purchasingpower.infragraph.model.changeset.ChangeSet;

import java.util.List;

/**
 * Lifecycle of change sets: create, apply into Head, abandon.
 */
public interface ChangeSetService {

    /**
     * Create an OPEN change set. A blank name is replaced by a generated one.
     */
    ChangeSet create(String workspaceId, String name);

    ChangeSet get(String changeSetId);

    List<ChangeSet> listOpen(String workspaceId);

    /**
     * Applied change sets of a workspace, newest first.
     */
    List<ChangeSet> listApplied(String workspaceId);

    /**
     * Promote every change set row into Head, cancel the change set's open edit
     * sessions and mark it APPLIED, all in one transaction.
     *
     * @throws com.purchasingpower.infragraph.exception.InvalidStateException if not OPEN
     * @throws com.purchasingpower.infragraph.exception.ConflictException if a concurrent
     *         transaction closed the change set first
     */
    ChangeSet apply(String changeSetId);

    /**
     * Discard the change set's rows and open edit sessions, leaving Head untouched.
     */
    ChangeSet abandon(String changeSetId);
}
