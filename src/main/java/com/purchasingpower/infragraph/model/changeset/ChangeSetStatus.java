package com.purchasingpower.infragraph.model.changeset;

/**
 * Lifecycle of a change set.
 *
 * <pre>
 * OPEN → APPLIED
 *   ↓
 * ABANDONED
 * </pre>
 */
public enum ChangeSetStatus {

    /**
     * Accepting edit sessions and saves.
     */
    OPEN,

    /**
     * Promoted into Head. Terminal.
     */
    APPLIED,

    /**
     * Discarded without touching Head. Terminal.
     */
    ABANDONED;

    public boolean isTerminal() {
        return this != OPEN;
    }
}
