package com.purchasingpower.infragraph.model.changeset;

/**
 * Lifecycle of an edit session.
 *
 * <pre>
 * OPEN → SAVED
 *   ↓
 * CANCELED
 * </pre>
 */
public enum EditSessionStatus {

    /**
     * Drafts may be written.
     */
    OPEN,

    /**
     * Drafts promoted into the change set. Terminal.
     */
    SAVED,

    /**
     * Drafts discarded. Terminal.
     */
    CANCELED;

    public boolean isTerminal() {
        return this != OPEN;
    }
}
