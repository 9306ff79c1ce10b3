package com.purchasingpower.infragraph.model.graph;

/**
 * The layer a stored row belongs to.
 *
 * <p>Resolution priority runs from the most specific layer to the baseline:
 * <pre>
 * EDIT_SESSION → CHANGE_SET → HEAD
 * </pre>
 * Promotion only ever moves rows in the same direction.
 */
public enum Tier {

    /**
     * Canonical, merged baseline graph.
     */
    HEAD,

    /**
     * Saved but not yet applied edits of one change set.
     */
    CHANGE_SET,

    /**
     * In-progress drafts of one edit session.
     */
    EDIT_SESSION
}
