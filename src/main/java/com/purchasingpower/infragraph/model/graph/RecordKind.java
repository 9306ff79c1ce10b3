package com.purchasingpower.infragraph.model.graph;

/**
 * Structural kind of a versioned record. The finer-grained kind tag
 * (application, system, ...) lives on the payload.
 */
public enum RecordKind {
    ENTITY,
    NODE,
    EDGE
}
