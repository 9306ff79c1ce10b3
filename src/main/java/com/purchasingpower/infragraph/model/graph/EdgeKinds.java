package com.purchasingpower.infragraph.model.graph;

/**
 * Edge kind tags used by the application workflows. Other kinds are declared
 * through configuration and treated as opaque.
 */
public final class EdgeKinds {

    public static final String INCLUDES = "Includes";

    private EdgeKinds() {
    }
}
