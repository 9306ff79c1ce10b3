package com.purchasingpower.infragraph.storage;

import java.util.Set;

/**
 * Declares which edge kinds may be written and which of them are meant to be acyclic.
 * The store only enforces the former.
 */
public interface EdgeKindRegistry {

    boolean isDeclared(String edgeKind);

    boolean isAcyclic(String edgeKind);

    Set<String> declaredKinds();
}
