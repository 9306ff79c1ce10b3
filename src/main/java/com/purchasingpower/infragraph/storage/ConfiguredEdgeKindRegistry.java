package com.purchasingpower.infragraph.storage;

import com.google.common.collect.ImmutableSet;
import com.purchasingpower.infragraph.configuration.GraphProperties;
import com.purchasingpower.infragraph.configuration.VersioningProperties;
import com.purchasingpower.infragraph.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Edge kind registry backed by {@code infragraph.graph.*}.
 */
@Slf4j
@Component
public class ConfiguredEdgeKindRegistry implements EdgeKindRegistry {

    private final Set<String> declared;
    private final Set<String> acyclic;

    public ConfiguredEdgeKindRegistry(VersioningProperties properties) {
        GraphProperties graph = properties.getGraph();
        this.declared = ImmutableSet.copyOf(graph.getEdgeKinds());
        this.acyclic = ImmutableSet.copyOf(graph.getAcyclicEdgeKinds());
        if (!declared.containsAll(acyclic)) {
            throw new IllegalStateException("Acyclic edge kinds " + acyclic
                    + " must be a subset of declared edge kinds " + declared);
        }
        log.info("Edge kinds: declared={}, acyclic={}",
                ExternalCallLogger.formatCollection(declared), ExternalCallLogger.formatCollection(acyclic));
    }

    @Override
    public boolean isDeclared(String edgeKind) {
        return declared.contains(edgeKind);
    }

    @Override
    public boolean isAcyclic(String edgeKind) {
        return acyclic.contains(edgeKind);
    }

    @Override
    public Set<String> declaredKinds() {
        return declared;
    }
}
