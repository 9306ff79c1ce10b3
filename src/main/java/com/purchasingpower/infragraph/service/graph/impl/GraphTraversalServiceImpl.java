package com.purchasingpower.infragraph.service.graph.impl;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.purchasingpower.infragraph.model.graph.StoredRecord;
import com.purchasingpower.infragraph.model.graph.TierContext;
import com.purchasingpower.infragraph.model.graph.TierKey;
import com.purchasingpower.infragraph.model.graph.VersionedRecord;
import com.purchasingpower.infragraph.model.payload.EdgePayload;
import com.purchasingpower.infragraph.model.payload.Vertex;
import com.purchasingpower.infragraph.service.TierResolver;
import com.purchasingpower.infragraph.service.TierTransactions;
import com.purchasingpower.infragraph.service.graph.GraphTraversalService;
import com.purchasingpower.infragraph.storage.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.BiFunction;
import java.util.function.Function;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphTraversalServiceImpl implements GraphTraversalService {

    private final TierTransactions transactions;
    private final TierResolver resolver;
    private final RecordStore recordStore;

    @Override
    public List<VersionedRecord> successors(String edgeKind, String objectId, TierContext context) {
        checkArguments(edgeKind, objectId, context);
        return transactions.read("successors", () -> hops(edgeKind, objectId, context, Direction.OUTGOING)
                .stream()
                .map(Hop::edge)
                .toList());
    }

    @Override
    public List<VersionedRecord> successorEntities(String edgeKind, String objectId, TierContext context) {
        checkArguments(edgeKind, objectId, context);
        return transactions.read("successorEntities", () -> hops(edgeKind, objectId, context, Direction.OUTGOING)
                .stream()
                .map(Hop::neighbor)
                .toList());
    }

    @Override
    public List<VersionedRecord> predecessors(String edgeKind, String objectId, TierContext context) {
        checkArguments(edgeKind, objectId, context);
        return transactions.read("predecessors", () -> hops(edgeKind, objectId, context, Direction.INCOMING)
                .stream()
                .map(Hop::edge)
                .toList());
    }

    private List<Hop> hops(String edgeKind, String objectId, TierContext context, Direction direction) {
        // Candidates from every visible tier; a draft may add, move or hide an edge.
        SortedSet<String> candidateIds = new TreeSet<>();
        for (TierKey tierKey : context.resolutionOrder()) {
            direction.scan.apply(recordStore, new ScanKey(edgeKind, objectId, tierKey))
                    .forEach(row -> candidateIds.add(row.getObjectId()));
        }

        List<Hop> hops = new ArrayList<>();
        for (String edgeId : candidateIds) {
            Optional<VersionedRecord> edge = resolver.tryResolve(edgeId, context);
            if (edge.isEmpty() || !edge.get().isEdge()) {
                continue;
            }
            EdgePayload payload = edge.get().edge();
            if (!edgeKind.equals(payload.getEdgeKind())
                    || !objectId.equals(direction.near.apply(payload).objectId())) {
                continue;
            }

            String neighborId = direction.far.apply(payload).objectId();
            Optional<VersionedRecord> neighbor = resolver.tryResolve(neighborId, context);
            if (neighbor.isEmpty()) {
                log.debug("Dropping {} edge {}: {} does not resolve in {}", edgeKind, edgeId, neighborId,
                        context.resolutionOrder());
                continue;
            }
            hops.add(new Hop(edge.get(), neighbor.get()));
        }
        log.debug("{} {} of {}: {} of {} candidates", edgeKind, direction, objectId, hops.size(), candidateIds.size());
        return hops;
    }

    private static void checkArguments(String edgeKind, String objectId, TierContext context) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(edgeKind), "edgeKind is required");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(objectId), "objectId is required");
        Preconditions.checkNotNull(context, "context is required");
    }

    private record Hop(VersionedRecord edge, VersionedRecord neighbor) {}

    private record ScanKey(String edgeKind, String objectId, TierKey tierKey) {}

    private enum Direction {
        OUTGOING((store, key) -> store.scanEdgesFrom(key.edgeKind(), key.objectId(), key.tierKey()),
                EdgePayload::getTailVertex, EdgePayload::getHeadVertex),
        INCOMING((store, key) -> store.scanEdgesTo(key.edgeKind(), key.objectId(), key.tierKey()),
                EdgePayload::getHeadVertex, EdgePayload::getTailVertex);

        private final BiFunction<RecordStore, ScanKey, List<StoredRecord>> scan;
        private final Function<EdgePayload, Vertex> near;
        private final Function<EdgePayload, Vertex> far;

        Direction(BiFunction<RecordStore, ScanKey, List<StoredRecord>> scan,
                  Function<EdgePayload, Vertex> near,
                  Function<EdgePayload, Vertex> far) {
            this.scan = scan;
            this.near = near;
            this.far = far;
        }
    }
}
