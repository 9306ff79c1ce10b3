package com.purchasingpower.infragraph.service.graph;

import com.purchasingpower.infragraph.model.graph.TierContext;
import com.purchasingpower.infragraph.model.graph.VersionedRecord;

import java.util.List;

/**
 * One-hop, tier-aware queries over edge records. Callers recurse explicitly.
 *
 * <p>Every query is best-effort: an edge whose far end does not resolve in the
 * context (deleted in a draft, or never promoted) is left out instead of failing
 * the call.
 */
public interface GraphTraversalService {

    /**
     * Edges of the given kind leaving an object.
     *
     * @param edgeKind Edge kind tag (e.g., "Includes")
     * @param objectId Tail object id
     * @param context Tier context edges and their heads are resolved in
     * @return Edges ordered by edge object id
     */
    List<VersionedRecord> successors(String edgeKind, String objectId, TierContext context);

    /**
     * Head records of {@link #successors}, in the same order.
     */
    List<VersionedRecord> successorEntities(String edgeKind, String objectId, TierContext context);

    /**
     * Edges of the given kind arriving at an object; edges whose tail does not resolve are left out.
     */
    List<VersionedRecord> predecessors(String edgeKind, String objectId, TierContext context);
}
