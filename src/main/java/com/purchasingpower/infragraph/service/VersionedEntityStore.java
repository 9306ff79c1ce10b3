package com.purchasingpower.infragraph.service;

import com.purchasingpower.infragraph.model.graph.RecordKind;
import com.purchasingpower.infragraph.model.graph.TierContext;
import com.purchasingpower.infragraph.model.graph.VersionedRecord;
import com.purchasingpower.infragraph.model.payload.RecordPayload;

import java.util.List;
import java.util.Optional;

/**
 * Stores and resolves entities, nodes and edges across the Head, change set and
 * edit session tiers.
 *
 * <p>Reads fall back from the edit session to the change set to Head and return the
 * first row found. Writes always land in the context's edit session, which must be
 * open; the change set and Head tiers only change through promotion.
 */
public interface VersionedEntityStore {

    /**
     * Resolve an object in the given context.
     *
     * @throws com.purchasingpower.infragraph.exception.RecordNotFoundException if no tier holds
     *         a live row, or the highest-priority row is a deletion marker
     */
    VersionedRecord resolve(String objectId, TierContext context);

    /**
     * Like {@link #resolve} but absence is an empty result instead of a failure.
     */
    Optional<VersionedRecord> find(String objectId, TierContext context);

    /**
     * Copy-on-write update of an object inside the context's edit session. The first write
     * clones the best visible ancestor into a draft; later writes mutate that draft.
     *
     * @param mutation receives a private copy of the visible payload ({@code null} when absent)
     */
    VersionedRecord write(String objectId, TierContext context, RecordMutation mutation);

    /**
     * Write a new object under a generated id of the form {@code <record-kind>:<uuid>}.
     */
    VersionedRecord create(RecordPayload payload, TierContext context);

    /**
     * Hide the object from this context onward by writing a deletion marker into the
     * edit session. An object that only exists as a draft of this session is removed outright.
     */
    void delete(String objectId, TierContext context);

    /**
     * Create an edge of the given kind between two objects visible in the context.
     */
    VersionedRecord connect(String edgeKind, String tailObjectId, String headObjectId, TierContext context);

    /**
     * Every live record of a structural kind visible in the context's workspace, by object id.
     */
    List<VersionedRecord> list(RecordKind recordKind, TierContext context);

    /**
     * Every live record with the given kind tag (e.g. "application"), by object id.
     */
    List<VersionedRecord> listByKind(String kind, TierContext context);
}
