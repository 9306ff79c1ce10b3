package com.purchasingpower.infragraph.storage;

import com.purchasingpower.infragraph.model.graph.RecordKind;
import com.purchasingpower.infragraph.model.graph.StoredRecord;
import com.purchasingpower.infragraph.model.graph.TierKey;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary of the versioned graph: rows keyed by (object id, tier key).
 *
 * <p>Every method joins the caller's transaction; none of them starts its own.
 * Scans return deletion markers too, so callers can tell "hidden" from "absent".
 */
public interface RecordStore {

    Optional<StoredRecord> find(String objectId, TierKey tierKey);

    /**
     * Inserts or updates the row. The row's object id and tier key must not collide
     * with a different existing row.
     */
    StoredRecord put(StoredRecord row);

    List<StoredRecord> scan(TierKey tierKey);

    List<StoredRecord> scanByRecordKind(String workspaceId, TierKey tierKey, RecordKind recordKind);

    List<StoredRecord> scanByKind(String workspaceId, TierKey tierKey, String kind);

    List<StoredRecord> scanEdgesFrom(String edgeKind, String tailObjectId, TierKey tierKey);

    List<StoredRecord> scanEdgesTo(String edgeKind, String headObjectId, TierKey tierKey);

    void delete(StoredRecord row);

    /**
     * Removes every row of a tier.
     *
     * @return number of rows removed
     */
    int deleteAll(TierKey tierKey);

    long count(TierKey tierKey);
}
