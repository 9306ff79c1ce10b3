package com.purchasingpower.infragraph.service;

import com.purchasingpower.infragraph.exception.RecordNotFoundException;
import com.purchasingpower.infragraph.model.graph.StoredRecord;
import com.purchasingpower.infragraph.model.graph.TierContext;
import com.purchasingpower.infragraph.model.graph.TierKey;
import com.purchasingpower.infragraph.model.graph.VersionedRecord;
import com.purchasingpower.infragraph.storage.PayloadCodec;
import com.purchasingpower.infragraph.storage.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Tier fallback resolution. Runs inside the caller's transaction and never opens one,
 * so a miss during traversal does not mark an enclosing transaction rollback-only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TierResolver {

    private final RecordStore recordStore;
    private final PayloadCodec payloadCodec;

    /**
     * First row for the object in resolution order, deletion markers included.
     */
    public Optional<StoredRecord> findVisible(String objectId, TierContext context) {
        for (TierKey tierKey : context.resolutionOrder()) {
            Optional<StoredRecord> row = recordStore.find(objectId, tierKey);
            if (row.isPresent()) {
                log.debug("Resolved {} at {} (deleted={})", objectId, tierKey, row.get().isDeleted());
                return row;
            }
        }
        return Optional.empty();
    }

    public Optional<VersionedRecord> tryResolve(String objectId, TierContext context) {
        return findVisible(objectId, context)
                .filter(row -> !row.isDeleted())
                .map(this::toRecord);
    }

    public VersionedRecord resolve(String objectId, TierContext context) {
        return tryResolve(objectId, context)
                .orElseThrow(() -> new RecordNotFoundException("Record", objectId, describe(context)));
    }

    /**
     * Resolves every object that has a row in any visible tier of the scan, ordered by object id.
     */
    public List<VersionedRecord> resolveAll(TierContext context, Function<TierKey, List<StoredRecord>> scan) {
        SortedSet<String> objectIds = new TreeSet<>();
        for (TierKey tierKey : context.resolutionOrder()) {
            scan.apply(tierKey).forEach(row -> objectIds.add(row.getObjectId()));
        }
        return objectIds.stream()
                .map(objectId -> tryResolve(objectId, context))
                .flatMap(Optional::stream)
                .toList();
    }

    public VersionedRecord toRecord(StoredRecord row) {
        return VersionedRecord.builder()
                .objectId(row.getObjectId())
                .recordKind(row.getRecordKind())
                .kind(row.getKind())
                .tierKey(row.tierKey())
                .workspaceId(row.getWorkspaceId())
                .payload(payloadCodec.decode(row))
                .createdAt(row.getCreatedAt())
                .updatedAt(row.getUpdatedAt())
                .build();
    }

    static String describe(TierContext context) {
        return "workspace=" + context.workspaceId()
                + ", changeSet=" + context.changeSetId()
                + ", editSession=" + context.editSessionId();
    }
}
