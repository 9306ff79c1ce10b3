package com.purchasingpower.infragraph.storage;

import com.purchasingpower.infragraph.model.graph.RecordKind;
import com.purchasingpower.infragraph.model.graph.StoredRecord;
import com.purchasingpower.infragraph.model.graph.TierKey;
import com.purchasingpower.infragraph.repository.StoredRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaRecordStore implements RecordStore {

    private final StoredRecordRepository repository;

    @Override
    public Optional<StoredRecord> find(String objectId, TierKey tierKey) {
        return repository.findByObjectIdAndTierAndTierId(objectId, tierKey.tier(), tierKey.tierId());
    }

    @Override
    public StoredRecord put(StoredRecord row) {
        StoredRecord saved = repository.save(row);
        log.debug("Stored {} at {} (deleted={})", saved.getObjectId(), saved.tierKey(), saved.isDeleted());
        return saved;
    }

    @Override
    public List<StoredRecord> scan(TierKey tierKey) {
        return repository.findByTierAndTierIdOrderByObjectIdAsc(tierKey.tier(), tierKey.tierId());
    }

    @Override
    public List<StoredRecord> scanByRecordKind(String workspaceId, TierKey tierKey, RecordKind recordKind) {
        return repository.findByWorkspaceIdAndTierAndTierIdAndRecordKindOrderByObjectIdAsc(
                workspaceId, tierKey.tier(), tierKey.tierId(), recordKind);
    }

    @Override
    public List<StoredRecord> scanByKind(String workspaceId, TierKey tierKey, String kind) {
        return repository.findByWorkspaceIdAndTierAndTierIdAndKindOrderByObjectIdAsc(
                workspaceId, tierKey.tier(), tierKey.tierId(), kind);
    }

    @Override
    public List<StoredRecord> scanEdgesFrom(String edgeKind, String tailObjectId, TierKey tierKey) {
        return repository.findByEdgeKindAndTailObjectIdAndTierAndTierIdOrderByObjectIdAsc(
                edgeKind, tailObjectId, tierKey.tier(), tierKey.tierId());
    }

    @Override
    public List<StoredRecord> scanEdgesTo(String edgeKind, String headObjectId, TierKey tierKey) {
        return repository.findByEdgeKindAndHeadObjectIdAndTierAndTierIdOrderByObjectIdAsc(
                edgeKind, headObjectId, tierKey.tier(), tierKey.tierId());
    }

    @Override
    public void delete(StoredRecord row) {
        repository.delete(row);
        // Hibernate flushes inserts before deletes; re-inserting this key later in the transaction needs the delete applied first.
        repository.flush();
        log.debug("Removed {} at {}", row.getObjectId(), row.tierKey());
    }

    @Override
    public int deleteAll(TierKey tierKey) {
        int removed = repository.deleteTier(tierKey.tier(), tierKey.tierId());
        log.debug("Removed {} rows at {}", removed, tierKey);
        return removed;
    }

    @Override
    public long count(TierKey tierKey) {
        return repository.countByTierAndTierId(tierKey.tier(), tierKey.tierId());
    }
}
