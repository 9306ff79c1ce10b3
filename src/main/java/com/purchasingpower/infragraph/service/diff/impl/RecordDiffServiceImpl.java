package com.purchasingpower.infragraph.service.diff.impl;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.Sets;
import com.purchasingpower.infragraph.exception.InvalidStateException;
import com.purchasingpower.infragraph.exception.RecordNotFoundException;
import com.purchasingpower.infragraph.model.changeset.ChangeSet;
import com.purchasingpower.infragraph.model.dto.ChangeSetDiff;
import com.purchasingpower.infragraph.model.dto.DiffSummary;
import com.purchasingpower.infragraph.model.dto.RecordChange;
import com.purchasingpower.infragraph.model.dto.RecordChange.ChangeType;
import com.purchasingpower.infragraph.model.dto.RecordChange.PropertyDiff;
import com.purchasingpower.infragraph.model.graph.StoredRecord;
import com.purchasingpower.infragraph.model.graph.TierContext;
import com.purchasingpower.infragraph.model.graph.TierKey;
import com.purchasingpower.infragraph.model.payload.RecordPayload;
import com.purchasingpower.infragraph.repository.ChangeSetRepository;
import com.purchasingpower.infragraph.service.TierResolver;
import com.purchasingpower.infragraph.service.TierTransactions;
import com.purchasingpower.infragraph.service.diff.RecordDiffService;
import com.purchasingpower.infragraph.storage.PayloadCodec;
import com.purchasingpower.infragraph.storage.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecordDiffServiceImpl implements RecordDiffService {

    private final TierTransactions transactions;
    private final TierResolver resolver;
    private final RecordStore recordStore;
    private final PayloadCodec payloadCodec;
    private final ChangeSetRepository changeSetRepository;

    @Override
    public RecordChange diffAgainstHead(String objectId, TierContext context) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(objectId), "objectId is required");
        Preconditions.checkNotNull(context, "context is required");
        if (context.isHead()) {
            throw new InvalidStateException("Nothing to compare: context is Head");
        }

        return transactions.read("diffAgainstHead", () -> {
            StoredRecord visible = resolver.findVisible(objectId, context)
                    .orElseThrow(() -> new RecordNotFoundException("Record", objectId));
            Optional<StoredRecord> head = recordStore.find(objectId, TierKey.HEAD);
            return compare(visible, head.orElse(null))
                    .orElseThrow(() -> new RecordNotFoundException("Record", objectId));
        });
    }

    @Override
    public ChangeSetDiff diffChangeSet(String changeSetId) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(changeSetId), "changeSetId is required");

        return transactions.read("diffChangeSet", () -> {
            ChangeSet changeSet = changeSetRepository.findById(changeSetId)
                    .orElseThrow(() -> new RecordNotFoundException("ChangeSet", changeSetId));

            List<RecordChange> changes = new ArrayList<>();
            for (StoredRecord row : recordStore.scan(TierKey.changeSet(changeSetId))) {
                compare(row, recordStore.find(row.getObjectId(), TierKey.HEAD).orElse(null))
                        .filter(change -> change.getChangeType() != ChangeType.UNCHANGED)
                        .ifPresent(changes::add);
            }

            DiffSummary summary = summarize(changes);
            log.debug("Change set {} diff: {} added, {} modified, {} removed", changeSetId,
                    summary.getRecordsAdded(), summary.getRecordsModified(), summary.getRecordsRemoved());
            return ChangeSetDiff.builder()
                    .changeSetId(changeSetId)
                    .changeSetName(changeSet.getName())
                    .status(changeSet.getStatus())
                    .changes(changes)
                    .summary(summary)
                    .build();
        });
    }

    /**
     * @return empty when the row is a deletion marker for something Head does not have either
     */
    private Optional<RecordChange> compare(StoredRecord current, StoredRecord head) {
        RecordChange.RecordChangeBuilder change = RecordChange.builder()
                .objectId(current.getObjectId())
                .recordKind(current.getRecordKind())
                .kind(current.getKind())
                .sourceTier(current.tierKey());

        if (current.isDeleted()) {
            if (head == null) {
                return Optional.empty();
            }
            return Optional.of(change.changeType(ChangeType.REMOVED)
                    .headPayload(payloadCodec.decode(head))
                    .build());
        }

        RecordPayload currentPayload = payloadCodec.decode(current);
        if (head == null) {
            return Optional.of(change.changeType(ChangeType.ADDED)
                    .currentPayload(currentPayload)
                    .build());
        }
        if (current.tierKey().isHead()) {
            return Optional.of(change.changeType(ChangeType.UNCHANGED)
                    .headPayload(currentPayload)
                    .currentPayload(currentPayload)
                    .build());
        }

        RecordPayload headPayload = payloadCodec.decode(head);
        List<PropertyDiff> diffs = diffProperties(payloadCodec.toProperties(headPayload),
                payloadCodec.toProperties(currentPayload));
        return Optional.of(change.changeType(diffs.isEmpty() ? ChangeType.UNCHANGED : ChangeType.MODIFIED)
                .propertyDiffs(diffs)
                .headPayload(headPayload)
                .currentPayload(currentPayload)
                .build());
    }

    private static List<PropertyDiff> diffProperties(Map<String, Object> before, Map<String, Object> after) {
        List<PropertyDiff> diffs = new ArrayList<>();
        for (String property : new TreeSet<>(Sets.union(before.keySet(), after.keySet()))) {
            Object oldValue = before.get(property);
            Object newValue = after.get(property);
            if (!Objects.equals(oldValue, newValue)) {
                diffs.add(PropertyDiff.builder()
                        .property(property)
                        .oldValue(oldValue)
                        .newValue(newValue)
                        .build());
            }
        }
        return diffs;
    }

    private static DiffSummary summarize(List<RecordChange> changes) {
        Map<String, Integer> added = new TreeMap<>();
        Map<String, Integer> modified = new TreeMap<>();
        Map<String, Integer> removed = new TreeMap<>();
        for (RecordChange change : changes) {
            Map<String, Integer> bucket = switch (change.getChangeType()) {
                case ADDED -> added;
                case MODIFIED -> modified;
                case REMOVED -> removed;
                case UNCHANGED -> null;
            };
            if (bucket != null) {
                bucket.merge(change.getRecordKind().name(), 1, Integer::sum);
            }
        }
        int addedCount = added.values().stream().mapToInt(Integer::intValue).sum();
        int modifiedCount = modified.values().stream().mapToInt(Integer::intValue).sum();
        int removedCount = removed.values().stream().mapToInt(Integer::intValue).sum();
        return DiffSummary.builder()
                .totalChanges(addedCount + modifiedCount + removedCount)
                .recordsAdded(addedCount)
                .recordsModified(modifiedCount)
                .recordsRemoved(removedCount)
                .addedByKind(added)
                .modifiedByKind(modified)
                .removedByKind(removed)
                .build();
    }
}
