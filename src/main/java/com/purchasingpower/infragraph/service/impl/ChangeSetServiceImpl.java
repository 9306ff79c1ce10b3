package com.purchasingpower.infragraph.service.impl;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.purchasingpower.infragraph.configuration.VersioningProperties;
import com.purchasingpower.infragraph.exception.ConflictException;
import com.purchasingpower.infragraph.exception.InvalidStateException;
import com.purchasingpower.infragraph.exception.RecordNotFoundException;
import com.purchasingpower.infragraph.model.changeset.ChangeSet;
import com.purchasingpower.infragraph.model.changeset.ChangeSetStatus;
import com.purchasingpower.infragraph.model.changeset.EditSession;
import com.purchasingpower.infragraph.model.event.ChangeEvent;
import com.purchasingpower.infragraph.model.event.ChangeEventType;
import com.purchasingpower.infragraph.model.graph.StoredRecord;
import com.purchasingpower.infragraph.model.graph.TierKey;
import com.purchasingpower.infragraph.repository.ChangeSetRepository;
import com.purchasingpower.infragraph.service.ChangeNotifier;
import com.purchasingpower.infragraph.service.ChangeSetService;
import com.purchasingpower.infragraph.service.EditSessionService;
import com.purchasingpower.infragraph.service.TierTransactions;
import com.purchasingpower.infragraph.storage.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeSetServiceImpl implements ChangeSetService {

    private static final DateTimeFormatter NAME_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final TierTransactions transactions;
    private final ChangeSetRepository changeSetRepository;
    private final EditSessionService editSessionService;
    private final RecordStore recordStore;
    private final ChangeNotifier changeNotifier;
    private final VersioningProperties properties;

    @Override
    public ChangeSet create(String workspaceId, String name) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(workspaceId), "workspaceId is required");
        String resolvedName = Strings.isNullOrEmpty(name) || name.isBlank()
                ? properties.getChangeSets().getDefaultNamePrefix() + "-" + LocalDateTime.now().format(NAME_TIMESTAMP)
                : name.trim();

        return transactions.write("createChangeSet", () -> {
            ChangeSet changeSet = changeSetRepository.save(ChangeSet.builder()
                    .id(UUID.randomUUID().toString())
                    .name(resolvedName)
                    .workspaceId(workspaceId)
                    .status(ChangeSetStatus.OPEN)
                    .build());

            changeNotifier.publish(ChangeEvent.lifecycle(ChangeEventType.CHANGE_SET_CREATED,
                    workspaceId, changeSet.getId(), TierKey.changeSet(changeSet.getId())));
            log.info("🌿 Created change set '{}' ({}) in workspace {}", resolvedName, changeSet.getId(), workspaceId);
            return changeSet;
        });
    }

    @Override
    public ChangeSet get(String changeSetId) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(changeSetId), "changeSetId is required");
        return transactions.read("getChangeSet", () -> load(changeSetId));
    }

    @Override
    public List<ChangeSet> listOpen(String workspaceId) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(workspaceId), "workspaceId is required");
        return transactions.read("listOpenChangeSets", () ->
                changeSetRepository.findByWorkspaceIdAndStatusOrderByCreatedAtAsc(workspaceId, ChangeSetStatus.OPEN));
    }

    @Override
    public List<ChangeSet> listApplied(String workspaceId) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(workspaceId), "workspaceId is required");
        return transactions.read("listAppliedChangeSets", () ->
                changeSetRepository.findByWorkspaceIdAndStatusOrderByClosedAtDesc(workspaceId, ChangeSetStatus.APPLIED));
    }

    @Override
    public ChangeSet apply(String changeSetId) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(changeSetId), "changeSetId is required");

        return transactions.write("applyChangeSet", () -> {
            ChangeSet changeSet = load(changeSetId);
            transition(changeSet, ChangeSetStatus.APPLIED);

            TierKey changeSetKey = TierKey.changeSet(changeSetId);
            List<StoredRecord> rows = recordStore.scan(changeSetKey);
            int written = 0;
            int deleted = 0;
            for (StoredRecord row : rows) {
                if (promoteToHead(row)) {
                    written++;
                } else {
                    deleted++;
                }
            }
            recordStore.deleteAll(changeSetKey);
            int canceled = cancelOpenSessions(changeSetId);

            changeNotifier.publish(ChangeEvent.lifecycle(ChangeEventType.CHANGE_SET_APPLIED,
                    changeSet.getWorkspaceId(), changeSetId, TierKey.HEAD));
            log.info("✅ Applied change set {}: {} rows written to Head, {} removed, {} open sessions canceled",
                    changeSetId, written, deleted, canceled);
            return load(changeSetId);
        });
    }

    @Override
    public ChangeSet abandon(String changeSetId) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(changeSetId), "changeSetId is required");

        return transactions.write("abandonChangeSet", () -> {
            ChangeSet changeSet = load(changeSetId);
            transition(changeSet, ChangeSetStatus.ABANDONED);

            int discarded = recordStore.deleteAll(TierKey.changeSet(changeSetId));
            int canceled = cancelOpenSessions(changeSetId);

            changeNotifier.publish(ChangeEvent.lifecycle(ChangeEventType.CHANGE_SET_ABANDONED,
                    changeSet.getWorkspaceId(), changeSetId, TierKey.changeSet(changeSetId)));
            log.info("🗑️ Abandoned change set {}: {} rows discarded, {} open sessions canceled",
                    changeSetId, discarded, canceled);
            return load(changeSetId);
        });
    }

    /**
     * Overwrite the Head row with a change set row, or remove it for a deletion marker.
     *
     * @return true if a Head row was written
     */
    private boolean promoteToHead(StoredRecord row) {
        Optional<StoredRecord> headRow = recordStore.find(row.getObjectId(), TierKey.HEAD);

        if (row.isDeleted()) {
            headRow.ifPresent(recordStore::delete);
            changeNotifier.publish(ChangeEvent.deleted(row.getWorkspaceId(), row.getRecordKind(),
                    row.getObjectId(), TierKey.HEAD));
            return false;
        }

        StoredRecord target = headRow.orElseGet(
                () -> StoredRecord.newRow(row.getObjectId(), TierKey.HEAD, row.getWorkspaceId()));
        target.copyContentFrom(row);
        StoredRecord saved = recordStore.put(target);
        changeNotifier.publish(ChangeEvent.written(saved));
        return true;
    }

    private int cancelOpenSessions(String changeSetId) {
        List<EditSession> open = editSessionService.listOpen(changeSetId);
        open.forEach(session -> editSessionService.cancel(session.getId()));
        return open.size();
    }

    private void transition(ChangeSet changeSet, ChangeSetStatus target) {
        if (changeSet.getStatus() != ChangeSetStatus.OPEN) {
            throw new InvalidStateException("Change set " + changeSet.getId() + " is "
                    + changeSet.getStatus() + "; only OPEN change sets can be " + target.name().toLowerCase());
        }
        int updated = changeSetRepository.transitionStatus(changeSet.getId(),
                ChangeSetStatus.OPEN, target, LocalDateTime.now());
        if (updated == 0) {
            throw new ConflictException("Change set " + changeSet.getId()
                    + " was closed by a concurrent transaction");
        }
    }

    private ChangeSet load(String changeSetId) {
        return changeSetRepository.findById(changeSetId)
                .orElseThrow(() -> new RecordNotFoundException("ChangeSet", changeSetId));
    }
}
