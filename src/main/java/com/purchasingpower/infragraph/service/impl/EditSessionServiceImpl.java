package com.purchasingpower.infragraph.service.impl;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.purchasingpower.infragraph.exception.ConflictException;
import com.purchasingpower.infragraph.exception.InvalidStateException;
import com.purchasingpower.infragraph.exception.RecordNotFoundException;
import com.purchasingpower.infragraph.model.changeset.ChangeSet;
import com.purchasingpower.infragraph.model.changeset.ChangeSetStatus;
import com.purchasingpower.infragraph.model.changeset.EditSession;
import com.purchasingpower.infragraph.model.changeset.EditSessionStatus;
import com.purchasingpower.infragraph.model.event.ChangeEvent;
import com.purchasingpower.infragraph.model.event.ChangeEventType;
import com.purchasingpower.infragraph.model.graph.StoredRecord;
import com.purchasingpower.infragraph.model.graph.TierKey;
import com.purchasingpower.infragraph.repository.ChangeSetRepository;
import com.purchasingpower.infragraph.repository.EditSessionRepository;
import com.purchasingpower.infragraph.service.ChangeNotifier;
import com.purchasingpower.infragraph.service.EditSessionService;
import com.purchasingpower.infragraph.service.TierTransactions;
import com.purchasingpower.infragraph.storage.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class EditSessionServiceImpl implements EditSessionService {

    private final TierTransactions transactions;
    private final EditSessionRepository editSessionRepository;
    private final ChangeSetRepository changeSetRepository;
    private final RecordStore recordStore;
    private final ChangeNotifier changeNotifier;

    @Override
    public EditSession create(String changeSetId, String workspaceId) {
        checkId(changeSetId, "changeSetId");
        checkId(workspaceId, "workspaceId");

        return transactions.write("createEditSession", () -> {
            ChangeSet changeSet = changeSetRepository.findById(changeSetId)
                    .orElseThrow(() -> new RecordNotFoundException("ChangeSet", changeSetId));
            if (!changeSet.getWorkspaceId().equals(workspaceId)) {
                throw new InvalidStateException("Change set " + changeSetId + " belongs to workspace "
                        + changeSet.getWorkspaceId() + ", not " + workspaceId);
            }
            if (changeSet.getStatus() != ChangeSetStatus.OPEN) {
                throw new InvalidStateException("Cannot open an edit session on change set "
                        + changeSetId + " in status " + changeSet.getStatus());
            }

            EditSession session = editSessionRepository.save(EditSession.builder()
                    .id(UUID.randomUUID().toString())
                    .changeSetId(changeSetId)
                    .workspaceId(workspaceId)
                    .status(EditSessionStatus.OPEN)
                    .build());

            changeNotifier.publish(ChangeEvent.lifecycle(ChangeEventType.EDIT_SESSION_CREATED,
                    workspaceId, session.getId(), TierKey.editSession(session.getId())));
            log.info("📝 Opened edit session {} on change set {}", session.getId(), changeSetId);
            return session;
        });
    }

    @Override
    public EditSession get(String editSessionId) {
        checkId(editSessionId, "editSessionId");
        return transactions.read("getEditSession", () -> load(editSessionId));
    }

    @Override
    public List<EditSession> listOpen(String changeSetId) {
        checkId(changeSetId, "changeSetId");
        return transactions.read("listOpenEditSessions", () ->
                editSessionRepository.findByChangeSetIdAndStatusOrderByCreatedAtAsc(changeSetId, EditSessionStatus.OPEN));
    }

    @Override
    public EditSession save(String editSessionId) {
        checkId(editSessionId, "editSessionId");

        return transactions.write("saveEditSession", () -> {
            EditSession session = load(editSessionId);
            requireOpenChangeSet(session);
            transition(session, EditSessionStatus.SAVED);

            TierKey draftKey = TierKey.editSession(session.getId());
            TierKey changeSetKey = TierKey.changeSet(session.getChangeSetId());
            List<StoredRecord> drafts = recordStore.scan(draftKey);

            for (StoredRecord draft : drafts) {
                promote(draft, changeSetKey);
            }
            int removed = recordStore.deleteAll(draftKey);

            changeNotifier.publish(ChangeEvent.lifecycle(ChangeEventType.CHANGE_SET_WRITTEN,
                    session.getWorkspaceId(), session.getChangeSetId(), changeSetKey));
            changeNotifier.publish(ChangeEvent.lifecycle(ChangeEventType.EDIT_SESSION_SAVED,
                    session.getWorkspaceId(), session.getId(), draftKey));
            log.info("💾 Saved edit session {}: {} drafts promoted into change set {}",
                    session.getId(), removed, session.getChangeSetId());
            return load(editSessionId);
        });
    }

    @Override
    public EditSession cancel(String editSessionId) {
        checkId(editSessionId, "editSessionId");

        return transactions.write("cancelEditSession", () -> {
            EditSession session = load(editSessionId);
            transition(session, EditSessionStatus.CANCELED);

            TierKey draftKey = TierKey.editSession(session.getId());
            int removed = recordStore.deleteAll(draftKey);

            changeNotifier.publish(ChangeEvent.lifecycle(ChangeEventType.EDIT_SESSION_CANCELED,
                    session.getWorkspaceId(), session.getId(), draftKey));
            log.info("🗑️ Canceled edit session {} ({} drafts discarded)", session.getId(), removed);
            return load(editSessionId);
        });
    }

    /**
     * Create-or-replace the change set row for one draft. A deletion marker for an
     * object Head has never seen just removes the change set row.
     */
    private void promote(StoredRecord draft, TierKey changeSetKey) {
        Optional<StoredRecord> existing = recordStore.find(draft.getObjectId(), changeSetKey);

        if (draft.isDeleted() && recordStore.find(draft.getObjectId(), TierKey.HEAD).isEmpty()) {
            existing.ifPresent(recordStore::delete);
            changeNotifier.publish(ChangeEvent.deleted(draft.getWorkspaceId(), draft.getRecordKind(),
                    draft.getObjectId(), changeSetKey));
            return;
        }

        StoredRecord target = existing.orElseGet(
                () -> StoredRecord.newRow(draft.getObjectId(), changeSetKey, draft.getWorkspaceId()));
        target.copyContentFrom(draft);
        StoredRecord saved = recordStore.put(target);

        if (saved.isDeleted()) {
            changeNotifier.publish(ChangeEvent.deleted(saved.getWorkspaceId(), saved.getRecordKind(),
                    saved.getObjectId(), changeSetKey));
        } else {
            changeNotifier.publish(ChangeEvent.written(saved));
        }
    }

    /**
     * Save writes into the change set tier, which is frozen once the change set is terminal.
     */
    private void requireOpenChangeSet(EditSession session) {
        ChangeSet changeSet = changeSetRepository.findById(session.getChangeSetId())
                .orElseThrow(() -> new RecordNotFoundException("ChangeSet", session.getChangeSetId()));
        if (changeSet.getStatus() != ChangeSetStatus.OPEN) {
            throw new InvalidStateException("Cannot save edit session " + session.getId() + " into change set "
                    + changeSet.getId() + " in status " + changeSet.getStatus());
        }
    }

    private void transition(EditSession session, EditSessionStatus target) {
        if (session.getStatus() != EditSessionStatus.OPEN) {
            throw new InvalidStateException("Edit session " + session.getId() + " is "
                    + session.getStatus() + "; only OPEN sessions can be " + target.name().toLowerCase());
        }
        int updated = editSessionRepository.transitionStatus(session.getId(),
                EditSessionStatus.OPEN, target, LocalDateTime.now());
        if (updated == 0) {
            throw new ConflictException("Edit session " + session.getId()
                    + " was closed by a concurrent transaction");
        }
    }

    private EditSession load(String editSessionId) {
        return editSessionRepository.findById(editSessionId)
                .orElseThrow(() -> new RecordNotFoundException("EditSession", editSessionId));
    }

    private static void checkId(String value, String name) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(value), "%s is required", name);
    }
}
