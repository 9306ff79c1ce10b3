package com.purchasingpower.infragraph.service.impl;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.purchasingpower.infragraph.exception.InvalidPayloadException;
import com.purchasingpower.infragraph.exception.InvalidStateException;
import com.purchasingpower.infragraph.exception.RecordNotFoundException;
import com.purchasingpower.infragraph.model.changeset.ChangeSet;
import com.purchasingpower.infragraph.model.changeset.ChangeSetStatus;
import com.purchasingpower.infragraph.model.changeset.EditSession;
import com.purchasingpower.infragraph.model.changeset.EditSessionStatus;
import com.purchasingpower.infragraph.model.event.ChangeEvent;
import com.purchasingpower.infragraph.model.graph.RecordKind;
import com.purchasingpower.infragraph.model.graph.StoredRecord;
import com.purchasingpower.infragraph.model.graph.TierContext;
import com.purchasingpower.infragraph.model.graph.TierKey;
import com.purchasingpower.infragraph.model.graph.VersionedRecord;
import com.purchasingpower.infragraph.model.payload.EdgePayload;
import com.purchasingpower.infragraph.model.payload.RecordPayload;
import com.purchasingpower.infragraph.model.payload.Vertex;
import com.purchasingpower.infragraph.repository.ChangeSetRepository;
import com.purchasingpower.infragraph.repository.EditSessionRepository;
import com.purchasingpower.infragraph.service.ChangeNotifier;
import com.purchasingpower.infragraph.service.RecordMutation;
import com.purchasingpower.infragraph.service.TierResolver;
import com.purchasingpower.infragraph.service.TierTransactions;
import com.purchasingpower.infragraph.service.VersionedEntityStore;
import com.purchasingpower.infragraph.storage.PayloadCodec;
import com.purchasingpower.infragraph.storage.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class VersionedEntityStoreImpl implements VersionedEntityStore {

    private final TierTransactions transactions;
    private final TierResolver resolver;
    private final RecordStore recordStore;
    private final PayloadCodec payloadCodec;
    private final EditSessionRepository editSessionRepository;
    private final ChangeSetRepository changeSetRepository;
    private final ChangeNotifier changeNotifier;

    @Override
    public VersionedRecord resolve(String objectId, TierContext context) {
        checkObjectId(objectId);
        Preconditions.checkNotNull(context, "context is required");
        return transactions.read("resolve", () -> resolver.resolve(objectId, context));
    }

    @Override
    public Optional<VersionedRecord> find(String objectId, TierContext context) {
        checkObjectId(objectId);
        Preconditions.checkNotNull(context, "context is required");
        return transactions.read("find", () -> resolver.tryResolve(objectId, context));
    }

    @Override
    public VersionedRecord write(String objectId, TierContext context, RecordMutation mutation) {
        checkObjectId(objectId);
        Preconditions.checkNotNull(context, "context is required");
        Preconditions.checkNotNull(mutation, "mutation is required");

        return transactions.write("write", () -> {
            TierKey draftKey = requireOpenSession(context);
            Optional<StoredRecord> draft = recordStore.find(objectId, draftKey);
            Optional<StoredRecord> ancestor = resolver.findVisible(objectId, context.withoutEditSession());

            // Copy-on-write: the mutation always gets a freshly decoded payload, never a shared instance.
            RecordPayload current;
            if (draft.isPresent()) {
                current = draft.get().isDeleted() ? null : payloadCodec.decode(draft.get());
            } else {
                current = ancestor.filter(row -> !row.isDeleted()).map(payloadCodec::decode).orElse(null);
            }

            RecordPayload next = mutation.apply(current);
            if (next == null) {
                throw new InvalidPayloadException("Mutation of " + objectId + " returned no payload");
            }
            checkKindUnchanged(objectId, draft.or(() -> ancestor).orElse(null), next);

            String json = payloadCodec.encode(objectId, next);
            StoredRecord row = draft.orElseGet(() -> StoredRecord.newRow(objectId, draftKey, context.workspaceId()));
            row.applyPayload(next, json);
            StoredRecord saved = recordStore.put(row);

            VersionedRecord record = resolver.toRecord(saved);
            changeNotifier.publish(ChangeEvent.written(saved));
            log.debug("{} {} {} at {}", current == null ? "Created" : "Updated",
                    record.getKind(), objectId, draftKey);
            return record;
        });
    }

    @Override
    public VersionedRecord create(RecordPayload payload, TierContext context) {
        Preconditions.checkNotNull(payload, "payload is required");
        String objectId = payload.recordKind().name().toLowerCase() + ":" + UUID.randomUUID();
        return write(objectId, context, RecordMutation.replaceWith(payload));
    }

    @Override
    public void delete(String objectId, TierContext context) {
        checkObjectId(objectId);
        Preconditions.checkNotNull(context, "context is required");

        transactions.writeVoid("delete", () -> {
            TierKey draftKey = requireOpenSession(context);
            StoredRecord visible = resolver.findVisible(objectId, context)
                    .filter(row -> !row.isDeleted())
                    .orElseThrow(() -> new RecordNotFoundException("Record", objectId,
                            "workspace=" + context.workspaceId()));

            boolean existsBelow = resolver.findVisible(objectId, context.withoutEditSession())
                    .filter(row -> !row.isDeleted())
                    .isPresent();
            Optional<StoredRecord> draft = recordStore.find(objectId, draftKey);

            if (!existsBelow) {
                // Only this session ever saw the object.
                draft.ifPresent(recordStore::delete);
            } else {
                StoredRecord marker = draft.orElseGet(
                        () -> StoredRecord.newRow(objectId, draftKey, context.workspaceId()));
                marker.markDeleted(visible);
                recordStore.put(marker);
            }

            changeNotifier.publish(ChangeEvent.deleted(context.workspaceId(), visible.getRecordKind(),
                    objectId, draftKey));
            log.debug("Deleted {} {} at {}", visible.getKind(), objectId, draftKey);
        });
    }

    @Override
    public VersionedRecord connect(String edgeKind, String tailObjectId, String headObjectId, TierContext context) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(edgeKind), "edgeKind is required");
        checkObjectId(tailObjectId);
        checkObjectId(headObjectId);

        return transactions.write("connect", () -> {
            VersionedRecord tail = resolver.resolve(tailObjectId, context);
            VersionedRecord head = resolver.resolve(headObjectId, context);
            EdgePayload edge = new EdgePayload(edgeKind,
                    new Vertex(tail.getObjectId(), tail.getKind()),
                    new Vertex(head.getObjectId(), head.getKind()));
            return create(edge, context);
        });
    }

    @Override
    public List<VersionedRecord> list(RecordKind recordKind, TierContext context) {
        Preconditions.checkNotNull(recordKind, "recordKind is required");
        Preconditions.checkNotNull(context, "context is required");
        return transactions.read("list", () -> resolver.resolveAll(context,
                tierKey -> recordStore.scanByRecordKind(context.workspaceId(), tierKey, recordKind)));
    }

    @Override
    public List<VersionedRecord> listByKind(String kind, TierContext context) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(kind), "kind is required");
        Preconditions.checkNotNull(context, "context is required");
        return transactions.read("listByKind", () -> resolver.resolveAll(context,
                tierKey -> recordStore.scanByKind(context.workspaceId(), tierKey, kind)));
    }

    /**
     * @return the tier key drafts of this context are written under
     */
    private TierKey requireOpenSession(TierContext context) {
        if (!context.hasEditSession()) {
            throw new InvalidStateException("Writes need an edit session; "
                    + (context.isHead() ? "Head" : "change set " + context.changeSetId())
                    + " only changes through promotion");
        }
        EditSession session = editSessionRepository.findById(context.editSessionId())
                .orElseThrow(() -> new RecordNotFoundException("EditSession", context.editSessionId()));
        if (session.getStatus() != EditSessionStatus.OPEN) {
            throw new InvalidStateException("Edit session " + session.getId() + " is " + session.getStatus());
        }
        if (!session.getChangeSetId().equals(context.changeSetId())
                || !session.getWorkspaceId().equals(context.workspaceId())) {
            throw new InvalidStateException("Edit session " + session.getId() + " belongs to change set "
                    + session.getChangeSetId() + " in workspace " + session.getWorkspaceId());
        }
        ChangeSet changeSet = changeSetRepository.findById(session.getChangeSetId())
                .orElseThrow(() -> new RecordNotFoundException("ChangeSet", session.getChangeSetId()));
        if (changeSet.getStatus() != ChangeSetStatus.OPEN) {
            throw new InvalidStateException("Change set " + changeSet.getId() + " of edit session "
                    + session.getId() + " is " + changeSet.getStatus());
        }
        return TierKey.editSession(session.getId());
    }

    private static void checkKindUnchanged(String objectId, StoredRecord existing, RecordPayload next) {
        if (existing == null) {
            return;
        }
        if (existing.getRecordKind() != next.recordKind() || !existing.getKind().equals(next.kindTag())) {
            throw new InvalidPayloadException("Cannot change " + objectId + " from "
                    + existing.getKind() + " to " + next.kindTag());
        }
    }

    private static void checkObjectId(String objectId) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(objectId), "objectId is required");
    }
}
