package com.purchasingpower.infragraph;

import com.purchasingpower.infragraph.model.changeset.ChangeSet;
import com.purchasingpower.infragraph.model.changeset.EditSession;
import com.purchasingpower.infragraph.model.graph.TierContext;
import com.purchasingpower.infragraph.model.graph.TierKey;
import com.purchasingpower.infragraph.model.graph.VersionedRecord;
import com.purchasingpower.infragraph.model.payload.ApplicationPayload;
import com.purchasingpower.infragraph.model.payload.EntityPayload;
import com.purchasingpower.infragraph.model.payload.RecordPayload;
import com.purchasingpower.infragraph.service.ChangeSetService;
import com.purchasingpower.infragraph.service.EditSessionService;
import com.purchasingpower.infragraph.service.RecordMutation;
import com.purchasingpower.infragraph.service.TierTransactions;
import com.purchasingpower.infragraph.service.VersionedEntityStore;
import com.purchasingpower.infragraph.storage.RecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;

/**
 * Shared wiring for integration tests against the in-memory store.
 *
 * Every test gets its own workspace id because the Spring context (and the H2
 * database behind it) is shared across test classes.
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class TierTestSupport {

    @Autowired
    protected VersionedEntityStore entityStore;

    @Autowired
    protected ChangeSetService changeSetService;

    @Autowired
    protected EditSessionService editSessionService;

    @Autowired
    protected RecordStore recordStore;

    @Autowired
    protected TierTransactions transactions;

    protected String workspaceId;

    @BeforeEach
    void newWorkspace() {
        workspaceId = "ws-" + UUID.randomUUID();
    }

    protected TierContext head() {
        return TierContext.head(workspaceId);
    }

    /**
     * Open change set plus one open edit session under it.
     */
    protected TierContext openDraft(String changeSetName) {
        ChangeSet changeSet = changeSetService.create(workspaceId, changeSetName);
        EditSession session = editSessionService.create(changeSet.getId(), workspaceId);
        return TierContext.editSession(workspaceId, changeSet.getId(), session.getId());
    }

    protected TierContext anotherSession(TierContext draft) {
        EditSession session = editSessionService.create(draft.changeSetId(), workspaceId);
        return TierContext.editSession(workspaceId, draft.changeSetId(), session.getId());
    }

    /**
     * Write a payload and push it all the way to Head.
     */
    protected VersionedRecord seedHead(String objectId, RecordPayload payload) {
        TierContext draft = openDraft("seed " + objectId);
        entityStore.write(objectId, draft, RecordMutation.replaceWith(payload));
        editSessionService.save(draft.editSessionId());
        changeSetService.apply(draft.changeSetId());
        return entityStore.resolve(objectId, head());
    }

    protected VersionedRecord seedHead(RecordPayload payload) {
        return seedHead(payload.recordKind().name().toLowerCase() + ":" + UUID.randomUUID(), payload);
    }

    protected String uniqueId(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }

    protected long rowsAt(TierKey tierKey) {
        return transactions.read("count", () -> recordStore.count(tierKey));
    }

    protected static ApplicationPayload application(String name, String description) {
        ApplicationPayload payload = new ApplicationPayload(name);
        payload.setDescription(description);
        return payload;
    }

    protected static String nameOf(VersionedRecord record) {
        return record.payloadAs(EntityPayload.class).getName();
    }
}
