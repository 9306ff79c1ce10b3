package com.purchasingpower.infragraph.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.infragraph.TierTestSupport;
import com.purchasingpower.infragraph.exception.InvalidStateException;
import com.purchasingpower.infragraph.exception.RecordNotFoundException;
import com.purchasingpower.infragraph.model.changeset.ChangeSet;
import com.purchasingpower.infragraph.model.changeset.ChangeSetStatus;
import com.purchasingpower.infragraph.model.changeset.EditSession;
import com.purchasingpower.infragraph.model.graph.TierContext;
import com.purchasingpower.infragraph.model.graph.TierKey;
import com.purchasingpower.infragraph.model.graph.VersionedRecord;
import com.purchasingpower.infragraph.model.payload.ApplicationPayload;
import com.purchasingpower.infragraph.model.payload.RecordPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * ════════════════════════════════════════════════════════════════════════════
 * END-TO-END: ONE OBJECT FROM DRAFT TO HEAD
 * ════════════════════════════════════════════════════════════════════════════
 *
 * Change set C1 in workspace W, session S1 under it, entity "app-1" written in S1:
 * visible only to S1, then to C1 after save, then to everyone after apply.
 * ════════════════════════════════════════════════════════════════════════════
 */
@DisplayName("End-to-End Scenario Test")
class EndToEndScenarioTest extends TierTestSupport {

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("app-1 should move from S1 to C1 to Head")
    void draftToHead() throws Exception {
        // Given: C1 open in W, S1 open under C1
        ChangeSet c1 = changeSetService.create(workspaceId, "C1");
        EditSession s1 = editSessionService.create(c1.getId(), workspaceId);
        TierContext inSession = TierContext.editSession(workspaceId, c1.getId(), s1.getId());
        TierContext inChangeSet = TierContext.changeSet(workspaceId, c1.getId());
        RecordPayload payload = objectMapper.readValue("{\"kind\":\"application\",\"name\":\"app-1\"}",
                RecordPayload.class);

        // When: app-1 written in S1
        entityStore.write("app-1", inSession, current -> payload);

        // Then: only S1 sees it
        VersionedRecord draft = entityStore.resolve("app-1", inSession);
        assertEquals("app-1", draft.payloadAs(ApplicationPayload.class).getName());
        assertThat(draft.getTierKey()).isEqualTo(TierKey.editSession(s1.getId()));
        assertThrows(RecordNotFoundException.class, () -> entityStore.resolve("app-1", inChangeSet));

        // When: S1 saved
        editSessionService.save(s1.getId());

        // Then: C1 sees it
        VersionedRecord inC1 = entityStore.resolve("app-1", inChangeSet);
        assertEquals("app-1", inC1.payloadAs(ApplicationPayload.class).getName());
        assertThat(inC1.getTierKey()).isEqualTo(TierKey.changeSet(c1.getId()));
        assertThrows(RecordNotFoundException.class, () -> entityStore.resolve("app-1", head()));

        // When: C1 applied
        ChangeSet applied = changeSetService.apply(c1.getId());

        // Then: Head sees it, and C1 cannot be applied again
        assertEquals(ChangeSetStatus.APPLIED, applied.getStatus());
        VersionedRecord atHead = entityStore.resolve("app-1", head());
        assertEquals("app-1", atHead.payloadAs(ApplicationPayload.class).getName());
        assertThat(atHead.getPayload()).isEqualTo(payload);
        assertThrows(InvalidStateException.class, () -> changeSetService.apply(c1.getId()));
    }
}
