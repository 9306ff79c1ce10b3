package com.purchasingpower.infragraph.service.diff;

import com.purchasingpower.infragraph.TierTestSupport;
import com.purchasingpower.infragraph.exception.InvalidStateException;
import com.purchasingpower.infragraph.exception.RecordNotFoundException;
import com.purchasingpower.infragraph.model.dto.ChangeSetDiff;
import com.purchasingpower.infragraph.model.dto.RecordChange;
import com.purchasingpower.infragraph.model.dto.RecordChange.ChangeType;
import com.purchasingpower.infragraph.model.graph.TierContext;
import com.purchasingpower.infragraph.model.graph.VersionedRecord;
import com.purchasingpower.infragraph.model.payload.ApplicationPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Record Diff Service Tests")
class RecordDiffServiceTest extends TierTestSupport {

    @Autowired
    private RecordDiffService recordDiffService;

    @Test
    @DisplayName("Should report changed properties of a modified record")
    void diffAgainstHead_modified() {
        // Given
        VersionedRecord seeded = seedHead(application("payments", "v1"));
        TierContext draft = openDraft("describe");
        entityStore.write(seeded.getObjectId(), draft, current -> {
            ((ApplicationPayload) current).setDescription("v2");
            current.putExtension("owner", "team-pay");
            return current;
        });

        // When
        RecordChange change = recordDiffService.diffAgainstHead(seeded.getObjectId(), draft);

        // Then
        assertEquals(ChangeType.MODIFIED, change.getChangeType());
        assertThat(change.getPropertyDiffs())
                .extracting(RecordChange.PropertyDiff::getProperty)
                .containsExactly("description", "owner");
        RecordChange.PropertyDiff description = change.getPropertyDiffs().get(0);
        assertEquals("v1", description.getOldValue());
        assertEquals("v2", description.getNewValue());
    }

    @Test
    @DisplayName("Should classify added, removed and untouched records")
    void diffAgainstHead_classifies() {
        VersionedRecord untouched = seedHead(application("untouched", null));
        VersionedRecord removed = seedHead(application("removed", null));
        TierContext draft = openDraft("classify");
        VersionedRecord added = entityStore.create(application("added", null), draft);
        entityStore.delete(removed.getObjectId(), draft);

        assertEquals(ChangeType.ADDED, recordDiffService.diffAgainstHead(added.getObjectId(), draft).getChangeType());
        assertEquals(ChangeType.REMOVED, recordDiffService.diffAgainstHead(removed.getObjectId(), draft).getChangeType());
        assertEquals(ChangeType.UNCHANGED,
                recordDiffService.diffAgainstHead(untouched.getObjectId(), draft).getChangeType());
        assertThrows(RecordNotFoundException.class,
                () -> recordDiffService.diffAgainstHead(uniqueId("nothing"), draft));
    }

    @Test
    @DisplayName("Diffing from Head should fail InvalidState")
    void diffAgainstHead_rejectsHeadContext() {
        assertThrows(InvalidStateException.class, () -> recordDiffService.diffAgainstHead("anything", head()));
    }

    @Test
    @DisplayName("Change set diff should summarize every row by record kind")
    void diffChangeSet_summarizes() {
        // Given
        VersionedRecord modified = seedHead(application("modified", "old"));
        VersionedRecord removed = seedHead(application("removed", null));
        TierContext draft = openDraft("summary");
        entityStore.write(modified.getObjectId(), draft, current -> application("modified", "new"));
        entityStore.delete(removed.getObjectId(), draft);
        VersionedRecord added = entityStore.create(application("added", null), draft);
        entityStore.connect("Includes", modified.getObjectId(), added.getObjectId(), draft);
        editSessionService.save(draft.editSessionId());

        // When
        ChangeSetDiff diff = recordDiffService.diffChangeSet(draft.changeSetId());

        // Then
        assertEquals("summary", diff.getChangeSetName());
        assertThat(diff.getChanges()).hasSize(4);
        assertEquals(4, diff.getSummary().getTotalChanges());
        assertEquals(2, diff.getSummary().getRecordsAdded());
        assertEquals(1, diff.getSummary().getRecordsModified());
        assertEquals(1, diff.getSummary().getRecordsRemoved());
        assertEquals(1, diff.getSummary().getAddedByKind().get("EDGE"));
        assertEquals(1, diff.getSummary().getAddedByKind().get("ENTITY"));
    }
}
