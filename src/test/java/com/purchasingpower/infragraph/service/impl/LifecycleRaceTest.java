package com.purchasingpower.infragraph.service.impl;

import com.purchasingpower.infragraph.configuration.VersioningProperties;
import com.purchasingpower.infragraph.exception.ConflictException;
import com.purchasingpower.infragraph.exception.InvalidStateException;
import com.purchasingpower.infragraph.model.changeset.ChangeSet;
import com.purchasingpower.infragraph.model.changeset.ChangeSetStatus;
import com.purchasingpower.infragraph.model.changeset.EditSession;
import com.purchasingpower.infragraph.model.changeset.EditSessionStatus;
import com.purchasingpower.infragraph.repository.ChangeSetRepository;
import com.purchasingpower.infragraph.repository.EditSessionRepository;
import com.purchasingpower.infragraph.service.ChangeNotifier;
import com.purchasingpower.infragraph.service.EditSessionService;
import com.purchasingpower.infragraph.service.TierTransactions;
import com.purchasingpower.infragraph.storage.RecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Simulates losing the status compare-and-set to a concurrent transaction:
 * the status was OPEN when read, but the conditional update matches no row.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Lifecycle Race Tests")
class LifecycleRaceTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private ChangeSetRepository changeSetRepository;

    @Mock
    private EditSessionRepository editSessionRepository;

    @Mock
    private EditSessionService editSessionService;

    @Mock
    private RecordStore recordStore;

    @Mock
    private ChangeNotifier changeNotifier;

    private TierTransactions transactions;

    @BeforeEach
    void setUp() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        transactions = new TierTransactions(transactionManager, new VersioningProperties());
    }

    @Test
    @DisplayName("Concurrent save of the same session should make the loser fail Conflict")
    void save_losingCompareAndSet() {
        // Given: the session reads as OPEN but another save already flipped it
        EditSessionServiceImpl service = new EditSessionServiceImpl(transactions, editSessionRepository,
                changeSetRepository, recordStore, changeNotifier);
        when(editSessionRepository.findById("es-1")).thenReturn(Optional.of(session("es-1", EditSessionStatus.OPEN)));
        when(changeSetRepository.findById("cs-1")).thenReturn(Optional.of(changeSet("cs-1", ChangeSetStatus.OPEN)));
        when(editSessionRepository.transitionStatus(eq("es-1"), eq(EditSessionStatus.OPEN),
                eq(EditSessionStatus.SAVED), any())).thenReturn(0);

        // When / Then
        assertThrows(ConflictException.class, () -> service.save("es-1"));
        verifyNoInteractions(recordStore, changeNotifier);
        verify(transactionManager).rollback(any());
    }

    @Test
    @DisplayName("Concurrent apply of the same change set should make the loser fail Conflict")
    void apply_losingCompareAndSet() {
        // Given
        ChangeSetServiceImpl service = new ChangeSetServiceImpl(transactions, changeSetRepository,
                editSessionService, recordStore, changeNotifier, new VersioningProperties());
        when(changeSetRepository.findById("cs-1")).thenReturn(Optional.of(changeSet("cs-1", ChangeSetStatus.OPEN)));
        when(changeSetRepository.transitionStatus(eq("cs-1"), eq(ChangeSetStatus.OPEN),
                eq(ChangeSetStatus.APPLIED), any())).thenReturn(0);

        // When / Then
        assertThrows(ConflictException.class, () -> service.apply("cs-1"));
        verifyNoInteractions(recordStore, editSessionService, changeNotifier);
    }

    @Test
    @DisplayName("A change set read as APPLIED should fail InvalidState without attempting the update")
    void apply_alreadyApplied() {
        ChangeSetServiceImpl service = new ChangeSetServiceImpl(transactions, changeSetRepository,
                editSessionService, recordStore, changeNotifier, new VersioningProperties());
        when(changeSetRepository.findById("cs-2")).thenReturn(Optional.of(changeSet("cs-2", ChangeSetStatus.APPLIED)));

        assertThrows(InvalidStateException.class, () -> service.apply("cs-2"));
        verify(changeSetRepository).findById("cs-2");
        verifyNoInteractions(recordStore);
    }

    private static EditSession session(String id, EditSessionStatus status) {
        return EditSession.builder()
                .id(id)
                .changeSetId("cs-1")
                .workspaceId("ws")
                .status(status)
                .build();
    }

    private static ChangeSet changeSet(String id, ChangeSetStatus status) {
        return ChangeSet.builder()
                .id(id)
                .name("race")
                .workspaceId("ws")
                .status(status)
                .build();
    }
}
