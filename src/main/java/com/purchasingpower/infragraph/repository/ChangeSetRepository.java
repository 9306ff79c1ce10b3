package com.purchasingpower.infragraph.repository;

import com.purchasingpower.infragraph.model.changeset.ChangeSet;
import com.purchasingpower.infragraph.model.changeset.ChangeSetStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for managing ChangeSet entities.
 */
@Repository
public interface ChangeSetRepository extends JpaRepository<ChangeSet, String> {

    /**
     * Change sets of a workspace in a given state, oldest first.
     */
    List<ChangeSet> findByWorkspaceIdAndStatusOrderByCreatedAtAsc(String workspaceId, ChangeSetStatus status);

    /**
     * Applied change sets, most recently applied first (the revision history).
     */
    List<ChangeSet> findByWorkspaceIdAndStatusOrderByClosedAtDesc(String workspaceId, ChangeSetStatus status);

    /**
     * Move a change set from one status to another only if it is still in the expected one.
     *
     * @return 1 if this caller won the transition, 0 if another transaction got there first
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ChangeSet c SET c.status = :to, c.updatedAt = :now, c.closedAt = :now, " +
           "c.version = c.version + 1 " +
           "WHERE c.id = :id AND c.status = :from")
    int transitionStatus(@Param("id") String id,
                         @Param("from") ChangeSetStatus from,
                         @Param("to") ChangeSetStatus to,
                         @Param("now") LocalDateTime now);
}
