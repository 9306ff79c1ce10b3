package com.purchasingpower.infragraph.repository;

import com.purchasingpower.infragraph.model.changeset.EditSession;
import com.purchasingpower.infragraph.model.changeset.EditSessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for managing EditSession entities.
 */
@Repository
public interface EditSessionRepository extends JpaRepository<EditSession, String> {

    List<EditSession> findByChangeSetIdAndStatusOrderByCreatedAtAsc(String changeSetId, EditSessionStatus status);

    /**
     * Same compare-and-set contract as {@link ChangeSetRepository#transitionStatus}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE EditSession e SET e.status = :to, e.updatedAt = :now, e.closedAt = :now, " +
           "e.version = e.version + 1 " +
           "WHERE e.id = :id AND e.status = :from")
    int transitionStatus(@Param("id") String id,
                         @Param("from") EditSessionStatus from,
                         @Param("to") EditSessionStatus to,
                         @Param("now") LocalDateTime now);
}
