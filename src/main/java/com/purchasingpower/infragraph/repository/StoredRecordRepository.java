package com.purchasingpower.infragraph.repository;

import com.purchasingpower.infragraph.model.graph.RecordKind;
import com.purchasingpower.infragraph.model.graph.StoredRecord;
import com.purchasingpower.infragraph.model.graph.Tier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for tier-specific record rows.
 *
 * Every query is pinned to one (tier, tierId) pair; merging tiers is the resolver's job.
 */
@Repository
public interface StoredRecordRepository extends JpaRepository<StoredRecord, Long> {

    Optional<StoredRecord> findByObjectIdAndTierAndTierId(String objectId, Tier tier, String tierId);

    /**
     * All rows of one tier, e.g. every draft of an edit session.
     */
    List<StoredRecord> findByTierAndTierIdOrderByObjectIdAsc(Tier tier, String tierId);

    List<StoredRecord> findByWorkspaceIdAndTierAndTierIdAndRecordKindOrderByObjectIdAsc(
            String workspaceId, Tier tier, String tierId, RecordKind recordKind);

    List<StoredRecord> findByWorkspaceIdAndTierAndTierIdAndKindOrderByObjectIdAsc(
            String workspaceId, Tier tier, String tierId, String kind);

    /**
     * Edge rows (including deletion markers) leaving the given tail.
     */
    List<StoredRecord> findByEdgeKindAndTailObjectIdAndTierAndTierIdOrderByObjectIdAsc(
            String edgeKind, String tailObjectId, Tier tier, String tierId);

    /**
     * Edge rows (including deletion markers) arriving at the given head.
     */
    List<StoredRecord> findByEdgeKindAndHeadObjectIdAndTierAndTierIdOrderByObjectIdAsc(
            String edgeKind, String headObjectId, Tier tier, String tierId);

    long countByTierAndTierId(Tier tier, String tierId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM StoredRecord r WHERE r.tier = :tier AND r.tierId = :tierId")
    int deleteTier(@Param("tier") Tier tier, @Param("tierId") String tierId);
}
