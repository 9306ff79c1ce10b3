package com.purchasingpower.infragraph.model.graph;

import com.purchasingpower.infragraph.model.payload.EdgePayload;
import com.purchasingpower.infragraph.model.payload.RecordPayload;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * JPA Entity holding one tier-specific row of a versioned Entity, Node or Edge.
 * Maps to table 'VERSIONED_RECORDS'.
 *
 * <p>The row is keyed by (object_id, tier, tier_id). Edge rows copy their kind and
 * vertices into dedicated columns so successor scans do not decode payloads.
 * A row with {@code deleted = true} is a deletion marker: it hides every
 * lower-priority row of the same object.
 */
@Entity
@Table(name = "VERSIONED_RECORDS",
        uniqueConstraints = @UniqueConstraint(name = "uk_record_object_tier",
                columnNames = {"object_id", "tier", "tier_id"}),
        indexes = {
                @Index(name = "idx_record_tier", columnList = "tier, tier_id"),
                @Index(name = "idx_record_workspace", columnList = "workspace_id, record_kind"),
                @Index(name = "idx_record_edge_tail", columnList = "edge_kind, tail_object_id"),
                @Index(name = "idx_record_edge_head", columnList = "edge_kind, head_object_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "object_id", nullable = false, length = 200)
    private String objectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_kind", nullable = false, length = 20)
    private RecordKind recordKind;

    /**
     * Payload kind tag, e.g. "application" or "edge".
     */
    @Column(name = "kind", nullable = false, length = 100)
    private String kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "tier", nullable = false, length = 20)
    private Tier tier;

    @Column(name = "tier_id", nullable = false, length = 100)
    private String tierId;

    @Column(name = "workspace_id", nullable = false, length = 100)
    private String workspaceId;

    @Lob
    @Column(name = "payload_json")
    private String payloadJson; // null for deletion markers

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Column(name = "edge_kind", length = 100)
    private String edgeKind;

    @Column(name = "tail_object_id", length = 200)
    private String tailObjectId;

    @Column(name = "tail_kind", length = 100)
    private String tailKind;

    @Column(name = "head_object_id", length = 200)
    private String headObjectId;

    @Column(name = "head_kind", length = 100)
    private String headKind;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static StoredRecord newRow(String objectId, TierKey tierKey, String workspaceId) {
        StoredRecord row = new StoredRecord();
        row.setObjectId(objectId);
        row.setTier(tierKey.tier());
        row.setTierId(tierKey.tierId());
        row.setWorkspaceId(workspaceId);
        return row;
    }

    public TierKey tierKey() {
        return new TierKey(tier, tierId);
    }

    public boolean isEdge() {
        return recordKind == RecordKind.EDGE;
    }

    /**
     * Replaces the content of this row with an encoded payload.
     */
    public void applyPayload(RecordPayload payload, String json) {
        this.recordKind = payload.recordKind();
        this.kind = payload.kindTag();
        this.payloadJson = json;
        this.deleted = false;
        if (payload instanceof EdgePayload edge) {
            this.edgeKind = edge.getEdgeKind();
            this.tailObjectId = edge.getTailVertex().objectId();
            this.tailKind = edge.getTailVertex().kind();
            this.headObjectId = edge.getHeadVertex().objectId();
            this.headKind = edge.getHeadVertex().kind();
        } else {
            this.edgeKind = null;
            this.tailObjectId = null;
            this.tailKind = null;
            this.headObjectId = null;
            this.headKind = null;
        }
    }

    /**
     * Turns this row into a deletion marker for the record described by {@code shadowed}.
     * Kind and edge columns are kept so the marker is still found by kind and edge scans.
     */
    public void markDeleted(StoredRecord shadowed) {
        this.recordKind = shadowed.getRecordKind();
        this.kind = shadowed.getKind();
        this.edgeKind = shadowed.getEdgeKind();
        this.tailObjectId = shadowed.getTailObjectId();
        this.tailKind = shadowed.getTailKind();
        this.headObjectId = shadowed.getHeadObjectId();
        this.headKind = shadowed.getHeadKind();
        this.payloadJson = null;
        this.deleted = true;
    }

    /**
     * Copies content (not identity or tier) from a lower-tier row during promotion.
     */
    public void copyContentFrom(StoredRecord source) {
        this.recordKind = source.getRecordKind();
        this.kind = source.getKind();
        this.workspaceId = source.getWorkspaceId();
        this.payloadJson = source.getPayloadJson();
        this.deleted = source.isDeleted();
        this.edgeKind = source.getEdgeKind();
        this.tailObjectId = source.getTailObjectId();
        this.tailKind = source.getTailKind();
        this.headObjectId = source.getHeadObjectId();
        this.headKind = source.getHeadKind();
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
