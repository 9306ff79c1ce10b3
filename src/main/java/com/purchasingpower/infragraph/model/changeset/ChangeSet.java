package com.purchasingpower.infragraph.model.changeset;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * JPA Entity for a change set: a named, reviewable branch of proposed edits.
 *
 * Table: CHANGE_SETS
 */
@Entity
@Table(name = "CHANGE_SETS", indexes = {
        @Index(name = "idx_change_set_workspace_status", columnList = "workspace_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeSet {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "workspace_id", nullable = false, length = 100)
    private String workspaceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ChangeSetStatus status;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * When the change set was applied or abandoned.
     */
    @Column(name = "closed_at")
    private LocalDateTime closedAt;

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
