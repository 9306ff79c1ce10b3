package com.purchasingpower.infragraph.model.changeset;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * JPA Entity for an edit session: one user's scratch layer under a change set.
 *
 * Table: EDIT_SESSIONS
 */
@Entity
@Table(name = "EDIT_SESSIONS", indexes = {
        @Index(name = "idx_edit_session_change_set", columnList = "change_set_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EditSession {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "change_set_id", nullable = false, length = 64)
    private String changeSetId;

    @Column(name = "workspace_id", nullable = false, length = 100)
    private String workspaceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private EditSessionStatus status;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * When the session was saved or canceled.
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
