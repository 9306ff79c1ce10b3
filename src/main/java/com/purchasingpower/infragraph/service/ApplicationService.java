package com.purchasingpower.infragraph.service;

import com.purchasingpower.infragraph.model.dto.ApplicationContextView;
import com.purchasingpower.infragraph.model.graph.TierContext;
import com.purchasingpower.infragraph.model.graph.VersionedRecord;

import java.util.List;

/**
 * Application-level workflows composed from the store, lifecycle and traversal services.
 */
public interface ApplicationService {

    /**
     * Create an application through a one-shot change set: the entity, its node and an
     * Includes edge from the default system, applied to Head in one transaction.
     *
     * @return the application as resolved at Head
     */
    VersionedRecord createApplication(String name, String workspaceId);

    List<VersionedRecord> listApplications(String workspaceId);

    ApplicationContextView applicationContext(String applicationId, String workspaceId);

    /**
     * Entities the application includes, as seen from the context. Entities that do not
     * resolve there are left out.
     *
     * @throws com.purchasingpower.infragraph.exception.RecordNotFoundException if the application
     *         itself does not resolve in the context or is not an application
     */
    List<VersionedRecord> allEntities(String applicationId, TierContext context);
}
