package com.purchasingpower.infragraph.service.impl;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.purchasingpower.infragraph.configuration.VersioningProperties;
import com.purchasingpower.infragraph.exception.RecordNotFoundException;
import com.purchasingpower.infragraph.model.changeset.ChangeSet;
import com.purchasingpower.infragraph.model.changeset.EditSession;
import com.purchasingpower.infragraph.model.dto.ApplicationContextView;
import com.purchasingpower.infragraph.model.graph.EdgeKinds;
import com.purchasingpower.infragraph.model.graph.TierContext;
import com.purchasingpower.infragraph.model.graph.VersionedRecord;
import com.purchasingpower.infragraph.model.payload.ApplicationPayload;
import com.purchasingpower.infragraph.model.payload.EntityPayload;
import com.purchasingpower.infragraph.model.payload.NodePayload;
import com.purchasingpower.infragraph.model.payload.SystemPayload;
import com.purchasingpower.infragraph.service.ApplicationService;
import com.purchasingpower.infragraph.service.ChangeSetService;
import com.purchasingpower.infragraph.service.EditSessionService;
import com.purchasingpower.infragraph.service.TierTransactions;
import com.purchasingpower.infragraph.service.VersionedEntityStore;
import com.purchasingpower.infragraph.service.graph.GraphTraversalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicationServiceImpl implements ApplicationService {

    private final TierTransactions transactions;
    private final VersionedEntityStore entityStore;
    private final ChangeSetService changeSetService;
    private final EditSessionService editSessionService;
    private final GraphTraversalService graphTraversalService;
    private final VersioningProperties properties;

    @Override
    public VersionedRecord createApplication(String name, String workspaceId) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "name is required");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(workspaceId), "workspaceId is required");

        return transactions.write("createApplication", () -> {
            ChangeSet changeSet = changeSetService.create(workspaceId, "create application " + name);
            EditSession session = editSessionService.create(changeSet.getId(), workspaceId);
            TierContext draft = TierContext.editSession(workspaceId, changeSet.getId(), session.getId());

            VersionedRecord application = entityStore.create(new ApplicationPayload(name), draft);
            entityStore.create(NodePayload.forEntity(name, application.getObjectId(), ApplicationPayload.KIND), draft);

            Optional<VersionedRecord> system = findDefaultSystem(workspaceId);
            system.ifPresent(s -> entityStore.connect(EdgeKinds.INCLUDES, s.getObjectId(),
                    application.getObjectId(), draft));
            if (system.isEmpty()) {
                log.warn("No '{}' system in workspace {}; application {} is not included anywhere",
                        properties.getApplications().getDefaultSystemName(), workspaceId, name);
            }

            editSessionService.save(session.getId());
            changeSetService.apply(changeSet.getId());

            log.info("🚀 Created application '{}' ({}) in workspace {}", name, application.getObjectId(), workspaceId);
            return entityStore.resolve(application.getObjectId(), TierContext.head(workspaceId));
        });
    }

    @Override
    public List<VersionedRecord> listApplications(String workspaceId) {
        return entityStore.listByKind(ApplicationPayload.KIND, TierContext.head(workspaceId));
    }

    @Override
    public ApplicationContextView applicationContext(String applicationId, String workspaceId) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(applicationId), "applicationId is required");
        TierContext head = TierContext.head(workspaceId);

        return transactions.read("applicationContext", () -> {
            VersionedRecord application = entityStore.find(applicationId, head)
                    .filter(record -> ApplicationPayload.KIND.equals(record.getKind()))
                    .orElseThrow(() -> new RecordNotFoundException("Application", applicationId));

            return ApplicationContextView.builder()
                    .applicationId(applicationId)
                    .applicationName(application.payloadAs(ApplicationPayload.class).getName())
                    .systems(entityStore.listByKind(SystemPayload.KIND, head))
                    .openChangeSets(changeSetService.listOpen(workspaceId))
                    .revisions(changeSetService.listApplied(workspaceId))
                    .build();
        });
    }

    @Override
    public List<VersionedRecord> allEntities(String applicationId, TierContext context) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(applicationId), "applicationId is required");

        return transactions.read("allEntities", () -> {
            // A missing root fails; only missing successors are omitted.
            VersionedRecord application = entityStore.resolve(applicationId, context);
            if (!ApplicationPayload.KIND.equals(application.getKind())) {
                throw new RecordNotFoundException("Application", applicationId,
                        "object is a " + application.getKind());
            }
            return graphTraversalService.successorEntities(EdgeKinds.INCLUDES, applicationId, context);
        });
    }

    private Optional<VersionedRecord> findDefaultSystem(String workspaceId) {
        String systemName = properties.getApplications().getDefaultSystemName();
        return entityStore.listByKind(SystemPayload.KIND, TierContext.head(workspaceId)).stream()
                .filter(record -> systemName.equals(record.payloadAs(EntityPayload.class).getName()))
                .findFirst();
    }
}
