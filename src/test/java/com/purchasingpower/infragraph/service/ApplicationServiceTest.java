package com.purchasingpower.infragraph.service;

import com.purchasingpower.infragraph.TierTestSupport;
import com.purchasingpower.infragraph.exception.RecordNotFoundException;
import com.purchasingpower.infragraph.model.dto.ApplicationContextView;
import com.purchasingpower.infragraph.model.graph.EdgeKinds;
import com.purchasingpower.infragraph.model.graph.TierContext;
import com.purchasingpower.infragraph.model.graph.TierKey;
import com.purchasingpower.infragraph.model.graph.VersionedRecord;
import com.purchasingpower.infragraph.model.payload.ApplicationPayload;
import com.purchasingpower.infragraph.model.payload.NodePayload;
import com.purchasingpower.infragraph.model.payload.ServicePayload;
import com.purchasingpower.infragraph.model.payload.SystemPayload;
import com.purchasingpower.infragraph.service.graph.GraphTraversalService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Application Service Tests")
class ApplicationServiceTest extends TierTestSupport {

    @Autowired
    private ApplicationService applicationService;

    @Autowired
    private GraphTraversalService graphTraversalService;

    @Test
    @DisplayName("Should create the application at Head and include it in production")
    void createApplication_includedInDefaultSystem() {
        // Given
        VersionedRecord production = seedHead(new SystemPayload("production"));

        // When
        VersionedRecord application = applicationService.createApplication("storefront", workspaceId);

        // Then
        assertThat(application.getTierKey()).isEqualTo(TierKey.HEAD);
        assertEquals(ApplicationPayload.KIND, application.getKind());
        assertEquals("storefront", nameOf(application));
        assertThat(graphTraversalService.successorEntities(EdgeKinds.INCLUDES, production.getObjectId(), head()))
                .extracting(VersionedRecord::getObjectId)
                .containsExactly(application.getObjectId());
        assertThat(entityStore.listByKind(NodePayload.KIND, head()))
                .singleElement()
                .satisfies(node -> assertEquals(application.getObjectId(),
                        node.payloadAs(NodePayload.class).getEntityObjectId()));
        assertThat(changeSetService.listOpen(workspaceId)).isEmpty();
    }

    @Test
    @DisplayName("Should still create the application when there is no default system")
    void createApplication_withoutDefaultSystem() {
        VersionedRecord application = applicationService.createApplication("lonely", workspaceId);

        assertThat(applicationService.listApplications(workspaceId))
                .extracting(VersionedRecord::getObjectId)
                .containsExactly(application.getObjectId());
        assertThat(entityStore.listByKind("edge", head())).isEmpty();
    }

    @Test
    @DisplayName("Should assemble the application context")
    void applicationContext() {
        seedHead(new SystemPayload("production"));
        VersionedRecord application = applicationService.createApplication("inventory", workspaceId);
        changeSetService.create(workspaceId, "pending work");

        ApplicationContextView context = applicationService.applicationContext(application.getObjectId(), workspaceId);

        assertEquals("inventory", context.getApplicationName());
        assertThat(context.getSystems()).extracting(TierTestSupport::nameOf).containsExactly("production");
        assertThat(context.getOpenChangeSets()).hasSize(1);
        assertThat(context.getRevisions()).hasSize(2);
        assertThrows(RecordNotFoundException.class,
                () -> applicationService.applicationContext(uniqueId("application"), workspaceId));
    }

    @Test
    @DisplayName("All entities should follow Includes edges in the given context")
    void allEntities() {
        // Given
        VersionedRecord application = applicationService.createApplication("shop", workspaceId);
        TierContext draft = openDraft("add services");
        VersionedRecord api = entityStore.create(new ServicePayload("api"), draft);
        VersionedRecord gone = entityStore.create(new ServicePayload("gone"), draft);
        entityStore.connect(EdgeKinds.INCLUDES, application.getObjectId(), api.getObjectId(), draft);
        entityStore.connect(EdgeKinds.INCLUDES, application.getObjectId(), gone.getObjectId(), draft);
        entityStore.delete(gone.getObjectId(), draft);

        // Then
        assertThat(applicationService.allEntities(application.getObjectId(), draft))
                .extracting(VersionedRecord::getObjectId)
                .containsExactly(api.getObjectId());
        assertThat(applicationService.allEntities(application.getObjectId(), head())).isEmpty();
    }

    @Test
    @DisplayName("All entities should fail when the application does not resolve")
    void allEntities_unknownOrDeletedApplication() {
        // Given
        VersionedRecord application = applicationService.createApplication("retired", workspaceId);
        VersionedRecord system = seedHead(new SystemPayload("staging"));
        TierContext draft = openDraft("retire application");
        entityStore.delete(application.getObjectId(), draft);

        // Then
        RecordNotFoundException unknown = assertThrows(RecordNotFoundException.class,
                () -> applicationService.allEntities(uniqueId("application"), head()));
        assertEquals("Record", unknown.getSubject());
        assertThrows(RecordNotFoundException.class,
                () -> applicationService.allEntities(application.getObjectId(), draft));
        RecordNotFoundException notAnApplication = assertThrows(RecordNotFoundException.class,
                () -> applicationService.allEntities(system.getObjectId(), head()));
        assertEquals("Application", notAnApplication.getSubject());
        assertThat(applicationService.allEntities(application.getObjectId(), head())).isEmpty();
    }
}
