package com.purchasingpower.infragraph.storage;

import com.purchasingpower.infragraph.exception.InvalidPayloadException;
import com.purchasingpower.infragraph.exception.PayloadSerializationException;
import com.purchasingpower.infragraph.model.graph.RecordKind;
import com.purchasingpower.infragraph.model.graph.StoredRecord;
import com.purchasingpower.infragraph.model.graph.TierKey;
import com.purchasingpower.infragraph.model.payload.ApplicationPayload;
import com.purchasingpower.infragraph.model.payload.EdgePayload;
import com.purchasingpower.infragraph.model.payload.RecordPayload;
import com.purchasingpower.infragraph.model.payload.ServicePayload;
import com.purchasingpower.infragraph.model.payload.Vertex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Payload Codec Tests")
class PayloadCodecTest {

    @Autowired
    private PayloadCodec payloadCodec;

    @Autowired
    private EdgeKindRegistry edgeKindRegistry;

    @Test
    @DisplayName("Unknown properties should survive decoding and re-encoding")
    void keepsExtensions() {
        // Given: JSON written by a newer schema
        StoredRecord row = row("app:ext", RecordKind.ENTITY, ApplicationPayload.KIND,
                "{\"kind\":\"application\",\"name\":\"crm\",\"owner\":\"team-a\",\"tags\":[\"pci\"]}");

        // When
        RecordPayload decoded = payloadCodec.decode(row);
        String reencoded = payloadCodec.encode("app:ext", decoded);

        // Then
        assertThat(decoded).isInstanceOf(ApplicationPayload.class);
        assertEquals("team-a", decoded.getExtensions().get("owner"));
        assertThat(reencoded).contains("\"owner\":\"team-a\"").contains("\"kind\":\"application\"");
        Map<String, Object> properties = payloadCodec.toProperties(decoded);
        assertEquals("crm", properties.get("name"));
        assertThat(properties).containsKey("tags");
    }

    @Test
    @DisplayName("Bean Validation failures should be reported per property")
    void rejectsInvalidPayload() {
        ServicePayload service = new ServicePayload("");
        service.setReplicas(-1);

        InvalidPayloadException e = assertThrows(InvalidPayloadException.class,
                () -> payloadCodec.encode("service:bad", service));

        assertThat(e.getViolations()).hasSize(2);
        assertThat(e.getViolations()).anyMatch(v -> v.startsWith("name"));
        assertThat(e.getViolations()).anyMatch(v -> v.startsWith("replicas"));
    }

    @Test
    @DisplayName("Edges need a declared kind and both vertices")
    void validatesEdges() {
        EdgePayload undeclared = new EdgePayload("Teleports", new Vertex("a", "service"), new Vertex("b", "service"));
        EdgePayload headless = new EdgePayload("Includes", new Vertex("a", "service"), null);

        assertThrows(InvalidPayloadException.class, () -> payloadCodec.encode("edge:1", undeclared));
        InvalidPayloadException e = assertThrows(InvalidPayloadException.class,
                () -> payloadCodec.encode("edge:2", headless));
        assertThat(e.getViolations()).anyMatch(v -> v.startsWith("headVertex"));
        assertThat(edgeKindRegistry.isAcyclic("Includes")).isTrue();
        assertThat(edgeKindRegistry.isAcyclic("Configures")).isFalse();
    }

    @Test
    @DisplayName("A payload that disagrees with its row should fail Serialization")
    void rejectsKindMismatch() {
        StoredRecord mislabeled = row("node:1", RecordKind.NODE, "node",
                "{\"kind\":\"application\",\"name\":\"crm\"}");
        StoredRecord garbage = row("app:2", RecordKind.ENTITY, ApplicationPayload.KIND, "{not json");

        assertThrows(PayloadSerializationException.class, () -> payloadCodec.decode(mislabeled));
        PayloadSerializationException e = assertThrows(PayloadSerializationException.class,
                () -> payloadCodec.decode(garbage));
        assertEquals("app:2", e.getObjectId());
    }

    private static StoredRecord row(String objectId, RecordKind recordKind, String kind, String json) {
        StoredRecord row = StoredRecord.newRow(objectId, TierKey.HEAD, "ws");
        row.setRecordKind(recordKind);
        row.setKind(kind);
        row.setPayloadJson(json);
        return row;
    }
}
