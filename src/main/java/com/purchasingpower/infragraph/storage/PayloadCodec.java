package com.purchasingpower.infragraph.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.infragraph.exception.InvalidPayloadException;
import com.purchasingpower.infragraph.exception.PayloadSerializationException;
import com.purchasingpower.infragraph.model.graph.StoredRecord;
import com.purchasingpower.infragraph.model.payload.EdgePayload;
import com.purchasingpower.infragraph.model.payload.RecordPayload;
import com.purchasingpower.infragraph.util.ExternalCallLogger;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts payloads to and from the JSON stored in {@code payload_json}.
 *
 * <p>Encoding validates first: Bean Validation constraints on the payload and, for
 * edges, that the edge kind is declared. Decoding checks that the decoded payload
 * agrees with the record kind and kind tag stored on the row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PayloadCodec {

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final EdgeKindRegistry edgeKindRegistry;

    public String encode(String objectId, RecordPayload payload) {
        validate(objectId, payload);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new PayloadSerializationException(objectId, "cannot encode " + payload.kindTag(), e);
        }
    }

    public RecordPayload decode(StoredRecord row) {
        if (row.isDeleted() || row.getPayloadJson() == null) {
            throw new PayloadSerializationException(row.getObjectId(), "deletion marker has no payload");
        }
        RecordPayload payload = decode(row.getObjectId(), row.getPayloadJson());
        if (payload.recordKind() != row.getRecordKind() || !payload.kindTag().equals(row.getKind())) {
            throw new PayloadSerializationException(row.getObjectId(),
                    "stored as " + row.getRecordKind() + "/" + row.getKind()
                            + " but decoded as " + payload.recordKind() + "/" + payload.kindTag());
        }
        return payload;
    }

    /**
     * Decode a payload snapshot, e.g. the committed JSON carried by a change event.
     * Every call returns a new instance.
     */
    public RecordPayload decode(String objectId, String json) {
        try {
            return objectMapper.readValue(json, RecordPayload.class);
        } catch (JsonProcessingException e) {
            log.error("Undecodable payload for {}: {}", objectId, ExternalCallLogger.truncate(json, 200));
            throw new PayloadSerializationException(objectId, "cannot decode stored payload", e);
        }
    }

    /**
     * Payload as a flat property map, for diffs.
     */
    public Map<String, Object> toProperties(RecordPayload payload) {
        return objectMapper.convertValue(payload, objectMapper.getTypeFactory()
                .constructMapType(Map.class, String.class, Object.class));
    }

    public void validate(String objectId, RecordPayload payload) {
        if (payload == null) {
            throw new InvalidPayloadException("Payload for " + objectId + " is required");
        }
        Set<ConstraintViolation<RecordPayload>> violations = validator.validate(payload);
        List<String> problems = new ArrayList<>();
        violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .forEach(v -> problems.add(v.getPropertyPath() + ": " + v.getMessage()));
        if (payload instanceof EdgePayload edge
                && edge.getEdgeKind() != null
                && !edgeKindRegistry.isDeclared(edge.getEdgeKind())) {
            problems.add("edgeKind: '" + edge.getEdgeKind() + "' is not a declared edge kind "
                    + edgeKindRegistry.declaredKinds());
        }
        if (!problems.isEmpty()) {
            throw new InvalidPayloadException(objectId, problems);
        }
    }
}
