package com.purchasingpower.infragraph.model.payload;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.purchasingpower.infragraph.model.graph.RecordKind;

import java.util.Map;

/**
 * Structured document stored with every versioned record.
 *
 * <p>Serialized as JSON with a {@code kind} discriminator, for example:
 * <pre>
 * {"kind":"application","name":"app-1"}
 * {"kind":"edge","edgeKind":"Includes","tailVertex":{...},"headVertex":{...}}
 * </pre>
 * Properties the schema does not know about are kept in {@link #getExtensions()}
 * and written back unchanged.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ApplicationPayload.class, name = ApplicationPayload.KIND),
        @JsonSubTypes.Type(value = SystemPayload.class, name = SystemPayload.KIND),
        @JsonSubTypes.Type(value = ServicePayload.class, name = ServicePayload.KIND),
        @JsonSubTypes.Type(value = NodePayload.class, name = NodePayload.KIND),
        @JsonSubTypes.Type(value = EdgePayload.class, name = EdgePayload.KIND)
})
public interface RecordPayload {

    /**
     * Structural kind this payload may be stored under.
     */
    RecordKind recordKind();

    /**
     * The {@code kind} discriminator, e.g. "application".
     */
    String kindTag();

    Map<String, Object> getExtensions();

    void putExtension(String key, Object value);
}
