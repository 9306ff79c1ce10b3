package com.purchasingpower.infragraph.model.payload;

import com.purchasingpower.infragraph.model.graph.RecordKind;
import jakarta.validation.constraints.NotBlank;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Diagram node standing for one entity, with its position on the schematic.
 */
@Getter
@Setter
@NoArgsConstructor
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class NodePayload extends ExtensibleFields implements RecordPayload {

    public static final String KIND = "node";

    @NotBlank(message = "Node name is required")
    private String name;

    @NotBlank(message = "Node must reference an entity")
    private String entityObjectId;

    @NotBlank(message = "Node must declare the entity kind")
    private String entityKind;

    private int x;

    private int y;

    public static NodePayload forEntity(String name, String entityObjectId, String entityKind) {
        NodePayload node = new NodePayload();
        node.setName(name);
        node.setEntityObjectId(entityObjectId);
        node.setEntityKind(entityKind);
        return node;
    }

    @Override
    public RecordKind recordKind() {
        return RecordKind.NODE;
    }

    @Override
    public String kindTag() {
        return KIND;
    }
}
