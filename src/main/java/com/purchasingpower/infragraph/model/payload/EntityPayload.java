package com.purchasingpower.infragraph.model.payload;

import com.purchasingpower.infragraph.model.graph.RecordKind;
import jakarta.validation.constraints.NotBlank;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Common fields of every entity kind.
 */
@Getter
@Setter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public abstract class EntityPayload extends ExtensibleFields implements RecordPayload {

    @NotBlank(message = "Entity name is required")
    private String name;

    private String description;

    protected EntityPayload() {
    }

    protected EntityPayload(String name) {
        this.name = name;
    }

    @Override
    public RecordKind recordKind() {
        return RecordKind.ENTITY;
    }
}
