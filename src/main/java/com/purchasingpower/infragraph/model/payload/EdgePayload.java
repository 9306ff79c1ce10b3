package com.purchasingpower.infragraph.model.payload;

import com.purchasingpower.infragraph.model.graph.RecordKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Directed relationship from a tail vertex to a head vertex.
 */
@Getter
@Setter
@NoArgsConstructor
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class EdgePayload extends ExtensibleFields implements RecordPayload {

    public static final String KIND = "edge";

    @NotBlank(message = "Edge kind is required")
    private String edgeKind;

    @Valid
    @NotNull(message = "Edge tail vertex is required")
    private Vertex tailVertex;

    @Valid
    @NotNull(message = "Edge head vertex is required")
    private Vertex headVertex;

    private boolean bidirectional;

    public EdgePayload(String edgeKind, Vertex tailVertex, Vertex headVertex) {
        this.edgeKind = edgeKind;
        this.tailVertex = tailVertex;
        this.headVertex = headVertex;
    }

    @Override
    public RecordKind recordKind() {
        return RecordKind.EDGE;
    }

    @Override
    public String kindTag() {
        return KIND;
    }
}
