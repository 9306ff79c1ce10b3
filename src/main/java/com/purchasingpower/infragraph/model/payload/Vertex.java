package com.purchasingpower.infragraph.model.payload;

import jakarta.validation.constraints.NotBlank;

/**
 * One end of an edge.
 */
public record Vertex(
        @NotBlank(message = "Vertex objectId is required") String objectId,
        @NotBlank(message = "Vertex kind is required") String kind) {
}
