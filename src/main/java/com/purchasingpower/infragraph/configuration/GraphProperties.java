package com.purchasingpower.infragraph.configuration;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class GraphProperties {

    /**
     * Edge kinds accepted on write. Anything else is rejected as an invalid payload.
     */
    @NotEmpty
    private List<String> edgeKinds = new ArrayList<>(List.of("Includes", "Configures", "Deployment", "Component"));

    /**
     * Edge kinds that may not close a cycle.
     */
    private List<String> acyclicEdgeKinds = new ArrayList<>(List.of("Includes"));
}
