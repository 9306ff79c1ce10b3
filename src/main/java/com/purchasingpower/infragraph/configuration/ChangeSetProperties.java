package com.purchasingpower.infragraph.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ChangeSetProperties {

    /**
     * Prefix of the generated name when a change set is created without one.
     */
    @NotBlank
    private String defaultNamePrefix = "change-set";
}
