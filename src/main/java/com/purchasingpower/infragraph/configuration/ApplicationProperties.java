package com.purchasingpower.infragraph.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ApplicationProperties {

    /**
     * System that new applications are attached to with an Includes edge, if it exists at Head.
     */
    @NotBlank
    private String defaultSystemName = "production";
}
