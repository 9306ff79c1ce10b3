package com.purchasingpower.infragraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "infragraph")
public class VersioningProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private TransactionProperties transactions = new TransactionProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ChangeSetProperties changeSets = new ChangeSetProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GraphProperties graph = new GraphProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ApplicationProperties applications = new ApplicationProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private NotificationProperties notifications = new NotificationProperties();
}
