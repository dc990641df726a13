package com.purchasingpower.codegraph.configuration;

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
@ConfigurationProperties(prefix = "codegraph")
public class CodeGraphProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ScanProperties scan = new ScanProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private HistoryProperties history = new HistoryProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SearchProperties search = new SearchProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private StorageProperties storage = new StorageProperties();
}
