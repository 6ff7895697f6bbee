package com.purchasingpower.compliancekb.configuration;

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
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private OpenAiProperties openai = new OpenAiProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ItopProperties itop = new ItopProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private DriveProperties drive = new DriveProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SyncProperties sync = new SyncProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ChunkingProperties chunking = new ChunkingProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RetrievalProperties retrieval = new RetrievalProperties();
}
