package com.purchasingpower.lahk.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "lahk")
public class LahkProperties {

    /** Documents longer than this are rejected before parsing. */
    @Min(1)
    private int maxDocumentChars = 1_000_000;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private DiagnosticsProperties diagnostics = new DiagnosticsProperties();
}
