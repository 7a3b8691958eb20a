package com.purchasingpower.lahk.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code lahk.*} configuration properties with Spring's binder.
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties(LahkProperties.class)
public class ConfigurationPropertiesEnablerConfig {
}
