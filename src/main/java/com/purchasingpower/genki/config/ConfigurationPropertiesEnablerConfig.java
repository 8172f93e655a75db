package com.purchasingpower.genki.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the standalone {@code @ConfigurationProperties} classes.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link GlobalRetryConfig} - GitHub retry and backoff settings
 * </ul>
 *
 * <p>{@code AppProperties} is a {@code @Configuration} itself and needs no entry here.
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    GlobalRetryConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
