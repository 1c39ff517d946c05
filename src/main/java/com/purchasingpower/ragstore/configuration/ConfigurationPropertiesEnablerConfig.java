package com.purchasingpower.ragstore.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the application's {@code @ConfigurationProperties} classes.
 *
 * <ul>
 *   <li>{@link AppProperties} - store, Neo4j, embedding, search, index, graph and executor settings
 *   <li>{@link RetryProperties} - backoff for upstream calls
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    AppProperties.class,
    RetryProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
