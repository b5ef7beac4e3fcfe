package com.docfederation.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the standalone {@code @ConfigurationProperties} classes that are not
 * component-scanned as {@code @Configuration}.
 */
@Configuration
@EnableConfigurationProperties({
    GlobalRetryConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
