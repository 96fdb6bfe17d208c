package com.purchasingpower.proofengine.config;

import com.purchasingpower.proofengine.configuration.ProofAnalysisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @ConfigurationProperties} classes with Spring's binder.
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
        ProofAnalysisProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
