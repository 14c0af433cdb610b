package com.decisiontree.adapter.spring;

import com.decisiontree.config.EngineSettings;
import com.decisiontree.config.EngineSettingsLoader;
import com.decisiontree.engine.DecisionTreeEngineFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the decision tree engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "decision-tree", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(DecisionTreeProperties.class)
public class DecisionTreeAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DecisionTreeAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public EngineSettings engineSettings(DecisionTreeProperties properties) {
        return EngineSettingsLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionTreeEngineFactory decisionTreeEngineFactory(EngineSettings settings) {
        log.info("Creating DecisionTreeEngineFactory (max-depth={}, trace-enabled={})",
                settings.maxDepth(), settings.traceEnabled());
        return new DecisionTreeEngineFactory(settings);
    }
}
