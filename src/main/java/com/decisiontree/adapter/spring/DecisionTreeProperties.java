package com.decisiontree.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the decision tree engine.
 */
@ConfigurationProperties(prefix = "decision-tree")
public class DecisionTreeProperties {

    /**
     * Whether the engine beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the engine settings file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:decision-tree.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
