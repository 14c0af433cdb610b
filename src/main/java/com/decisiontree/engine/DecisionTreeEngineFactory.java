package com.decisiontree.engine;

import com.decisiontree.config.EngineSettings;
import com.decisiontree.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Creates engines sharing one set of settings.
 */
public class DecisionTreeEngineFactory {

    private static final Logger log = LoggerFactory.getLogger(DecisionTreeEngineFactory.class);

    private final EngineSettings settings;

    public DecisionTreeEngineFactory(EngineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public <T> DecisionTreeEngine<T> create(Node<T> root) {
        log.info("Creating DecisionTreeEngine for '{}' (max-depth={}, trace-enabled={})",
                root.getName(), settings.maxDepth(), settings.traceEnabled());
        return new DecisionTreeEngine<>(root, settings);
    }

    public EngineSettings getSettings() {
        return settings;
    }
}
