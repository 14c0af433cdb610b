package com.decisiontree.config;

import com.decisiontree.exception.ConfigurationException;

/**
 * Engine-wide settings.
 *
 * @param maxDepth     Maximum number of nodes on one root-to-leaf path; deeper
 *                     evaluation fails with a TreeDepthExceededException
 * @param traceEnabled Whether engines record the path taken through the tree
 */
public record EngineSettings(
        int maxDepth,
        boolean traceEnabled
) {
    public static final int DEFAULT_MAX_DEPTH = 256;

    public EngineSettings {
        if (maxDepth < 1) {
            throw new ConfigurationException("max-depth must be >= 1, got " + maxDepth);
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_MAX_DEPTH, true);
    }
}
