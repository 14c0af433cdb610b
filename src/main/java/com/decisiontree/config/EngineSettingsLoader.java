package com.decisiontree.config;

import com.decisiontree.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads engine settings from YAML files.
 * <pre>
 * decision-tree:
 *   max-depth: 64
 *   trace-enabled: true
 * </pre>
 * The keys may also sit at the root of the document.
 */
public final class EngineSettingsLoader {

    private static final Logger log = LoggerFactory.getLogger(EngineSettingsLoader.class);

    private static final String SECTION = "decision-tree";

    private EngineSettingsLoader() {
    }

    /**
     * Load settings from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the settings file
     * @return Loaded settings
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public static EngineSettings load(String path) {
        log.info("Loading decision tree settings from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Settings file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load settings from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse settings from a YAML stream.
     */
    @SuppressWarnings("unchecked")
    public static EngineSettings parse(InputStream inputStream) {
        Object document;
        try {
            document = new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in settings: " + e.getMessage(), e);
        }

        if (document == null) {
            log.warn("Settings file is empty, using defaults");
            return EngineSettings.defaults();
        }
        if (!(document instanceof Map)) {
            throw new ConfigurationException("Settings must be a YAML mapping");
        }

        Map<String, Object> root = (Map<String, Object>) document;
        Object section = root.containsKey(SECTION) ? root.get(SECTION) : root;
        if (section == null) {
            log.warn("Section '{}' is empty, using defaults", SECTION);
            return EngineSettings.defaults();
        }
        if (!(section instanceof Map)) {
            throw new ConfigurationException("Section '" + SECTION + "' must be a YAML mapping");
        }
        Map<String, Object> settingsMap = (Map<String, Object>) section;

        Object maxDepthValue = settingsMap.containsKey("max-depth")
                ? settingsMap.get("max-depth")
                : settingsMap.get("maxDepth");
        Object traceValue = settingsMap.containsKey("trace-enabled")
                ? settingsMap.get("trace-enabled")
                : settingsMap.get("traceEnabled");

        int maxDepth = getInt(maxDepthValue, "max-depth", EngineSettings.DEFAULT_MAX_DEPTH);
        boolean traceEnabled = getBoolean(traceValue, "trace-enabled", true);

        EngineSettings settings = new EngineSettings(maxDepth, traceEnabled);
        log.info("Loaded decision tree settings: max-depth={}, trace-enabled={}",
                settings.maxDepth(), settings.traceEnabled());
        return settings;
    }

    // Helper methods

    private static int getInt(Object value, String key, int defaultValue) {
        if (value == null) return defaultValue;
        if (value instanceof Integer) return (Integer) value;
        // Long, BigInteger and fractions from YAML go through parseInt so they are range-checked
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer between "
                    + Integer.MIN_VALUE + " and " + Integer.MAX_VALUE + ", got: " + value, e);
        }
    }

    private static boolean getBoolean(Object value, String key, boolean defaultValue) {
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text)) return true;
        if ("false".equalsIgnoreCase(text)) return false;
        throw new ConfigurationException("'" + key + "' must be true or false, got: " + value);
    }
}
