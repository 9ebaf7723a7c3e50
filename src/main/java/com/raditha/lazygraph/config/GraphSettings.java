package com.raditha.lazygraph.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Process wide configuration loaded from a YAML file such as {@code graph.yml}.
 */
public final class GraphSettings {

    private static final Logger logger = LoggerFactory.getLogger(GraphSettings.class);

    public static final String DEFAULT_CONFIG = "graph.yml";

    /**
     * Replaced as a whole on every change and never mutated once published.
     */
    private static volatile Map<String, Object> props = Map.of();

    private GraphSettings() {
        // Utility class
    }

    /**
     * Load the configuration from the given YAML file, replacing whatever was loaded before.
     *
     * @throws IOException if the file cannot be read
     */
    public static synchronized void loadConfigMap(File configFile) throws IOException {
        try (InputStream in = new FileInputStream(configFile)) {
            Map<String, Object> loaded = new Yaml().load(in);
            props = loaded != null ? Collections.unmodifiableMap(new HashMap<>(loaded)) : Map.of();
        }
        logger.info("Loaded configuration from {}", configFile);
    }

    /**
     * Load {@code graph.yml} from the current directory, falling back to
     * {@code src/main/resources/graph.yml}.
     *
     * @throws IOException if neither file exists or the file cannot be read
     */
    public static void loadConfigMap() throws IOException {
        File config = new File(DEFAULT_CONFIG);
        if (!config.exists()) {
            config = new File("src/main/resources/" + DEFAULT_CONFIG);
        }
        if (!config.exists()) {
            throw new IOException(DEFAULT_CONFIG + " not found in current directory or src/main/resources/");
        }
        loadConfigMap(config);
    }

    /**
     * Returns the top level property with the given key if it is present and of the given type.
     */
    public static <T> Optional<T> getProperty(String key, Class<T> type) {
        Object value = props.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    /**
     * Returns the top level section with the given key, or an empty map.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> getSection(String key) {
        return getProperty(key, Map.class).orElse(Map.of());
    }

    public static synchronized void setProperty(String key, Object value) {
        Map<String, Object> updated = new HashMap<>(props);
        updated.put(key, value);
        props = Collections.unmodifiableMap(updated);
    }

    /**
     * Forget all loaded configuration.
     */
    public static synchronized void reset() {
        props = Map.of();
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> getSection(Map<String, Object> config, String key) {
        Object value = config.get(key);
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
    }

    public static String getString(Map<String, Object> config, String key, String defaultValue) {
        Object value = config.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public static boolean getBoolean(Map<String, Object> config, String key, boolean defaultValue) {
        Object value = config.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s.trim());
        }
        return defaultValue;
    }

    public static int getInt(Map<String, Object> config, String key, int defaultValue) {
        Object value = config.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value '{}' for key '{}', using default {}", s, key, defaultValue);
            }
        }
        return defaultValue;
    }
}
