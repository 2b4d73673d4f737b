package com.raditha.checkcode.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads the analysis configuration from a YAML file with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > YAML file > defaults.
 * The YAML keys live under a top-level {@code check_code} entry:
 * <pre>
 * check_code:
 *   shingle_width: 5
 *   fingerprint_size: 50
 *   min_tokens: 25
 *   jaccard_min: 0.3
 *   duplication: true
 *   threads: 1
 *   source_suffix: .java
 *   exclude_patterns:
 *     - "**&#47;target/**"
 * </pre>
 */
public class AnalysisSettings {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisSettings.class);

    public static final String CONFIG_KEY = "check_code";
    public static final String DEFAULT_CONFIG_FILE = "checkcode.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private AnalysisSettings() {
    }

    /**
     * Load configuration, applying CLI overrides where provided.
     *
     * @param configFile     Explicit config file, or null to use {@value #DEFAULT_CONFIG_FILE} when present
     * @param duplicationCLI CLI duplication switch (null = use YAML/default)
     * @param threadsCLI     CLI worker thread count (null = use YAML/default)
     * @return Complete analysis configuration
     * @throws IOException if the config file cannot be read or is not valid YAML
     */
    public static AnalysisConfig loadConfig(@Nullable Path configFile,
            @Nullable Boolean duplicationCLI, @Nullable Integer threadsCLI) throws IOException {
        Map<String, Object> config = readSection(resolveConfigFile(configFile));
        return fromMap(config, duplicationCLI, threadsCLI);
    }

    /**
     * Build a configuration from an already parsed {@code check_code} section.
     */
    static AnalysisConfig fromMap(Map<String, Object> config,
            @Nullable Boolean duplicationCLI, @Nullable Integer threadsCLI) {
        AnalysisConfig defaults = AnalysisConfig.defaults();

        boolean duplication = duplicationCLI != null
                ? duplicationCLI
                : getBoolean(config, "duplication", defaults.duplication());
        int threads = threadsCLI != null
                ? threadsCLI
                : getInt(config, "threads", defaults.parallelism());

        return new AnalysisConfig(
                getInt(config, "shingle_width", defaults.shingleWidth()),
                getInt(config, "fingerprint_size", defaults.fingerprintSize()),
                getInt(config, "min_tokens", defaults.minTokens()),
                getDouble(config, "jaccard_min", defaults.jaccardMin()),
                duplication,
                threads,
                getString(config, "source_suffix", defaults.sourceSuffix()),
                getListString(config, "exclude_patterns"));
    }

    private static @Nullable Path resolveConfigFile(@Nullable Path configFile) {
        if (configFile != null) {
            if (!Files.isRegularFile(configFile)) {
                throw new IllegalArgumentException("Config file not found: " + configFile);
            }
            return configFile;
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        return Files.isRegularFile(fallback) ? fallback : null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readSection(@Nullable Path file) throws IOException {
        if (file == null) {
            return Map.of();
        }
        logger.info("Loading configuration from {}", file.toAbsolutePath());
        Object root = YAML.readValue(file.toFile(), Object.class);
        if (!(root instanceof Map)) {
            logger.warn("Ignoring {}: top level is not a mapping", file);
            return Map.of();
        }
        Object section = ((Map<String, Object>) root).get(CONFIG_KEY);
        if (!(section instanceof Map)) {
            logger.warn("No '{}' section in {}, using defaults", CONFIG_KEY, file);
            return Map.of();
        }
        return (Map<String, Object>) section;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(key + " must be a list of strings, got: " + value);
        }
        List<String> strings = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof String text)) {
                throw new IllegalArgumentException(key + " entries must be strings, got: " + item);
            }
            strings.add(text);
        }
        return strings;
    }
}
