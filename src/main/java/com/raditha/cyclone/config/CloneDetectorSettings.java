package com.raditha.cyclone.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raditha.cyclone.parser.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads clone detector configuration from a YAML file with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > YAML > preset defaults. The YAML
 * file holds a top-level {@code clone_detector} map:
 *
 * <pre>
 * clone_detector:
 *   preset: moderate
 *   min_pattern_nodes: 10
 *   similarity_threshold: 0.75
 *   anchor_kinds: [METHOD_DECLARATION, FOR_STMT]
 * </pre>
 */
public class CloneDetectorSettings {

    private static final Logger logger = LoggerFactory.getLogger(CloneDetectorSettings.class);

    static final String CONFIG_KEY = "clone_detector";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private CloneDetectorSettings() {
    }

    /**
     * Values given on the command line. Zero, false and null mean "not given".
     *
     * @param preset           preset name
     * @param minPatternNodes  minimum pattern size
     * @param maxPatternDepth  depth cap
     * @param thresholdPercent similarity threshold as a percentage 1-100
     * @param topK             pairs kept per pattern
     * @param exhaustive       force the approximate pass
     * @param parallelism      worker threads
     */
    public record Overrides(
            String preset,
            int minPatternNodes,
            int maxPatternDepth,
            int thresholdPercent,
            int topK,
            boolean exhaustive,
            int parallelism) {

        public static Overrides none() {
            return new Overrides(null, 0, 0, 0, 0, false, 0);
        }
    }

    /**
     * Read the {@code clone_detector} map of a YAML file.
     *
     * @param configFile YAML file, may be null
     * @return the map, empty if the file is null or has no such key
     * @throws IOException            if the file cannot be read
     * @throws ConfigurationException if the file is missing or not a YAML map
     */
    public static Map<String, Object> readYaml(Path configFile) throws IOException {
        if (configFile == null) {
            return Map.of();
        }
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigurationException("Configuration file not found: " + configFile);
        }
        JsonNode root;
        try {
            root = YAML.readTree(configFile.toFile());
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid YAML in " + configFile + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            logger.warn("Configuration file {} is empty, using defaults", configFile);
            return Map.of();
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Configuration file " + configFile + " must contain a YAML map");
        }
        JsonNode section = root.get(CONFIG_KEY);
        if (section == null || section.isNull()) {
            logger.warn("No '{}' section in {}, using defaults", CONFIG_KEY, configFile);
            return Map.of();
        }
        if (!section.isObject()) {
            throw new ConfigurationException("'" + CONFIG_KEY + "' must be a map in " + configFile);
        }
        return YAML.convertValue(section, new TypeReference<Map<String, Object>>() {
        });
    }

    /**
     * Load configuration from a YAML file, applying CLI overrides where provided.
     */
    public static CloneDetectionConfig loadConfig(Path configFile, Overrides cli) throws IOException {
        return loadConfig(readYaml(configFile), cli);
    }

    /**
     * Build the configuration from an already parsed {@code clone_detector}
     * map, applying CLI overrides where provided.
     *
     * @param config map of YAML keys, may be empty
     * @param cli    command line values
     * @return validated configuration
     * @throws ConfigurationException if a value has the wrong type or is out of range
     */
    public static CloneDetectionConfig loadConfig(Map<String, Object> config, Overrides cli) {
        // Determine preset (CLI > YAML > moderate)
        String presetName = cli.preset() != null ? cli.preset() : getString(config, "preset", "moderate");
        CloneDetectionConfig base = CloneDetectionConfig.preset(presetName);

        Language language = config.containsKey("language")
                ? Language.fromName(getString(config, "language", "JAVA"))
                : base.language();
        int minNodes = cli.minPatternNodes() != 0
                ? cli.minPatternNodes()
                : getInt(config, "min_pattern_nodes", base.minPatternNodes());
        int maxDepth = cli.maxPatternDepth() != 0
                ? cli.maxPatternDepth()
                : getInt(config, "max_pattern_depth", base.maxPatternDepth());
        int maxNodes = getInt(config, "max_pattern_nodes", Math.max(base.maxPatternNodes(), minNodes));
        double threshold = cli.thresholdPercent() != 0
                ? cli.thresholdPercent() / 100.0
                : getDouble(config, "similarity_threshold", base.similarityThreshold());
        int topK = cli.topK() != 0 ? cli.topK() : getInt(config, "top_k", base.topK());
        boolean exhaustive = cli.exhaustive() || getBoolean(config, "exhaustive", base.exhaustive());
        boolean verify = getBoolean(config, "verify_exact_matches", base.verifyExactMatches());
        long maxCells = getLong(config, "max_comparison_cells", base.maxComparisonCells());
        int parallelism = cli.parallelism() != 0
                ? cli.parallelism()
                : getInt(config, "parallelism", base.parallelism());

        Set<NodeKind> anchors = config.containsKey("anchor_kinds")
                ? parseAnchorKinds(getListString(config, "anchor_kinds"))
                : base.anchorKinds();
        List<String> excludePatterns = config.containsKey("exclude_patterns")
                ? getListString(config, "exclude_patterns")
                : base.excludePatterns();

        CloneDetectionConfig result = new CloneDetectionConfig(
                language,
                minNodes,
                maxDepth,
                maxNodes,
                threshold,
                topK,
                anchors,
                exhaustive,
                verify,
                maxCells,
                parallelism,
                excludePatterns);
        logger.debug("Loaded configuration {}", result);
        return result;
    }

    /**
     * Accepts constant names ({@code METHOD_DECLARATION}) as well as grammar
     * type names ({@code MethodDeclaration}).
     */
    static Set<NodeKind> parseAnchorKinds(List<String> names) {
        Set<NodeKind> kinds = EnumSet.noneOf(NodeKind.class);
        for (String name : names) {
            kinds.add(parseKind(name.trim()));
        }
        return kinds;
    }

    private static NodeKind parseKind(String name) {
        for (NodeKind kind : NodeKind.values()) {
            if (kind.name().equalsIgnoreCase(name)) {
                return kind;
            }
        }
        NodeKind kind = NodeKind.forTypeName(name);
        if (kind == NodeKind.OTHER) {
            throw new ConfigurationException("Unknown anchor kind: " + name);
        }
        return kind;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw typeError(key, "an integer", value);
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw typeError(key, "an integer", value);
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw typeError(key, "a number", value);
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        throw typeError(key, "true or false", value);
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
            throw typeError(key, "a list", value);
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            result.add(String.valueOf(item));
        }
        return result;
    }

    private static ConfigurationException typeError(String key, String expected, Object actual) {
        return new ConfigurationException(
                "'" + key + "' must be " + expected + " but was '" + actual + "'");
    }
}
