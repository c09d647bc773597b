package com.raditha.cyclone.config;

import com.raditha.cyclone.parser.NodeKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CloneDetectorSettings.
 */
class CloneDetectorSettingsTest {

    private static final Path TEST_CONFIG = Path.of("src/test/resources/cyclone-test.yml");
    private static final Path INVALID_CONFIG = Path.of("src/test/resources/cyclone-invalid.yml");

    @TempDir
    Path tempDir;

    @Test
    void testLoadConfig_Defaults() throws IOException {
        CloneDetectionConfig config = CloneDetectorSettings.loadConfig((Path) null,
                CloneDetectorSettings.Overrides.none());
        CloneDetectionConfig moderate = CloneDetectionConfig.moderate();

        assertEquals(moderate.minPatternNodes(), config.minPatternNodes());
        assertEquals(moderate.maxPatternDepth(), config.maxPatternDepth());
        assertEquals(moderate.similarityThreshold(), config.similarityThreshold(), 0.001);
        assertEquals(moderate.anchorKinds(), config.anchorKinds());
        assertEquals(moderate.excludePatterns(), config.excludePatterns());
    }

    @Test
    void testLoadConfig_YamlFile() throws IOException {
        CloneDetectionConfig config = CloneDetectorSettings.loadConfig(TEST_CONFIG,
                CloneDetectorSettings.Overrides.none());

        assertEquals(12, config.minPatternNodes());
        assertEquals(9, config.maxPatternDepth());
        assertEquals(0.8, config.similarityThreshold(), 0.001);
        assertEquals(2, config.topK());
        assertEquals(Set.of(NodeKind.METHOD_DECLARATION, NodeKind.FOR_STMT), config.anchorKinds());
        assertEquals(250_000L, config.maxComparisonCells());
        assertEquals(3, config.parallelism());
        assertEquals(List.of("**/generated/**"), config.excludePatterns());
        // strict preset verifies, the file turns it off
        assertFalse(config.verifyExactMatches());
        // not in the file, taken from the strict preset
        assertEquals(CloneDetectionConfig.strict().maxPatternNodes(), config.maxPatternNodes());
        assertFalse(config.exhaustive());
    }

    @Test
    void testLoadConfig_CliOverrides() throws IOException {
        CloneDetectorSettings.Overrides cli = new CloneDetectorSettings.Overrides(
                "lenient", 10, 7, 65, 4, false, 2);

        CloneDetectionConfig config = CloneDetectorSettings.loadConfig(TEST_CONFIG, cli);

        assertEquals(10, config.minPatternNodes());
        assertEquals(7, config.maxPatternDepth());
        assertEquals(0.65, config.similarityThreshold(), 0.001);
        assertEquals(4, config.topK());
        assertEquals(2, config.parallelism());
        // the CLI preset replaces the file's preset as the base
        assertEquals(CloneDetectionConfig.lenient().maxPatternNodes(), config.maxPatternNodes());
        assertTrue(config.exhaustive());
        // keys the CLI does not cover still come from the file
        assertEquals(250_000L, config.maxComparisonCells());
    }

    @Test
    void testLoadConfig_ExhaustiveFlag() {
        Map<String, Object> yaml = Map.of("exhaustive", false);
        CloneDetectorSettings.Overrides cli = new CloneDetectorSettings.Overrides(null, 0, 0, 0, 0, true, 0);

        assertTrue(CloneDetectorSettings.loadConfig(yaml, cli).exhaustive());
        assertFalse(CloneDetectorSettings.loadConfig(yaml, CloneDetectorSettings.Overrides.none()).exhaustive());
    }

    @Test
    void testLoadConfig_YamlMap() {
        Map<String, Object> yaml = new HashMap<>();
        yaml.put("language", "java");
        yaml.put("min_pattern_nodes", 15);
        yaml.put("max_pattern_nodes", 800);
        yaml.put("similarity_threshold", 0.9);
        yaml.put("anchor_kinds", List.of("method_declaration", "WhileStmt", "IF_STMT"));

        CloneDetectionConfig config = CloneDetectorSettings.loadConfig(yaml, CloneDetectorSettings.Overrides.none());

        assertEquals(Language.JAVA, config.language());
        assertEquals(15, config.minPatternNodes());
        assertEquals(800, config.maxPatternNodes());
        assertEquals(0.9, config.similarityThreshold(), 0.001);
        assertEquals(Set.of(NodeKind.METHOD_DECLARATION, NodeKind.WHILE_STMT, NodeKind.IF_STMT),
                config.anchorKinds());
    }

    @Test
    void testLoadConfig_IntegerThreshold() {
        // YAML reads "1" as an integer
        CloneDetectionConfig config = CloneDetectorSettings.loadConfig(Map.of("similarity_threshold", 1),
                CloneDetectorSettings.Overrides.none());

        assertEquals(1.0, config.similarityThreshold());
    }

    @Test
    void testLoadConfig_MinNodesLiftsMaxNodes() {
        CloneDetectionConfig config = CloneDetectorSettings.loadConfig(Map.of("min_pattern_nodes", 2000),
                CloneDetectorSettings.Overrides.none());

        assertEquals(2000, config.minPatternNodes());
        assertEquals(2000, config.maxPatternNodes());
    }

    @Test
    void testInvalidValueInFile() {
        assertThrows(ConfigurationException.class,
                () -> CloneDetectorSettings.loadConfig(INVALID_CONFIG, CloneDetectorSettings.Overrides.none()));
    }

    @Test
    void testWrongTypes() {
        CloneDetectorSettings.Overrides none = CloneDetectorSettings.Overrides.none();

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> CloneDetectorSettings.loadConfig(Map.of("min_pattern_nodes", "many"), none));
        assertTrue(e.getMessage().contains("min_pattern_nodes"));
        assertThrows(ConfigurationException.class,
                () -> CloneDetectorSettings.loadConfig(Map.of("similarity_threshold", "high"), none));
        assertThrows(ConfigurationException.class,
                () -> CloneDetectorSettings.loadConfig(Map.of("exhaustive", "yes please"), none));
        assertThrows(ConfigurationException.class,
                () -> CloneDetectorSettings.loadConfig(Map.of("anchor_kinds", "METHOD_DECLARATION"), none));
    }

    @Test
    void testUnknownNames() {
        CloneDetectorSettings.Overrides none = CloneDetectorSettings.Overrides.none();

        assertThrows(ConfigurationException.class,
                () -> CloneDetectorSettings.loadConfig(Map.of("anchor_kinds", List.of("Banana")), none));
        assertThrows(ConfigurationException.class,
                () -> CloneDetectorSettings.loadConfig(Map.of("preset", "extreme"), none));
        assertThrows(ConfigurationException.class,
                () -> CloneDetectorSettings.loadConfig(Map.of("language", "cobol"), none));
    }

    @Test
    void testReadYaml_MissingFile() {
        assertThrows(ConfigurationException.class,
                () -> CloneDetectorSettings.readYaml(tempDir.resolve("missing.yml")));
    }

    @Test
    void testReadYaml_NoSection() throws IOException {
        Path file = tempDir.resolve("other.yml");
        Files.writeString(file, "something_else:\n  key: 1\n");

        assertTrue(CloneDetectorSettings.readYaml(file).isEmpty());
    }

    @Test
    void testReadYaml_SectionNotMap() throws IOException {
        Path file = tempDir.resolve("scalar.yml");
        Files.writeString(file, "clone_detector: 5\n");

        assertThrows(ConfigurationException.class, () -> CloneDetectorSettings.readYaml(file));
    }

    @Test
    void testReadYaml_Malformed() throws IOException {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "clone_detector:\n  top_k: [1, 2\n");

        assertThrows(ConfigurationException.class, () -> CloneDetectorSettings.readYaml(file));
    }

    @Test
    void testReadYaml_EmptyFile() throws IOException {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        assertTrue(CloneDetectorSettings.readYaml(file).isEmpty());
    }
}
