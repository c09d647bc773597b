package com.raditha.cyclone.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CycloneCLI.
 */
class CycloneCLITest {

    private static final String CALC = """
            class Calc {
                int compute(int x) {
                    int total = 0;
                    total += x * 2;
                    total -= x / 3;
                    log(total);
                    store(total);
                    return total;
                }
            }
            """;

    @TempDir
    Path tempDir;

    private Path repoA;
    private Path repoB;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        repoA = Files.createDirectories(tempDir.resolve("left"));
        repoB = Files.createDirectories(tempDir.resolve("right"));
        Files.writeString(repoA.resolve("Calc.java"), CALC);
        Files.writeString(repoB.resolve("Calc.java"), CALC.replace("total", "sum"));
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = CycloneCLI.createCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void testTextReport() {
        int exitCode = run(repoA.toString(), repoB.toString(), "--threads", "1");

        assertEquals(0, exitCode);
        String text = out.toString();
        assertTrue(text.contains("CLONE DETECTION REPORT"));
        assertTrue(text.contains("Repository A: left"));
        assertTrue(text.contains("Repository B: right"));
        assertTrue(text.contains("Type 2"));
    }

    @Test
    void testJsonOutput() throws IOException {
        int exitCode = run("--json", repoA.toString(), repoB.toString());

        assertEquals(0, exitCode);
        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertEquals("left", root.get("summary").get("repositoryA").asText());
        assertEquals(1, root.get("regions").size());
        assertEquals("TYPE2", root.get("regions").get(0).get("type").asText());
    }

    @Test
    void testExportBoth() {
        Path reports = tempDir.resolve("reports");

        int exitCode = run(repoA.toString(), repoB.toString(), "--export", "both", "--output", reports.toString());

        assertEquals(0, exitCode);
        assertTrue(Files.isRegularFile(reports.resolve("cyclone-report.csv")));
        assertTrue(Files.isRegularFile(reports.resolve("cyclone-report.json")));
    }

    @Test
    void testExportCsvOnly() {
        int exitCode = run(repoA.toString(), repoB.toString(), "--export", "CSV", "--output", tempDir.toString());

        assertEquals(0, exitCode);
        assertTrue(Files.exists(tempDir.resolve("cyclone-report.csv")));
        assertFalse(Files.exists(tempDir.resolve("cyclone-report.json")));
    }

    @Test
    void testLenientPresetWithConfigFile() throws IOException {
        Path config = tempDir.resolve("cyclone.yml");
        Files.writeString(config, """
                clone_detector:
                  min_pattern_nodes: 10
                  similarity_threshold: 0.9
                """);

        int exitCode = run("--config-file", config.toString(), "--lenient", "--threshold", "50",
                repoA.toString(), repoB.toString());

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("Threshold: 50%"));
    }

    @Test
    void testInvalidThreshold() {
        int exitCode = run("--threshold", "150", repoA.toString(), repoB.toString());

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Threshold must be between 0 and 100"));
    }

    @Test
    void testMissingRepository() {
        int exitCode = run(repoA.toString(), tempDir.resolve("nowhere").toString());

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Repository not found"));
    }

    @Test
    void testConflictingPresets() {
        assertEquals(2, run("--strict", "--lenient", repoA.toString(), repoB.toString()));
    }

    @Test
    void testUnknownExportFormat() {
        assertEquals(2, run("--export", "xml", repoA.toString(), repoB.toString()));
    }

    @Test
    void testUnknownOption() {
        assertEquals(2, run("--frobnicate", repoA.toString(), repoB.toString()));
    }

    @Test
    void testMissingArguments() {
        assertEquals(2, run(repoA.toString()));
    }

    @Test
    void testInvalidConfigFile() throws IOException {
        Path config = tempDir.resolve("bad.yml");
        Files.writeString(config, "clone_detector:\n  similarity_threshold: 1.5\n");

        int exitCode = run("--config-file", config.toString(), repoA.toString(), repoB.toString());

        assertEquals(2, exitCode);
        assertTrue(err.toString().startsWith("Configuration error"));
    }

    @Test
    void testOutputPathIsAFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("taken.txt"), "x");

        assertEquals(2, run("--export", "json", "--output", file.toString(), repoA.toString(), repoB.toString()));
    }

    @Test
    void testRepositoryId() {
        assertEquals("left", CycloneCLI.repositoryId(repoA));
        assertEquals("right", CycloneCLI.repositoryId(tempDir.resolve("right/./")));
    }

    @Test
    void testHelp() {
        assertEquals(0, run("--help"));
        assertTrue(out.toString().contains("--min-nodes"));
    }

    @Property(tries = 20)
    void negativeNumbersAreRejected(@ForAll @IntRange(min = -1000, max = -1) int value) throws IOException {
        Path dir = Files.createTempDirectory("cyclone-cli");
        try {
            CommandLine cmd = CycloneCLI.createCommandLine();
            cmd.setOut(new PrintWriter(new StringWriter()));
            cmd.setErr(new PrintWriter(new StringWriter()));
            assertEquals(2, cmd.execute("--top-k", String.valueOf(value), dir.toString(), dir.toString()));
        } finally {
            Files.deleteIfExists(dir);
        }
    }
}
