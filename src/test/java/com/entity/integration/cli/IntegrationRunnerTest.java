package com.entity.integration.cli;

import com.entity.integration.api.IntegrationOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class IntegrationRunnerTest {

    private static final String DOCUMENT = """
            {
              "entities": [
                {"id": "e1", "type": "ORGANIZATION", "text": "French troops", "confidence": 0.85},
                {"id": "e2", "type": "LOCATION", "text": "Vienna", "confidence": 0.9},
                {"id": "e3", "type": "LOCATION", "text": "the front", "confidence": 0.4},
                {"id": "e4", "type": "TIME", "text": "that winter", "confidence": 0.5}
              ],
              "relations": [
                {"subject": "e1", "predicate": "capitulation", "object": "e2", "confidence": 0.8}
              ],
              "locations": [
                {"entity_id": "e2", "latitude": 48.2082, "longitude": 16.3738}
              ]
            }
            """;

    @Test
    @DisplayName("Should integrate a directory and write JSON, CSV and a report")
    void testRun(@TempDir Path dir) throws Exception {
        Path input = Files.createDirectories(dir.resolve("enhanced_results"));
        Files.writeString(input.resolve("doc1.json"), DOCUMENT);
        Files.writeString(input.resolve("doc2.json"), DOCUMENT);
        Files.writeString(input.resolve("doc3.json"), "{ broken");
        Path outputJson = dir.resolve("integrated_results").resolve("graph.json");
        Path csvDir = dir.resolve("neo4j_import");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code = IntegrationRunner.run(
                new String[]{"-i", input.toString(), "-o", outputJson.toString(), "-c", csvDir.toString()},
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(IntegrationRunner.EXIT_OK, code);
        assertTrue(Files.exists(outputJson));
        assertTrue(Files.exists(csvDir.resolve("relations.csv")));

        String printed = out.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("=== Entity Integration Validation ==="));
        assertTrue(printed.contains("Error processing file"));
        assertTrue(printed.contains("Processed 3 files with 2 total documents"));
        assertTrue(printed.contains("Integrated 4 unique entities and 1 unique relations"));
        assertTrue(printed.contains("WARNING: 1 location entities are missing coordinate information"));
        assertTrue(printed.contains("WARNING: 1 time entities are missing date information"));
    }

    @Test
    @DisplayName("Should fail with a usage message when the input directory is missing")
    void testMissingInput(@TempDir Path dir) {
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int code = IntegrationRunner.run(new String[]{"--input", dir.resolve("absent").toString()},
                new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(IntegrationRunner.EXIT_USAGE, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage:"));
    }

    @Test
    @DisplayName("Should parse flags with and without values")
    void testParseArgs() {
        Map<String, String> args = IntegrationRunner.parseArgs(new String[]{"-i", "in", "--help", "-o", "out.json"});

        assertEquals("in", args.get("-i"));
        assertEquals("", args.get("--help"));
        assertEquals("out.json", args.get("-o"));
    }

    @Test
    @DisplayName("Should load classpath defaults and let integration.* overrides win")
    void testLoadProperties() {
        Properties overrides = new Properties();
        overrides.setProperty(IntegrationOptions.SIMILARITY_THRESHOLD_KEY, "0.9");
        overrides.setProperty("user.home", "/ignored");

        Properties properties = IntegrationRunner.loadProperties(overrides);

        assertEquals("0.9", properties.getProperty(IntegrationOptions.SIMILARITY_THRESHOLD_KEY));
        assertEquals("1.0", properties.getProperty(IntegrationOptions.GEO_MATCH_DISTANCE_KEY));
        assertNull(properties.getProperty("user.home"));
    }
}
