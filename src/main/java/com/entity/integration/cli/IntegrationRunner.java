package com.entity.integration.cli;

import com.entity.integration.api.IntegrationOptions;
import com.entity.integration.api.IntegrationOrchestrator;
import com.entity.integration.api.ValidationReport;
import com.entity.integration.bulk.BatchIntegrator;
import com.entity.integration.bulk.CsvGraphExporter;
import com.entity.integration.bulk.DocumentLoader;
import com.entity.integration.bulk.ExportResult;
import com.entity.integration.bulk.IntegrationSummary;
import com.entity.integration.bulk.JsonGraphExporter;
import com.entity.integration.core.model.KnowledgeGraph;
import com.entity.integration.metrics.MetricsService;
import com.entity.integration.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Command-line entry point: integrates a directory of enhanced extraction files and writes
 * the JSON graph, the CSV import files and a validation report.
 *
 * <pre>
 * java -jar entity-integration.jar [-i &lt;input_dir&gt;] [-o &lt;output_json&gt;] [-c &lt;csv_dir&gt;]
 * </pre>
 *
 * Options are read from {@code integration.properties} on the classpath; any
 * {@code -Dintegration.*} system property overrides the file.
 */
public final class IntegrationRunner {
    private static final Logger log = LoggerFactory.getLogger(IntegrationRunner.class);

    static final String DEFAULT_INPUT_DIR = "enhanced_results";
    static final String DEFAULT_OUTPUT_JSON = "integrated_results/integrated_knowledge_graph.json";
    static final String DEFAULT_CSV_DIR = "neo4j_import";
    static final String PROPERTIES_RESOURCE = "/integration.properties";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;

    private IntegrationRunner() {
    }

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Runs one integration and returns the process exit code.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        Map<String, String> cli = parseArgs(args);
        if (cli.containsKey("-h") || cli.containsKey("--help")) {
            out.println(usage());
            return EXIT_OK;
        }
        Path inputDir = Paths.get(cli.getOrDefault("-i", cli.getOrDefault("--input", DEFAULT_INPUT_DIR)));
        Path outputJson = Paths.get(cli.getOrDefault("-o", cli.getOrDefault("--output", DEFAULT_OUTPUT_JSON)));
        Path csvDir = Paths.get(cli.getOrDefault("-c", cli.getOrDefault("--csv-dir", DEFAULT_CSV_DIR)));

        if (!Files.isDirectory(inputDir)) {
            err.println("Input directory not found: " + inputDir.toAbsolutePath());
            err.println(usage());
            return EXIT_USAGE;
        }

        IntegrationOptions options;
        try {
            options = IntegrationOptions.fromProperties(loadProperties(System.getProperties()));
        } catch (IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
        log.info("runner.started input={} output={} csvDir={} options={}", inputDir, outputJson, csvDir, options);

        MetricsService metrics = new MicrometerMetricsService(new SimpleMeterRegistry());
        IntegrationOrchestrator orchestrator = IntegrationOrchestrator.builder()
                .options(options)
                .metricsService(metrics)
                .build();
        BatchIntegrator batch = new BatchIntegrator(orchestrator, new DocumentLoader(), metrics);

        IntegrationSummary summary = batch.integrateDirectory(inputDir,
                (processed, total, message) -> out.println("[" + processed + "/" + total + "] " + message));
        for (IntegrationSummary.FileError error : summary.errors()) {
            out.println("Error processing file " + error.file() + ": " + error.message());
        }

        ValidationReport report = orchestrator.validate();
        KnowledgeGraph graph = orchestrator.finalizeGraph();

        ExportResult json = new JsonGraphExporter().export(graph, outputJson);
        out.println("Integrated data saved to " + outputJson);
        ExportResult csv = new CsvGraphExporter().export(graph, csvDir);
        out.println("CSV files generated in " + csvDir + " (" + csv.locations() + " locations, "
                + csv.timeperiods() + " time periods)");

        out.println();
        out.print(report.toReport());
        out.println();
        out.println("Integration complete!");
        out.println("Processed " + (summary.filesProcessed() + summary.filesFailed()) + " files with "
                + summary.documentsIntegrated() + " total documents");
        out.println("Integrated " + json.entities() + " unique entities and " + json.relations() + " unique relations");

        if (report.locationsWithoutCoordinates() > 0) {
            out.println();
            out.println("WARNING: " + report.locationsWithoutCoordinates()
                    + " location entities are missing coordinate information");
        }
        if (summary.entitiesSkipped() > 0) {
            out.println();
            out.println("WARNING: " + summary.entitiesSkipped()
                    + " entities were skipped for missing id, text or type");
        }
        if (report.timesWithoutDates() > 0) {
            out.println();
            out.println("WARNING: " + report.timesWithoutDates() + " time entities are missing date information");
        }
        return EXIT_OK;
    }

    /**
     * Classpath defaults overlaid with any {@code integration.*} entries of the overrides.
     */
    static Properties loadProperties(Properties overrides) {
        Properties properties = new Properties();
        try (InputStream in = IntegrationRunner.class.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                log.debug("runner.config.missing resource={}", PROPERTIES_RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + PROPERTIES_RESOURCE, e);
        }
        for (String name : overrides.stringPropertyNames()) {
            if (name.startsWith("integration.")) {
                properties.setProperty(name, overrides.getProperty(name));
            }
        }
        return properties;
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("-")) {
                String v = (i + 1 < args.length && !args[i + 1].startsWith("-")) ? args[i + 1] : "";
                m.put(a, v);
                if (!v.isEmpty()) i++;
            }
        }
        return m;
    }

    private static String usage() {
        return "Usage: java -jar entity-integration.jar [-i <input_dir>] [-o <output_json>] [-c <csv_dir>]";
    }
}
