package com.entity.integration.bulk;

import com.entity.integration.api.DocumentIntegrationResult;
import com.entity.integration.api.IntegrationOrchestrator;
import com.entity.integration.core.model.KnowledgeGraph;
import com.entity.integration.logging.LogContext;
import com.entity.integration.metrics.MetricsService;
import com.entity.integration.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

/**
 * Integrates a directory of per-document JSON files into one orchestrator.
 *
 * <p>Files are read and parsed on up to {@code parseParallelism} threads, but documents are
 * always integrated one at a time in file-name order, so a run over the same inputs
 * produces the same graph regardless of parallelism. A file that cannot be read or parsed
 * is skipped and reported in the {@link IntegrationSummary}; the rest of the batch continues.
 * The same holds for a document whose integration fails: the remainder of its file is
 * skipped and the failure is reported against the file.</p>
 */
public class BatchIntegrator {
    private static final Logger log = LoggerFactory.getLogger(BatchIntegrator.class);
    private static final String JSON_SUFFIX = ".json";

    private final IntegrationOrchestrator orchestrator;
    private final DocumentLoader loader;
    private final MetricsService metricsService;
    private final int parseParallelism;

    public BatchIntegrator(IntegrationOrchestrator orchestrator) {
        this(orchestrator, new DocumentLoader(), new NoOpMetricsService());
    }

    public BatchIntegrator(IntegrationOrchestrator orchestrator, DocumentLoader loader, MetricsService metricsService) {
        this.orchestrator = orchestrator;
        this.loader = loader;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.parseParallelism = orchestrator.getOptions().getParseParallelism();
    }

    /**
     * Integrates every {@code *.json} file directly inside the directory, in file-name order.
     *
     * @throws IllegalArgumentException if the path is not a directory
     * @throws UncheckedIOException     if the directory cannot be listed
     */
    public IntegrationSummary integrateDirectory(Path directory, ProgressCallback callback) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory);
        }
        return integrateFiles(listJsonFiles(directory), callback);
    }

    /**
     * Integrates the given files in the given order.
     *
     * @throws IllegalStateException if the orchestrator has been finalized
     */
    public IntegrationSummary integrateFiles(List<Path> files, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        String batchId = LogContext.generateCorrelationId();

        if (orchestrator.getState() == IntegrationOrchestrator.State.FINALIZED) {
            throw new IllegalStateException("Orchestrator is finalized; cannot integrate a batch");
        }

        long filesProcessed = 0;
        long documentsIntegrated = 0;
        long entitiesSkipped = 0;
        List<IntegrationSummary.FileError> errors = new ArrayList<>();

        try (LogContext ctx = LogContext.forBatch(batchId)) {
            log.info("batch.started files={} parseParallelism={}", files.size(), parseParallelism);

            List<ParsedFile> parsed = parseAll(files);
            long total = files.size();
            long seen = 0;
            for (ParsedFile file : parsed) {
                seen++;
                if (file.error() != null) {
                    recordFailure(errors, file.path(), file.error().getMessage(), null);
                    cb.onProgress(seen, total, "Skipped " + file.path().getFileName());
                    continue;
                }

                boolean failed = false;
                for (LoadedDocument document : file.documents()) {
                    try (LogContext docCtx = LogContext.forDocument(batchId, document.documentId())) {
                        DocumentIntegrationResult result =
                                orchestrator.integrateDocument(document.documentId(), document.record());
                        log.debug("batch.document.integrated file={} result={}", file.path().getFileName(), result);
                        documentsIntegrated++;
                        entitiesSkipped += result.entitiesSkipped();
                    } catch (RuntimeException e) {
                        // Documents of this file integrated before the failure stay in the graph.
                        recordFailure(errors, file.path(), "document " + document.documentId() + ": " + e, e);
                        failed = true;
                        break;
                    }
                }
                if (failed) {
                    cb.onProgress(seen, total, "Skipped " + file.path().getFileName());
                    continue;
                }
                filesProcessed++;
                cb.onProgress(seen, total, "Integrated " + file.path().getFileName());
            }
        }

        KnowledgeGraph graph = orchestrator.snapshot();
        IntegrationSummary summary = new IntegrationSummary(filesProcessed, documentsIntegrated, entitiesSkipped,
                graph.entityCount(), graph.relationCount(), errors);
        log.info("batch.completed summary={}", summary);
        return summary;
    }

    private void recordFailure(List<IntegrationSummary.FileError> errors, Path file, String message,
                               RuntimeException cause) {
        if (cause != null) {
            log.warn("batch.document.failed file={} error={}", file, message, cause);
        } else {
            log.warn("batch.document.failed file={} error={}", file, message);
        }
        errors.add(new IntegrationSummary.FileError(file.toString(), message));
        metricsService.incrementDocumentFailed();
    }

    private List<ParsedFile> parseAll(List<Path> files) {
        if (parseParallelism <= 1 || files.size() <= 1) {
            List<ParsedFile> parsed = new ArrayList<>(files.size());
            for (Path file : files) {
                parsed.add(parse(file));
            }
            return parsed;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parseParallelism, files.size()));
        try {
            List<Future<ParsedFile>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(executor.submit(() -> parse(file)));
            }
            List<ParsedFile> parsed = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                parsed.add(await(futures.get(i), files.get(i)));
            }
            return parsed;
        } finally {
            executor.shutdownNow();
        }
    }

    private ParsedFile parse(Path file) {
        try {
            return new ParsedFile(file, loader.load(file), null);
        } catch (DocumentLoadException e) {
            return new ParsedFile(file, List.of(), e);
        }
    }

    private static ParsedFile await(Future<ParsedFile> future, Path file) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading " + file, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Failed to read " + file, e.getCause());
        }
    }

    private static List<Path> listJsonFiles(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(JSON_SUFFIX))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + directory, e);
        }
    }

    private record ParsedFile(Path path, List<LoadedDocument> documents, DocumentLoadException error) {}
}
