package com.entity.integration.bulk;

import com.entity.integration.core.model.KnowledgeGraph;

import java.nio.file.Path;

/**
 * Interface for writing an integrated graph to disk.
 * Implementations write entities and relations in a specific format.
 */
public interface GraphExporter {

    /**
     * Writes the graph.
     *
     * @param graph  the graph to export
     * @param target a file or a directory, depending on the format
     * @return the export result
     * @throws java.io.UncheckedIOException if the target cannot be written
     */
    ExportResult export(KnowledgeGraph graph, Path target);

    /**
     * Returns the format produced by this exporter (e.g., "csv", "json").
     */
    String getFormat();
}
