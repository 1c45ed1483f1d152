package com.entity.integration.bulk;

import java.util.List;

/**
 * Result of integrating a batch of input files.
 *
 * @param filesProcessed       files that were read and integrated
 * @param documentsIntegrated  documents integrated from those files
 * @param entitiesSkipped      entities dropped while reading the integrated documents
 * @param totalEntities        global entities in the store after the batch
 * @param totalRelations       global relations in the store after the batch
 * @param errors               files (or documents within a file) that were skipped, with the reason
 */
public record IntegrationSummary(
        long filesProcessed,
        long documentsIntegrated,
        long entitiesSkipped,
        long totalEntities,
        long totalRelations,
        List<FileError> errors
) {
    public IntegrationSummary {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long filesFailed() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * True if at least one file was integrated but some were skipped.
     */
    public boolean isPartial() {
        return hasErrors() && filesProcessed > 0;
    }

    /**
     * A file that could not be integrated.
     *
     * @param file    the file name
     * @param message the reason
     */
    public record FileError(String file, String message) {}

    @Override
    public String toString() {
        return "IntegrationSummary{files=" + filesProcessed +
                ", documents=" + documentsIntegrated +
                ", entitiesSkipped=" + entitiesSkipped +
                ", entities=" + totalEntities +
                ", relations=" + totalRelations +
                ", errors=" + errors.size() + '}';
    }
}
