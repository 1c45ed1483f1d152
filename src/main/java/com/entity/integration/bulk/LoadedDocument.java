package com.entity.integration.bulk;

import com.entity.integration.core.model.DocumentRecord;

import java.util.Objects;

/**
 * A parsed document together with the provenance id it will be integrated under.
 */
public record LoadedDocument(String documentId, DocumentRecord record) {
    public LoadedDocument {
        Objects.requireNonNull(documentId, "documentId is required");
        Objects.requireNonNull(record, "record is required");
    }
}
