package com.entity.integration.core.model;

import java.util.Objects;

/**
 * An entity as extracted from a single document. The id is only unique within that document.
 *
 * @param id         document-scoped identifier
 * @param type       entity type
 * @param text       surface text as it appeared in the document
 * @param normalized normalized form, may be null
 * @param confidence extraction confidence in [0, 1]
 */
public record LocalEntity(
        String id,
        EntityType type,
        String text,
        String normalized,
        double confidence
) {
    public LocalEntity {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(text, "text is required");
    }
}
