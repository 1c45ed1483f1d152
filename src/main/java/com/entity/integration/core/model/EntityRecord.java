package com.entity.integration.core.model;

/**
 * Read-only view shared by extracted candidates and integrated global entities,
 * so that both sides of a similarity check are compared through the same accessors.
 */
public interface EntityRecord {

    EntityType getType();

    String getText();

    /**
     * Normalized surface form, or null when the extractor produced none.
     */
    String getNormalized();

    double getConfidence();

    /**
     * Location attributes, or null when the entity carries none.
     */
    LocationAttributes getLocation();

    /**
     * Time attributes, or null when the entity carries none.
     */
    TimeAttributes getTime();

    /**
     * Best available text for comparison: the normalized form if present, otherwise the raw text.
     */
    default String getComparableText() {
        String normalized = getNormalized();
        return normalized != null ? normalized : getText();
    }
}
