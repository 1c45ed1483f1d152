package com.entity.integration.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Enumeration of entity types produced by the newspaper extraction stage.
 */
public enum EntityType {
    PERSON("Person"),
    ORGANIZATION("Organization"),
    LOCATION("Location"),
    EVENT("Event"),
    CONCEPT("Concept"),
    TIME("Time"),
    ARTIFACT("Artifact"),
    SENTIMENT("Sentiment");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Looks up a type by its name, ignoring case and surrounding whitespace.
     *
     * @return the type, or empty if the value is null or not a known type
     */
    public static Optional<EntityType> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String key = value.trim().toUpperCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.name().equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
