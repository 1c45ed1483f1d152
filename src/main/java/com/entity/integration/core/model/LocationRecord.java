package com.entity.integration.core.model;

import java.util.Objects;

/**
 * One row of a document's location table: geocoding results for a local entity.
 */
public record LocationRecord(String entityId, LocationAttributes attributes) {
    public LocationRecord {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(attributes, "attributes is required");
    }
}
