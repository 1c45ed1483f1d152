package com.entity.integration.core.model;

import java.util.Objects;

/**
 * One row of a document's timeperiod table: temporal parsing results for a local entity.
 */
public record TimePeriodRecord(String entityId, TimeAttributes attributes) {
    public TimePeriodRecord {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(attributes, "attributes is required");
    }
}
