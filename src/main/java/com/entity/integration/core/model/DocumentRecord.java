package com.entity.integration.core.model;

import java.util.List;

/**
 * Enhanced extraction output for one document.
 * Lists keep the order in which the extractor emitted them; integration follows that order.
 *
 * @param entitiesSkipped entities dropped while reading the document because they lacked an id,
 *                        text or known type
 */
public record DocumentRecord(
        List<LocalEntity> entities,
        List<LocalRelation> relations,
        List<LocationRecord> locations,
        List<TimePeriodRecord> timeperiods,
        int entitiesSkipped
) {
    public DocumentRecord {
        entities = entities != null ? List.copyOf(entities) : List.of();
        relations = relations != null ? List.copyOf(relations) : List.of();
        locations = locations != null ? List.copyOf(locations) : List.of();
        timeperiods = timeperiods != null ? List.copyOf(timeperiods) : List.of();
        if (entitiesSkipped < 0) {
            throw new IllegalArgumentException("entitiesSkipped must be >= 0");
        }
    }

    public DocumentRecord(List<LocalEntity> entities, List<LocalRelation> relations,
                          List<LocationRecord> locations, List<TimePeriodRecord> timeperiods) {
        this(entities, relations, locations, timeperiods, 0);
    }

    public static DocumentRecord empty() {
        return new DocumentRecord(List.of(), List.of(), List.of(), List.of());
    }
}
