package com.entity.integration.api;

import com.entity.integration.core.model.EntityType;
import com.entity.integration.core.model.GlobalEntity;
import com.entity.integration.core.model.GlobalRelation;
import com.entity.integration.core.model.LocationAttributes;
import com.entity.integration.core.model.TimeAttributes;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Data-quality statistics over an integrated graph.
 *
 * @param totalEntities                number of global entities
 * @param totalRelations               number of global relations
 * @param entitiesByType               entity count per type; types without entities are absent
 * @param locationsWithCoordinates     LOCATION entities with non-zero latitude and longitude
 * @param locationsWithoutCoordinates  LOCATION entities lacking usable coordinates
 * @param timesWithDates               TIME entities with a start date
 * @param timesWithoutDates            TIME entities without a start date
 * @param relationsWithTimeContext     relations anchored to a TIME entity
 * @param relationsWithLocationContext relations anchored to a LOCATION entity
 */
public record ValidationReport(
        int totalEntities,
        int totalRelations,
        Map<EntityType, Integer> entitiesByType,
        int locationsWithCoordinates,
        int locationsWithoutCoordinates,
        int timesWithDates,
        int timesWithoutDates,
        int relationsWithTimeContext,
        int relationsWithLocationContext
) {
    public ValidationReport {
        EnumMap<EntityType, Integer> copy = new EnumMap<>(EntityType.class);
        if (entitiesByType != null) {
            copy.putAll(entitiesByType);
        }
        entitiesByType = Collections.unmodifiableMap(copy);
    }

    /**
     * Computes the statistics without modifying the given collections.
     */
    public static ValidationReport of(Collection<GlobalEntity> entities, Collection<GlobalRelation> relations) {
        Map<EntityType, Integer> byType = new EnumMap<>(EntityType.class);
        int withCoordinates = 0;
        int withoutCoordinates = 0;
        int withDates = 0;
        int withoutDates = 0;

        for (GlobalEntity entity : entities) {
            byType.merge(entity.getType(), 1, Integer::sum);
            if (entity.getType() == EntityType.LOCATION) {
                if (hasUsableCoordinates(entity.getLocation())) {
                    withCoordinates++;
                } else {
                    withoutCoordinates++;
                }
            } else if (entity.getType() == EntityType.TIME) {
                TimeAttributes time = entity.getTime();
                if (time != null && time.hasStartDate()) {
                    withDates++;
                } else {
                    withoutDates++;
                }
            }
        }

        int withTimeContext = 0;
        int withLocationContext = 0;
        for (GlobalRelation relation : relations) {
            if (relation.hasContextTime()) {
                withTimeContext++;
            }
            if (relation.hasContextLocation()) {
                withLocationContext++;
            }
        }

        return new ValidationReport(entities.size(), relations.size(), byType,
                withCoordinates, withoutCoordinates, withDates, withoutDates,
                withTimeContext, withLocationContext);
    }

    private static boolean hasUsableCoordinates(LocationAttributes location) {
        return location != null && location.hasCoordinates()
                && location.getLatitude() != 0.0 && location.getLongitude() != 0.0;
    }

    public int countOf(EntityType type) {
        return entitiesByType.getOrDefault(type, 0);
    }

    public int relationsWithoutTimeContext() {
        return totalRelations - relationsWithTimeContext;
    }

    public int relationsWithoutLocationContext() {
        return totalRelations - relationsWithLocationContext;
    }

    public boolean hasMissingAttributes() {
        return locationsWithoutCoordinates > 0 || timesWithoutDates > 0;
    }

    /**
     * Renders the statistics as a human readable multi-line report.
     */
    public String toReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Entity Integration Validation ===\n");
        sb.append("Total unique entities: ").append(totalEntities).append('\n');
        sb.append("Total relations: ").append(totalRelations).append('\n');

        sb.append("\nEntity types:\n");
        entitiesByType.entrySet().stream()
                .sorted(Comparator.comparing(e -> e.getKey().name()))
                .forEach(e -> sb.append("  ").append(e.getKey().name()).append(": ").append(e.getValue()).append('\n'));

        int locations = countOf(EntityType.LOCATION);
        sb.append("\nLocation entities:\n");
        if (locations > 0) {
            appendShare(sb, "With coordinates", locationsWithCoordinates, locations);
            appendShare(sb, "Without coordinates", locationsWithoutCoordinates, locations);
        }

        int times = countOf(EntityType.TIME);
        sb.append("\nTime entities:\n");
        if (times > 0) {
            appendShare(sb, "With date information", timesWithDates, times);
            appendShare(sb, "Without date information", timesWithoutDates, times);
        }

        sb.append("\nRelation contexts:\n");
        if (totalRelations > 0) {
            appendShare(sb, "With time context", relationsWithTimeContext, totalRelations);
            appendShare(sb, "With location context", relationsWithLocationContext, totalRelations);
        }
        return sb.toString();
    }

    private static void appendShare(StringBuilder sb, String label, int count, int total) {
        sb.append("  ").append(label).append(": ").append(count)
                .append(String.format(Locale.ROOT, " (%.1f%%)", count * 100.0 / total))
                .append('\n');
    }
}
