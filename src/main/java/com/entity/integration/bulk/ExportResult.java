package com.entity.integration.bulk;

/**
 * Result of exporting an integrated graph.
 *
 * @param entities    entity records written
 * @param locations   location attribute records written
 * @param timeperiods time attribute records written
 * @param relations   relation records written
 */
public record ExportResult(
        long entities,
        long locations,
        long timeperiods,
        long relations
) {
    @Override
    public String toString() {
        return "ExportResult{entities=" + entities +
                ", locations=" + locations +
                ", timeperiods=" + timeperiods +
                ", relations=" + relations + '}';
    }
}
