package com.entity.integration.metrics;

import com.entity.integration.core.model.EntityType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code integration.entity.created}: Counter (tag: entityType)</li>
 *   <li>{@code integration.entity.merged}: Counter (tag: entityType)</li>
 *   <li>{@code integration.relation.added}: Counter</li>
 *   <li>{@code integration.relation.deduplicated}: Counter</li>
 *   <li>{@code integration.relation.dropped}: Counter</li>
 *   <li>{@code integration.document.duration}: Timer, one sample per integrated document</li>
 *   <li>{@code integration.document.failed}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter relationAddedCounter;
    private final Counter relationDeduplicatedCounter;
    private final Counter relationDroppedCounter;
    private final Counter documentFailedCounter;
    private final Timer documentTimer;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.relationAddedCounter = Counter.builder("integration.relation.added")
                .description("Number of new global relations")
                .register(registry);
        this.relationDeduplicatedCounter = Counter.builder("integration.relation.deduplicated")
                .description("Number of relations folded into an existing global relation")
                .register(registry);
        this.relationDroppedCounter = Counter.builder("integration.relation.dropped")
                .description("Number of relations dropped for unresolved subject or object")
                .register(registry);
        this.documentFailedCounter = Counter.builder("integration.document.failed")
                .description("Number of input files skipped because they could not be read")
                .register(registry);
        this.documentTimer = Timer.builder("integration.document.duration")
                .description("Duration of integrating one document")
                .register(registry);
    }

    @Override
    public void incrementEntityCreated(EntityType type) {
        entityCounter("integration.entity.created", "Number of new global entities", type).increment();
    }

    @Override
    public void incrementEntityMerged(EntityType type) {
        entityCounter("integration.entity.merged", "Number of local entities merged into a global entity", type)
                .increment();
    }

    @Override
    public void incrementRelationAdded() {
        relationAddedCounter.increment();
    }

    @Override
    public void incrementRelationDeduplicated() {
        relationDeduplicatedCounter.increment();
    }

    @Override
    public void incrementRelationDropped() {
        relationDroppedCounter.increment();
    }

    @Override
    public void recordDocumentIntegrated(Duration duration) {
        documentTimer.record(duration);
    }

    @Override
    public void incrementDocumentFailed() {
        documentFailedCounter.increment();
    }

    private Counter entityCounter(String name, String description, EntityType type) {
        String key = name + ":" + type.name();
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("entityType", type.name())
                        .register(registry));
    }
}
