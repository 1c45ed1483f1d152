package com.entity.integration.metrics;

import com.entity.integration.core.model.EntityType;

import java.time.Duration;

/**
 * Interface for recording integration metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing.
 */
public interface MetricsService {

    void incrementEntityCreated(EntityType type);

    void incrementEntityMerged(EntityType type);

    void incrementRelationAdded();

    void incrementRelationDeduplicated();

    void incrementRelationDropped();

    void recordDocumentIntegrated(Duration duration);

    void incrementDocumentFailed();
}
