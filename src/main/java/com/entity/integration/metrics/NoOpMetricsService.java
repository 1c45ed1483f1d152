package com.entity.integration.metrics;

import com.entity.integration.core.model.EntityType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementEntityCreated(EntityType type) {
    }

    @Override
    public void incrementEntityMerged(EntityType type) {
    }

    @Override
    public void incrementRelationAdded() {
    }

    @Override
    public void incrementRelationDeduplicated() {
    }

    @Override
    public void incrementRelationDropped() {
    }

    @Override
    public void recordDocumentIntegrated(Duration duration) {
    }

    @Override
    public void incrementDocumentFailed() {
    }
}
