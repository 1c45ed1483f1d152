package com.entity.integration.core.model;

import java.util.Objects;

/**
 * A local entity together with the attribute bag its document attached to it.
 * This is the incoming side of every match and merge decision.
 *
 * @param entity   the extracted entity
 * @param location location attributes (LOCATION entities only), may be null
 * @param time     time attributes (TIME entities only), may be null
 */
public record CandidateEntity(
        LocalEntity entity,
        LocationAttributes location,
        TimeAttributes time
) implements EntityRecord {

    public CandidateEntity {
        Objects.requireNonNull(entity, "entity is required");
    }

    public static CandidateEntity of(LocalEntity entity) {
        return new CandidateEntity(entity, null, null);
    }

    public String getLocalId() {
        return entity.id();
    }

    @Override
    public EntityType getType() {
        return entity.type();
    }

    @Override
    public String getText() {
        return entity.text();
    }

    @Override
    public String getNormalized() {
        return entity.normalized();
    }

    @Override
    public double getConfidence() {
        return entity.confidence();
    }

    @Override
    public LocationAttributes getLocation() {
        return location;
    }

    @Override
    public TimeAttributes getTime() {
        return time;
    }
}
