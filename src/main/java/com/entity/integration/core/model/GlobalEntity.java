package com.entity.integration.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A deduplicated, cross-document entity.
 * Identity and type are fixed at creation; every other field changes only through merges.
 */
public class GlobalEntity implements EntityRecord {
    private final String id;
    private final EntityType type;
    private String text;
    private String normalized;
    private double confidence;
    private final Set<String> sources;
    private LocationAttributes location;
    private TimeAttributes time;

    private GlobalEntity(Builder builder) {
        this.id = builder.id;
        this.type = builder.type;
        this.text = builder.text;
        this.normalized = builder.normalized;
        this.confidence = builder.confidence;
        this.sources = new LinkedHashSet<>(builder.sources);
        this.location = builder.location;
        this.time = builder.time;
    }

    public String getId() {
        return id;
    }

    @Override
    public EntityType getType() {
        return type;
    }

    @Override
    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    @Override
    public String getNormalized() {
        return normalized;
    }

    public void setNormalized(String normalized) {
        this.normalized = normalized;
    }

    @Override
    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    /**
     * Document ids that contributed evidence, in the order they were first seen.
     */
    public List<String> getSources() {
        return Collections.unmodifiableList(new ArrayList<>(sources));
    }

    /**
     * Records a contributing document. Adding the same document twice has no effect.
     *
     * @return true if the document was not yet a source
     */
    public boolean addSource(String documentId) {
        return sources.add(Objects.requireNonNull(documentId, "documentId is required"));
    }

    @Override
    public LocationAttributes getLocation() {
        return location;
    }

    public void setLocation(LocationAttributes location) {
        this.location = location;
    }

    @Override
    public TimeAttributes getTime() {
        return time;
    }

    public void setTime(TimeAttributes time) {
        this.time = time;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GlobalEntity that = (GlobalEntity) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "GlobalEntity{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", text='" + text + '\'' +
                ", normalized='" + normalized + '\'' +
                ", confidence=" + confidence +
                ", sources=" + sources +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private EntityType type;
        private String text;
        private String normalized;
        private double confidence;
        private final List<String> sources = new ArrayList<>();
        private LocationAttributes location;
        private TimeAttributes time;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder normalized(String normalized) {
            this.normalized = normalized;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder source(String documentId) {
            this.sources.add(documentId);
            return this;
        }

        public Builder location(LocationAttributes location) {
            this.location = location;
            return this;
        }

        public Builder time(TimeAttributes time) {
            this.time = time;
            return this;
        }

        public GlobalEntity build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(text, "text is required");
            return new GlobalEntity(this);
        }
    }
}
