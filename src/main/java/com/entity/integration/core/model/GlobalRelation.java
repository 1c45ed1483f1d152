package com.entity.integration.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A deduplicated relation between two global entities, optionally anchored to a
 * global TIME and/or LOCATION entity.
 *
 * The (subject, predicate, object, contextTime, contextLocation) tuple is immutable;
 * only confidence and provenance change when duplicates are folded in.
 */
public final class GlobalRelation {

    private final String id;
    private final String subject;
    private final String predicate;
    private final String object;
    private final String contextTime;
    private final String contextLocation;
    private double confidence;
    private final Set<String> sources;

    private GlobalRelation(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.subject = Objects.requireNonNull(builder.subject, "subject is required");
        this.predicate = Objects.requireNonNull(builder.predicate, "predicate is required");
        this.object = Objects.requireNonNull(builder.object, "object is required");
        this.contextTime = builder.contextTime;
        this.contextLocation = builder.contextLocation;
        this.confidence = builder.confidence;
        this.sources = new LinkedHashSet<>(builder.sources);
    }

    public String getId() {
        return id;
    }

    public String getSubject() {
        return subject;
    }

    public String getPredicate() {
        return predicate;
    }

    public String getObject() {
        return object;
    }

    public String getContextTime() {
        return contextTime;
    }

    public String getContextLocation() {
        return contextLocation;
    }

    public boolean hasContextTime() {
        return contextTime != null && !contextTime.isEmpty();
    }

    public boolean hasContextLocation() {
        return contextLocation != null && !contextLocation.isEmpty();
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * Raises the stored confidence; a lower value is ignored.
     */
    public void raiseConfidence(double candidate) {
        if (candidate > confidence) {
            confidence = candidate;
        }
    }

    public List<String> getSources() {
        return Collections.unmodifiableList(new ArrayList<>(sources));
    }

    public boolean addSource(String documentId) {
        return sources.add(Objects.requireNonNull(documentId, "documentId is required"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GlobalRelation that = (GlobalRelation) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "GlobalRelation{" +
                "id='" + id + '\'' +
                ", subject='" + subject + '\'' +
                ", predicate='" + predicate + '\'' +
                ", object='" + object + '\'' +
                ", contextTime='" + contextTime + '\'' +
                ", contextLocation='" + contextLocation + '\'' +
                ", confidence=" + confidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String subject;
        private String predicate;
        private String object;
        private String contextTime;
        private String contextLocation;
        private double confidence;
        private final List<String> sources = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder predicate(String predicate) {
            this.predicate = predicate;
            return this;
        }

        public Builder object(String object) {
            this.object = object;
            return this;
        }

        public Builder contextTime(String contextTime) {
            this.contextTime = contextTime;
            return this;
        }

        public Builder contextLocation(String contextLocation) {
            this.contextLocation = contextLocation;
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

        public GlobalRelation build() {
            return new GlobalRelation(this);
        }
    }
}
