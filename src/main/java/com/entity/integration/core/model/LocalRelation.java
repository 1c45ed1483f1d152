package com.entity.integration.core.model;

import java.util.Objects;

/**
 * A subject-predicate-object assertion as extracted from a single document.
 * All entity references are document-scoped ids.
 *
 * @param subject         local id of the subject entity
 * @param predicate       relation predicate
 * @param object          local id of the object entity
 * @param confidence      extraction confidence in [0, 1]
 * @param contextTime     local id of a TIME entity anchoring the assertion, may be null
 * @param contextLocation local id of a LOCATION entity anchoring the assertion, may be null
 */
public record LocalRelation(
        String subject,
        String predicate,
        String object,
        double confidence,
        String contextTime,
        String contextLocation
) {
    public LocalRelation {
        Objects.requireNonNull(subject, "subject is required");
        Objects.requireNonNull(predicate, "predicate is required");
        Objects.requireNonNull(object, "object is required");
    }

    public static LocalRelation of(String subject, String predicate, String object, double confidence) {
        return new LocalRelation(subject, predicate, object, confidence, null, null);
    }
}
