package com.entity.integration.relation;

import java.util.Objects;

/**
 * Identity of a global relation: the ordered tuple of its resolved references.
 * Context ids are null when the relation carries no such context.
 */
public record RelationKey(
        String subject,
        String predicate,
        String object,
        String contextTime,
        String contextLocation
) {
    public RelationKey {
        Objects.requireNonNull(subject, "subject is required");
        Objects.requireNonNull(predicate, "predicate is required");
        Objects.requireNonNull(object, "object is required");
    }

    /**
     * Canonical signature {@code subject_predicate_object[_time_<id>][_loc_<id>]} used to mint relation ids.
     */
    public String signature() {
        StringBuilder sb = new StringBuilder()
                .append(subject).append('_')
                .append(predicate).append('_')
                .append(object);
        if (contextTime != null) {
            sb.append("_time_").append(contextTime);
        }
        if (contextLocation != null) {
            sb.append("_loc_").append(contextLocation);
        }
        return sb.toString();
    }
}
