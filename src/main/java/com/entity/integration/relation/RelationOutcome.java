package com.entity.integration.relation;

/**
 * What happened to a local relation during integration.
 */
public enum RelationOutcome {
    /** A new global relation was created. */
    ADDED,
    /** An equivalent global relation existed; provenance and confidence were folded in. */
    DEDUPLICATED,
    /** Subject or object could not be resolved to a global entity. */
    DROPPED
}
