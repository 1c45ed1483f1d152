package com.entity.integration.api;

/**
 * Counts for one integrated document.
 *
 * @param documentId            the document
 * @param entitiesCreated       local entities that became new global entities
 * @param entitiesMerged        local entities folded into an existing global entity
 * @param entitiesSkipped       entities dropped while reading the document (missing id, text or type)
 * @param relationsAdded        relations that became new global relations
 * @param relationsDeduplicated relations folded into an existing global relation
 * @param relationsDropped      relations whose subject or object could not be resolved
 */
public record DocumentIntegrationResult(
        String documentId,
        int entitiesCreated,
        int entitiesMerged,
        int entitiesSkipped,
        int relationsAdded,
        int relationsDeduplicated,
        int relationsDropped
) {
    public int entitiesProcessed() {
        return entitiesCreated + entitiesMerged;
    }

    @Override
    public String toString() {
        return "DocumentIntegrationResult{document=" + documentId +
                ", created=" + entitiesCreated +
                ", merged=" + entitiesMerged +
                ", skipped=" + entitiesSkipped +
                ", relationsAdded=" + relationsAdded +
                ", relationsDeduplicated=" + relationsDeduplicated +
                ", relationsDropped=" + relationsDropped + '}';
    }
}
