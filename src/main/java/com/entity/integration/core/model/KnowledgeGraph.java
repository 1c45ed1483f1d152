package com.entity.integration.core.model;

import java.util.List;

/**
 * Snapshot of an integrated graph. Both lists are in creation order.
 */
public record KnowledgeGraph(List<GlobalEntity> entities, List<GlobalRelation> relations) {
    public KnowledgeGraph {
        entities = entities != null ? List.copyOf(entities) : List.of();
        relations = relations != null ? List.copyOf(relations) : List.of();
    }

    public int entityCount() {
        return entities.size();
    }

    public int relationCount() {
        return relations.size();
    }
}
