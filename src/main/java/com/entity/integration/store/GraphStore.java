package com.entity.integration.store;

import com.entity.integration.core.model.GlobalEntity;
import com.entity.integration.core.model.GlobalRelation;
import com.entity.integration.core.model.KnowledgeGraph;
import com.entity.integration.relation.RelationKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory accumulator for one integration run.
 *
 * <p>Entities and relations are kept in creation order and are never removed. The store
 * also remembers which global entity every document-scoped entity was folded into.</p>
 *
 * <p>Not thread-safe; callers serialize access (see
 * {@link com.entity.integration.api.IntegrationOrchestrator}).</p>
 */
public class GraphStore {

    private final Map<String, GlobalEntity> entities = new LinkedHashMap<>();
    private final Map<RelationKey, GlobalRelation> relations = new LinkedHashMap<>();
    private final Map<DocumentScopedId, String> idMapping = new HashMap<>();

    public Optional<GlobalEntity> findEntity(String globalId) {
        return Optional.ofNullable(entities.get(globalId));
    }

    public boolean containsEntity(String globalId) {
        return entities.containsKey(globalId);
    }

    /**
     * Adds a new entity.
     *
     * @throws IllegalStateException if an entity with the same id is already stored
     */
    public void addEntity(GlobalEntity entity) {
        Objects.requireNonNull(entity, "entity is required");
        if (entities.putIfAbsent(entity.getId(), entity) != null) {
            throw new IllegalStateException("Entity already stored: " + entity.getId());
        }
    }

    /**
     * Live, unmodifiable view of the entities in insertion order.
     */
    public Collection<GlobalEntity> entities() {
        return Collections.unmodifiableCollection(entities.values());
    }

    public Optional<GlobalRelation> findRelation(RelationKey key) {
        return Optional.ofNullable(relations.get(key));
    }

    /**
     * Adds a new relation.
     *
     * @throws IllegalStateException if a relation with the same key is already stored
     */
    public void addRelation(RelationKey key, GlobalRelation relation) {
        Objects.requireNonNull(relation, "relation is required");
        if (!entities.containsKey(relation.getSubject()) || !entities.containsKey(relation.getObject())) {
            throw new IllegalStateException("Relation references unknown entity: " + relation);
        }
        if (relations.putIfAbsent(key, relation) != null) {
            throw new IllegalStateException("Relation already stored: " + key.signature());
        }
    }

    /**
     * Live, unmodifiable view of the relations in insertion order.
     */
    public Collection<GlobalRelation> relations() {
        return Collections.unmodifiableCollection(relations.values());
    }

    public void mapLocalId(String documentId, String localId, String globalId) {
        idMapping.put(new DocumentScopedId(documentId, localId), globalId);
    }

    /**
     * Returns the global id a document-scoped entity was integrated into.
     */
    public Optional<String> resolveGlobalId(String documentId, String localId) {
        return Optional.ofNullable(idMapping.get(new DocumentScopedId(documentId, localId)));
    }

    public int entityCount() {
        return entities.size();
    }

    public int relationCount() {
        return relations.size();
    }

    /**
     * Copies the current contents into an immutable graph.
     */
    public KnowledgeGraph snapshot() {
        return new KnowledgeGraph(new ArrayList<>(entities.values()), new ArrayList<>(relations.values()));
    }

    private record DocumentScopedId(String documentId, String localId) {
    }
}
