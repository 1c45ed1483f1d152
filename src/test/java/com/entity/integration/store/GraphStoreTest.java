package com.entity.integration.store;

import com.entity.integration.core.model.EntityType;
import com.entity.integration.core.model.GlobalEntity;
import com.entity.integration.core.model.GlobalRelation;
import com.entity.integration.core.model.KnowledgeGraph;
import com.entity.integration.relation.RelationKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphStore Tests")
class GraphStoreTest {

    private GraphStore store;

    @BeforeEach
    void setUp() {
        store = new GraphStore();
    }

    private static GlobalEntity entity(String id) {
        return GlobalEntity.builder().id(id).type(EntityType.PERSON).text(id).build();
    }

    private static GlobalRelation relation(String id, String subject, String object) {
        return GlobalRelation.builder().id(id).subject(subject).predicate("met").object(object).build();
    }

    @Test
    @DisplayName("Entities keep insertion order")
    void insertionOrder() {
        store.addEntity(entity("c"));
        store.addEntity(entity("a"));
        store.addEntity(entity("b"));

        assertEquals(List.of("c", "a", "b"), store.entities().stream().map(GlobalEntity::getId).toList());
        assertTrue(store.containsEntity("a"));
        assertTrue(store.findEntity("b").isPresent());
        assertTrue(store.findEntity("z").isEmpty());
    }

    @Test
    @DisplayName("Duplicate entity id is rejected")
    void duplicateEntity() {
        store.addEntity(entity("a"));
        assertThrows(IllegalStateException.class, () -> store.addEntity(entity("a")));
    }

    @Test
    @DisplayName("Relation must reference stored entities")
    void relationReferentialIntegrity() {
        store.addEntity(entity("a"));
        RelationKey key = new RelationKey("a", "met", "b", null, null);
        assertThrows(IllegalStateException.class, () -> store.addRelation(key, relation("R1", "a", "b")));

        store.addEntity(entity("b"));
        store.addRelation(key, relation("R1", "a", "b"));
        assertEquals(1, store.relationCount());
        assertTrue(store.findRelation(key).isPresent());
        assertThrows(IllegalStateException.class, () -> store.addRelation(key, relation("R1", "a", "b")));
    }

    @Test
    @DisplayName("Views are unmodifiable")
    void unmodifiableViews() {
        store.addEntity(entity("a"));
        assertThrows(UnsupportedOperationException.class, () -> store.entities().clear());
        assertThrows(UnsupportedOperationException.class, () -> store.relations().clear());
    }

    @Test
    @DisplayName("Local ids are scoped by document")
    void documentScopedIds() {
        store.mapLocalId("doc1", "e1", "g1");
        store.mapLocalId("doc2", "e1", "g2");

        assertEquals("g1", store.resolveGlobalId("doc1", "e1").orElseThrow());
        assertEquals("g2", store.resolveGlobalId("doc2", "e1").orElseThrow());
        assertTrue(store.resolveGlobalId("doc3", "e1").isEmpty());
    }

    @Test
    @DisplayName("Snapshot is detached from later additions")
    void snapshotIsDetached() {
        store.addEntity(entity("a"));
        KnowledgeGraph snapshot = store.snapshot();
        store.addEntity(entity("b"));

        assertEquals(1, snapshot.entityCount());
        assertEquals(2, store.entityCount());
    }
}
