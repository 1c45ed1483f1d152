package com.entity.integration.relation;

import com.entity.integration.core.model.GlobalRelation;
import com.entity.integration.core.model.LocalRelation;
import com.entity.integration.identity.ContentHash;
import com.entity.integration.store.GraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps document-local relations onto global entities and deduplicates them.
 *
 * <p>Subject, object and both context references are resolved through the document's
 * local-to-global id map. A relation whose subject or object cannot be resolved is dropped;
 * an unresolvable context is simply left out.</p>
 *
 * <p>Relations with the same resolved tuple collapse into one record whose sources are
 * the union of all contributing documents and whose confidence is the maximum seen.</p>
 */
public class RelationResolver {
    private static final Logger log = LoggerFactory.getLogger(RelationResolver.class);

    public static final int ID_HASH_LENGTH = 11;

    private final GraphStore store;

    public RelationResolver(GraphStore store) {
        this.store = Objects.requireNonNull(store, "store is required");
    }

    /**
     * Integrates a relation.
     *
     * @param documentId document the relation was extracted from
     * @param relation   the local relation
     * @param idMap      local entity id to global entity id for that document
     * @return true if a new global relation was created
     */
    public boolean integrateRelation(String documentId, LocalRelation relation, Map<String, String> idMap) {
        return resolve(documentId, relation, idMap) == RelationOutcome.ADDED;
    }

    /**
     * Integrates a relation and reports what happened to it.
     */
    public RelationOutcome resolve(String documentId, LocalRelation relation, Map<String, String> idMap) {
        String subject = idMap.get(relation.subject());
        String object = idMap.get(relation.object());
        if (subject == null || object == null) {
            log.debug("relation.dropped documentId={} subject={} object={} predicate={}",
                    documentId, relation.subject(), relation.object(), relation.predicate());
            return RelationOutcome.DROPPED;
        }

        String contextTime = relation.contextTime() != null ? idMap.get(relation.contextTime()) : null;
        String contextLocation = relation.contextLocation() != null ? idMap.get(relation.contextLocation()) : null;
        RelationKey key = new RelationKey(subject, relation.predicate(), object, contextTime, contextLocation);

        Optional<GlobalRelation> existing = store.findRelation(key);
        if (existing.isPresent()) {
            GlobalRelation stored = existing.get();
            stored.raiseConfidence(relation.confidence());
            stored.addSource(documentId);
            log.debug("relation.deduplicated relationId={} documentId={}", stored.getId(), documentId);
            return RelationOutcome.DEDUPLICATED;
        }

        GlobalRelation created = GlobalRelation.builder()
                .id(relationId(key))
                .subject(subject)
                .predicate(relation.predicate())
                .object(object)
                .contextTime(contextTime)
                .contextLocation(contextLocation)
                .confidence(relation.confidence())
                .source(documentId)
                .build();
        store.addRelation(key, created);
        log.debug("relation.added relationId={} predicate={} documentId={}",
                created.getId(), created.getPredicate(), documentId);
        return RelationOutcome.ADDED;
    }

    /**
     * Mints the relation id: {@code "R"} followed by the first 11 hex characters of the signature hash.
     */
    public static String relationId(RelationKey key) {
        return "R" + ContentHash.md5Prefix(key.signature(), ID_HASH_LENGTH);
    }
}
