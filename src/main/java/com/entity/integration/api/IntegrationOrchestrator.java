package com.entity.integration.api;

import com.entity.integration.core.model.CandidateEntity;
import com.entity.integration.core.model.DocumentRecord;
import com.entity.integration.core.model.EntityType;
import com.entity.integration.core.model.GlobalEntity;
import com.entity.integration.core.model.KnowledgeGraph;
import com.entity.integration.core.model.LocalEntity;
import com.entity.integration.core.model.LocalRelation;
import com.entity.integration.core.model.LocationAttributes;
import com.entity.integration.core.model.LocationRecord;
import com.entity.integration.core.model.TimeAttributes;
import com.entity.integration.core.model.TimePeriodRecord;
import com.entity.integration.identity.IdentityAssigner;
import com.entity.integration.merge.AttributeMerger;
import com.entity.integration.metrics.MetricsService;
import com.entity.integration.metrics.NoOpMetricsService;
import com.entity.integration.relation.RelationOutcome;
import com.entity.integration.relation.RelationResolver;
import com.entity.integration.similarity.EntityMatcher;
import com.entity.integration.store.GraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Main entry point for integrating per-document extractions into one knowledge graph.
 *
 * <h2>Per-document flow</h2>
 * <ol>
 *   <li>Index the document's location and timeperiod rows by local entity id.</li>
 *   <li>For each entity in listed order: scan the global entities in insertion order and
 *       merge into the first similar one; otherwise mint a global id and create a new
 *       entity. Record the local to global mapping.</li>
 *   <li>For each relation in listed order: resolve and deduplicate it.</li>
 * </ol>
 *
 * <p>Results depend on the order of documents and of entities within them. All calls are
 * serialized by a single lock, so concurrent callers cannot interleave documents.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * IntegrationOrchestrator orchestrator = IntegrationOrchestrator.builder()
 *     .options(IntegrationOptions.defaults())
 *     .build();
 *
 * orchestrator.integrateDocument("doc1", record1);
 * orchestrator.integrateDocument("doc2", record2);
 *
 * ValidationReport report = orchestrator.validate();
 * KnowledgeGraph graph = orchestrator.finalizeGraph();
 * </pre>
 */
public class IntegrationOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(IntegrationOrchestrator.class);

    /**
     * Lifecycle of an orchestrator.
     */
    public enum State {
        ACCEPTING,
        FINALIZED
    }

    private final GraphStore store;
    private final IdentityAssigner identityAssigner;
    private final EntityMatcher matcher;
    private final AttributeMerger merger;
    private final RelationResolver relationResolver;
    private final MetricsService metricsService;
    private final IntegrationOptions options;
    private final ReentrantLock lock = new ReentrantLock();
    private State state = State.ACCEPTING;

    private IntegrationOrchestrator(Builder builder) {
        this.options = builder.options;
        this.store = builder.store != null ? builder.store : new GraphStore();
        this.identityAssigner = new IdentityAssigner();
        this.matcher = new EntityMatcher(options.getSimilarityThreshold(), options.getGeoMatchDistanceKm());
        this.merger = new AttributeMerger();
        this.relationResolver = new RelationResolver(store);
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
    }

    /**
     * Integrates one document into the global store.
     *
     * @param documentId provenance id recorded on every entity and relation the document touches
     * @param record     the document's enhanced extraction output
     * @return counts describing what the document contributed
     * @throws IllegalStateException if the orchestrator has been finalized
     */
    public DocumentIntegrationResult integrateDocument(String documentId, DocumentRecord record) {
        Objects.requireNonNull(documentId, "documentId is required");
        Objects.requireNonNull(record, "record is required");

        lock.lock();
        try {
            if (state == State.FINALIZED) {
                throw new IllegalStateException("Orchestrator is finalized; cannot integrate " + documentId);
            }
            long start = System.nanoTime();
            log.debug("document.integrating documentId={} entities={} relations={} locations={} timeperiods={}",
                    documentId, record.entities().size(), record.relations().size(),
                    record.locations().size(), record.timeperiods().size());

            Map<String, LocationAttributes> locationIndex = new HashMap<>();
            for (LocationRecord location : record.locations()) {
                locationIndex.put(location.entityId(), location.attributes());
            }
            Map<String, TimeAttributes> timeIndex = new HashMap<>();
            for (TimePeriodRecord timeperiod : record.timeperiods()) {
                timeIndex.put(timeperiod.entityId(), timeperiod.attributes());
            }

            Map<String, String> idMap = new HashMap<>();
            int created = 0;
            int merged = 0;
            for (LocalEntity entity : record.entities()) {
                CandidateEntity candidate = new CandidateEntity(entity,
                        entity.type() == EntityType.LOCATION ? locationIndex.get(entity.id()) : null,
                        entity.type() == EntityType.TIME ? timeIndex.get(entity.id()) : null);

                String globalId;
                Optional<GlobalEntity> match = matcher.findFirstMatch(store.entities(), candidate);
                if (match.isPresent()) {
                    globalId = match.get().getId();
                    mergeInto(match.get(), candidate, documentId);
                    merged++;
                } else {
                    globalId = identityAssigner.assign(candidate);
                    Optional<GlobalEntity> sameSignature = store.findEntity(globalId);
                    if (sameSignature.isPresent()) {
                        log.debug("entity.signature.shared globalId={} text='{}'", globalId, entity.text());
                        mergeInto(sameSignature.get(), candidate, documentId);
                        merged++;
                    } else {
                        store.addEntity(createEntity(globalId, candidate, documentId));
                        metricsService.incrementEntityCreated(entity.type());
                        created++;
                    }
                }
                idMap.put(entity.id(), globalId);
                store.mapLocalId(documentId, entity.id(), globalId);
            }

            int added = 0;
            int deduplicated = 0;
            int dropped = 0;
            for (LocalRelation relation : record.relations()) {
                RelationOutcome outcome = relationResolver.resolve(documentId, relation, idMap);
                switch (outcome) {
                    case ADDED -> {
                        added++;
                        metricsService.incrementRelationAdded();
                    }
                    case DEDUPLICATED -> {
                        deduplicated++;
                        metricsService.incrementRelationDeduplicated();
                    }
                    case DROPPED -> {
                        dropped++;
                        metricsService.incrementRelationDropped();
                    }
                }
            }

            DocumentIntegrationResult result = new DocumentIntegrationResult(
                    documentId, created, merged, record.entitiesSkipped(), added, deduplicated, dropped);
            metricsService.recordDocumentIntegrated(Duration.ofNanos(System.nanoTime() - start));
            log.debug("document.integrated result={} totalEntities={} totalRelations={}",
                    result, store.entityCount(), store.relationCount());
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends the run and returns the integrated graph. Further integration is rejected.
     * Calling this again returns a fresh snapshot of the same store.
     */
    public KnowledgeGraph finalizeGraph() {
        lock.lock();
        try {
            if (state != State.FINALIZED) {
                state = State.FINALIZED;
                log.info("integration.finalized entities={} relations={}",
                        store.entityCount(), store.relationCount());
            }
            return store.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Computes data-quality statistics over the current store without modifying it.
     */
    public ValidationReport validate() {
        lock.lock();
        try {
            return ValidationReport.of(store.entities(), store.relations());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the global id a document-scoped entity was integrated into.
     */
    public Optional<String> resolveGlobalId(String documentId, String localId) {
        lock.lock();
        try {
            return store.resolveGlobalId(documentId, localId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a snapshot of the graph integrated so far, without finalizing.
     */
    public KnowledgeGraph snapshot() {
        lock.lock();
        try {
            return store.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public State getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public IntegrationOptions getOptions() {
        return options;
    }

    private void mergeInto(GlobalEntity global, CandidateEntity candidate, String documentId) {
        global.addSource(documentId);
        merger.mergeCoreFields(global, candidate);
        if (candidate.getType() == EntityType.LOCATION) {
            merger.mergeLocation(global, candidate.getLocation());
        } else if (candidate.getType() == EntityType.TIME) {
            merger.mergeTime(global, candidate.getTime());
        }
        metricsService.incrementEntityMerged(candidate.getType());
        log.debug("entity.merged globalId={} type={} text='{}' documentId={}",
                global.getId(), candidate.getType(), candidate.getText(), documentId);
    }

    private GlobalEntity createEntity(String globalId, CandidateEntity candidate, String documentId) {
        GlobalEntity entity = GlobalEntity.builder()
                .id(globalId)
                .type(candidate.getType())
                .text(candidate.getText())
                .normalized(candidate.getNormalized())
                .confidence(candidate.getConfidence())
                .source(documentId)
                .location(candidate.getLocation() != null ? candidate.getLocation().copy() : null)
                .time(candidate.getTime() != null ? candidate.getTime().copy() : null)
                .build();
        log.debug("entity.created globalId={} type={} text='{}' documentId={}",
                globalId, candidate.getType(), candidate.getText(), documentId);
        return entity;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IntegrationOptions options = IntegrationOptions.defaults();
        private GraphStore store;
        private MetricsService metricsService;

        public Builder options(IntegrationOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        /**
         * Store to accumulate into. Defaults to a new, empty store.
         */
        public Builder store(GraphStore store) {
            this.store = store;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public IntegrationOrchestrator build() {
            return new IntegrationOrchestrator(this);
        }
    }
}
