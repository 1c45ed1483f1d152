package com.entity.integration.bulk;

import com.entity.integration.api.IntegrationOptions;
import com.entity.integration.api.IntegrationOrchestrator;
import com.entity.integration.core.model.GlobalRelation;
import com.entity.integration.core.model.KnowledgeGraph;
import com.entity.integration.metrics.MetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchIntegratorTest {

    @TempDir
    Path inputDir;

    @Mock
    private MetricsService metricsService;

    private static String document(String troopsText, double confidence) {
        return """
                {
                  "entities": [
                    {"id": "e1", "type": "PERSON", "text": "%s", "confidence": 0.85},
                    {"id": "e2", "type": "LOCATION", "text": "Vienna", "confidence": 0.9}
                  ],
                  "relations": [
                    {"subject": "e1", "predicate": "capitulation", "object": "e2", "confidence": %s}
                  ],
                  "locations": [
                    {"entity_id": "e2", "latitude": 48.2082, "longitude": 16.3738}
                  ]
                }
                """.formatted(troopsText, confidence);
    }

    private void write(String name, String content) throws Exception {
        Files.writeString(inputDir.resolve(name), content);
    }

    private static IntegrationOrchestrator orchestrator(int parallelism) {
        return IntegrationOrchestrator.builder()
                .options(IntegrationOptions.builder().parseParallelism(parallelism).build())
                .build();
    }

    @Test
    @DisplayName("Should integrate every JSON file in the directory")
    void testIntegratesDirectory() throws Exception {
        write("doc1.json", document("French troops", 0.7));
        write("doc2.json", document("French troops", 0.9));
        write("notes.txt", "not json");

        IntegrationOrchestrator orchestrator = orchestrator(1);
        IntegrationSummary summary = new BatchIntegrator(orchestrator, new DocumentLoader(), metricsService)
                .integrateDirectory(inputDir, null);

        assertEquals(2, summary.filesProcessed());
        assertEquals(2, summary.documentsIntegrated());
        assertEquals(2, summary.totalEntities());
        assertEquals(1, summary.totalRelations());
        assertFalse(summary.hasErrors());

        GlobalRelation relation = orchestrator.snapshot().relations().get(0);
        assertEquals(List.of("doc1", "doc2"), relation.getSources());
        verify(metricsService, never()).incrementDocumentFailed();
    }

    @Test
    @DisplayName("Should skip a malformed file and integrate the rest")
    void testSkipsMalformed() throws Exception {
        write("a.json", document("French troops", 0.7));
        write("b.json", "{\"entities\": [");
        write("c.json", document("French troops", 0.8));

        IntegrationOrchestrator orchestrator = orchestrator(1);
        IntegrationSummary summary = new BatchIntegrator(orchestrator, new DocumentLoader(), metricsService)
                .integrateDirectory(inputDir, ProgressCallback.NOOP);

        assertEquals(2, summary.filesProcessed());
        assertEquals(1, summary.filesFailed());
        assertTrue(summary.isPartial());
        assertTrue(summary.errors().get(0).file().endsWith("b.json"));
        assertEquals(List.of("a", "c"), orchestrator.snapshot().relations().get(0).getSources());
        verify(metricsService).incrementDocumentFailed();
    }

    @Test
    @DisplayName("Should integrate a file with an overflowing coordinate and the files after it")
    void testOverflowingCoordinate() throws Exception {
        write("a.json", """
                {
                  "entities": [{"id": "e1", "type": "LOCATION", "text": "Atlantis", "confidence": 0.6}],
                  "locations": [{"entity_id": "e1", "latitude": 1e400, "longitude": 16.3738}]
                }
                """);
        write("b.json", """
                {"entities": [{"id": "e1", "type": "PERSON", "text": "Napoleon Bonaparte", "confidence": 0.9}]}
                """);

        IntegrationOrchestrator orchestrator = orchestrator(1);
        IntegrationSummary summary = new BatchIntegrator(orchestrator, new DocumentLoader(), metricsService)
                .integrateDirectory(inputDir, null);

        assertEquals(2, summary.filesProcessed());
        assertFalse(summary.hasErrors());
        assertEquals(2, summary.totalEntities());
        assertTrue(orchestrator.resolveGlobalId("b", "e1").isPresent());
        assertNull(orchestrator.snapshot().entities().get(0).getLocation().getLatitude());
    }

    @Test
    @DisplayName("Should record a document that fails to integrate and continue with the next file")
    void testDocumentFailureContinues() throws Exception {
        write("a.json", document("French troops", 0.7));
        write("b.json", document("French troops", 0.8));

        IntegrationOrchestrator orchestrator = spy(orchestrator(1));
        doThrow(new IllegalArgumentException("unusable attribute"))
                .when(orchestrator).integrateDocument(eq("a"), any());

        IntegrationSummary summary = new BatchIntegrator(orchestrator, new DocumentLoader(), metricsService)
                .integrateDirectory(inputDir, null);

        assertEquals(1, summary.filesProcessed());
        assertEquals(1, summary.filesFailed());
        assertEquals(1, summary.documentsIntegrated());
        assertTrue(summary.errors().get(0).file().endsWith("a.json"));
        assertTrue(summary.errors().get(0).message().contains("unusable attribute"));
        assertEquals(List.of("b"), orchestrator.snapshot().relations().get(0).getSources());
        verify(metricsService).incrementDocumentFailed();
    }

    @Test
    @DisplayName("Should total the entities skipped while reading")
    void testCountsSkippedEntities() throws Exception {
        write("a.json", """
                {
                  "entities": [
                    {"id": "e1", "type": "PERSON", "text": "Napoleon Bonaparte"},
                    {"id": "e2", "type": "PERSON"},
                    {"type": "EVENT", "text": "Battle of Austerlitz"}
                  ]
                }
                """);
        write("b.json", """
                {"entities": [{"id": "e1", "type": "DRAGON", "text": "Smaug"}]}
                """);

        IntegrationSummary summary = new BatchIntegrator(orchestrator(1)).integrateDirectory(inputDir, null);

        assertEquals(3, summary.entitiesSkipped());
        assertEquals(1, summary.totalEntities());
    }

    @Test
    @DisplayName("Should reject a batch on a finalized orchestrator")
    void testRejectsAfterFinalize() throws Exception {
        write("a.json", document("French troops", 0.7));
        IntegrationOrchestrator orchestrator = orchestrator(1);
        orchestrator.finalizeGraph();

        assertThrows(IllegalStateException.class,
                () -> new BatchIntegrator(orchestrator).integrateDirectory(inputDir, null));
    }

    @Test
    @DisplayName("Should integrate in file-name order regardless of parse parallelism")
    void testParallelParseKeepsOrder() throws Exception {
        for (int i = 0; i < 8; i++) {
            write("doc" + i + ".json", document("French troops", 0.5 + i * 0.05));
        }

        IntegrationOrchestrator sequential = orchestrator(1);
        new BatchIntegrator(sequential).integrateDirectory(inputDir, null);
        IntegrationOrchestrator parallel = orchestrator(4);
        new BatchIntegrator(parallel).integrateDirectory(inputDir, null);

        KnowledgeGraph expected = sequential.snapshot();
        KnowledgeGraph actual = parallel.snapshot();
        assertEquals(expected.entities(), actual.entities());
        assertEquals(expected.relations().get(0).getSources(), actual.relations().get(0).getSources());
        assertEquals(List.of("doc0", "doc1", "doc2", "doc3", "doc4", "doc5", "doc6", "doc7"),
                actual.relations().get(0).getSources());
    }

    @Test
    @DisplayName("Should report progress once per file")
    void testProgress() throws Exception {
        write("doc1.json", document("French troops", 0.7));
        write("doc2.json", "broken");

        List<String> messages = new ArrayList<>();
        new BatchIntegrator(orchestrator(1))
                .integrateDirectory(inputDir, (processed, total, message) -> messages.add(processed + "/" + total));

        assertEquals(List.of("1/2", "2/2"), messages);
    }

    @Test
    @DisplayName("Should reject a path that is not a directory")
    void testNotADirectory() throws Exception {
        write("doc1.json", document("French troops", 0.7));

        assertThrows(IllegalArgumentException.class,
                () -> new BatchIntegrator(orchestrator(1)).integrateDirectory(inputDir.resolve("doc1.json"), null));
    }
}
