package com.entity.integration.bulk;

import com.entity.integration.core.model.EntityType;
import com.entity.integration.core.model.GlobalEntity;
import com.entity.integration.core.model.GlobalRelation;
import com.entity.integration.core.model.KnowledgeGraph;
import com.entity.integration.core.model.LocationAttributes;
import com.entity.integration.core.model.TimeAttributes;
import com.entity.integration.logging.LogContext;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the integrated graph as a single pretty-printed JSON document.
 *
 * <p>Output format:</p>
 * <pre>
 * {
 *   "entities" : [ {
 *     "id" : "3f2a9c1b0d4e",
 *     "type" : "LOCATION",
 *     "text" : "Vienna",
 *     "confidence" : 0.9,
 *     "sources" : [ "doc1", "doc2" ],
 *     "location" : { "latitude" : 48.20849, "longitude" : 16.37208, "display_name" : "Wien, Österreich" }
 *   } ],
 *   "relations" : [ {
 *     "id" : "R5b1e0f7a2c9",
 *     "subject" : "...", "predicate" : "occupied", "object" : "...",
 *     "confidence" : 0.8,
 *     "sources" : [ "doc1", "doc2" ]
 *   } ]
 * }
 * </pre>
 *
 * Absent optional values are omitted rather than written as null.
 */
public class JsonGraphExporter implements GraphExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonGraphExporter.class);

    private final ObjectMapper objectMapper;

    public JsonGraphExporter() {
        this(new ObjectMapper());
    }

    public JsonGraphExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes the graph to a file, creating parent directories as needed.
     */
    @Override
    public ExportResult export(KnowledgeGraph graph, Path file) {
        try (LogContext ctx = LogContext.forExport(getFormat())) {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ExportResult result;
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                result = export(graph, writer);
            }
            log.info("export.completed file={} result={}", file, result);
            return result;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
    }

    /**
     * Writes the graph to a writer. The writer is left open.
     */
    public ExportResult export(KnowledgeGraph graph, Writer writer) throws IOException {
        List<EntityView> entities = graph.entities().stream().map(EntityView::of).toList();
        List<RelationView> relations = graph.relations().stream().map(RelationView::of).toList();

        objectMapper.writer()
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(writer, new GraphView(entities, relations));
        writer.flush();

        long locations = entities.stream().filter(e -> e.location() != null).count();
        long timeperiods = entities.stream().filter(e -> e.time() != null).count();
        return new ExportResult(entities.size(), locations, timeperiods, relations.size());
    }

    @Override
    public String getFormat() {
        return "json";
    }

    record GraphView(List<EntityView> entities, List<RelationView> relations) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record EntityView(
            String id,
            String type,
            String text,
            String normalized,
            double confidence,
            List<String> sources,
            LocationView location,
            TimeView time
    ) {
        static EntityView of(GlobalEntity entity) {
            LocationView location = entity.getType() == EntityType.LOCATION && entity.getLocation() != null
                    ? LocationView.of(entity.getLocation()) : null;
            TimeView time = entity.getType() == EntityType.TIME && entity.getTime() != null
                    ? TimeView.of(entity.getTime()) : null;
            return new EntityView(entity.getId(), entity.getType().name(), entity.getText(),
                    entity.getNormalized(), entity.getConfidence(), entity.getSources(), location, time);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record LocationView(
            Double latitude,
            Double longitude,
            @JsonProperty("display_name") String displayName,
            @JsonProperty("location_type") String locationType,
            Double importance,
            @JsonProperty("osm_id") String osmId,
            @JsonProperty("bbox_south") Double bboxSouth,
            @JsonProperty("bbox_north") Double bboxNorth,
            @JsonProperty("bbox_west") Double bboxWest,
            @JsonProperty("bbox_east") Double bboxEast
    ) {
        static LocationView of(LocationAttributes a) {
            return new LocationView(a.getLatitude(), a.getLongitude(), a.getDisplayName(), a.getLocationType(),
                    a.getImportance(), a.getOsmId(), a.getBboxSouth(), a.getBboxNorth(), a.getBboxWest(),
                    a.getBboxEast());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record TimeView(
            String precision,
            String type,
            @JsonProperty("start_date") String startDate,
            @JsonProperty("end_date") String endDate,
            @JsonProperty("date_reliability") Double dateReliability
    ) {
        static TimeView of(TimeAttributes a) {
            return new TimeView(
                    a.getPrecision() != null ? a.getPrecision().name() : null,
                    a.getType() != null ? a.getType().name() : null,
                    a.getStartDate(), a.getEndDate(), a.getDateReliability());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record RelationView(
            String id,
            String subject,
            String predicate,
            String object,
            double confidence,
            @JsonProperty("context_time") String contextTime,
            @JsonProperty("context_location") String contextLocation,
            List<String> sources
    ) {
        static RelationView of(GlobalRelation relation) {
            return new RelationView(relation.getId(), relation.getSubject(), relation.getPredicate(),
                    relation.getObject(), relation.getConfidence(),
                    relation.hasContextTime() ? relation.getContextTime() : null,
                    relation.hasContextLocation() ? relation.getContextLocation() : null,
                    relation.getSources());
        }
    }
}
