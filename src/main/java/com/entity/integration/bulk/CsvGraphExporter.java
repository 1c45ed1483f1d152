package com.entity.integration.bulk;

import com.entity.integration.core.model.EntityType;
import com.entity.integration.core.model.GlobalEntity;
import com.entity.integration.core.model.GlobalRelation;
import com.entity.integration.core.model.KnowledgeGraph;
import com.entity.integration.core.model.LocationAttributes;
import com.entity.integration.core.model.TimeAttributes;
import com.entity.integration.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CSV exporter producing the four files a property-graph bulk loader expects.
 *
 * <p>Output files, each with a header row:</p>
 * <pre>
 * entities.csv     entity_id,type,text,normalized,confidence,sources
 * locations.csv    entity_id,latitude,longitude,display_name,location_type,importance,bbox_south,bbox_north,bbox_west,bbox_east
 * timeperiods.csv  entity_id,precision,type,start_date,end_date,date_reliability
 * relations.csv    relation_id,subject_id,predicate,object_id,confidence,context_time_id,context_location_id,sources
 * </pre>
 *
 * <p>Every LOCATION entity gets a locations row and every TIME entity a timeperiods row,
 * with empty cells for absent attributes. Sources are joined with {@code |}. Fields are
 * quoted only when they contain a comma, quote or line break; rows end with CRLF.</p>
 */
public class CsvGraphExporter implements GraphExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvGraphExporter.class);

    static final String ENTITIES_FILE = "entities.csv";
    static final String LOCATIONS_FILE = "locations.csv";
    static final String TIMEPERIODS_FILE = "timeperiods.csv";
    static final String RELATIONS_FILE = "relations.csv";

    private static final String LINE_END = "\r\n";
    private static final String SOURCE_SEPARATOR = "|";

    /**
     * Writes the four CSV files into the directory, creating it if needed.
     */
    @Override
    public ExportResult export(KnowledgeGraph graph, Path directory) {
        try (LogContext ctx = LogContext.forExport(getFormat())) {
            Files.createDirectories(directory);
            long entities;
            long locations;
            long timeperiods;
            long relations;
            try (Writer writer = Files.newBufferedWriter(directory.resolve(ENTITIES_FILE), StandardCharsets.UTF_8)) {
                entities = writeEntities(graph, writer);
            }
            try (Writer writer = Files.newBufferedWriter(directory.resolve(LOCATIONS_FILE), StandardCharsets.UTF_8)) {
                locations = writeLocations(graph, writer);
            }
            try (Writer writer = Files.newBufferedWriter(directory.resolve(TIMEPERIODS_FILE), StandardCharsets.UTF_8)) {
                timeperiods = writeTimeperiods(graph, writer);
            }
            try (Writer writer = Files.newBufferedWriter(directory.resolve(RELATIONS_FILE), StandardCharsets.UTF_8)) {
                relations = writeRelations(graph, writer);
            }
            ExportResult result = new ExportResult(entities, locations, timeperiods, relations);
            log.info("export.completed directory={} result={}", directory, result);
            return result;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write CSV files to " + directory, e);
        }
    }

    public long writeEntities(KnowledgeGraph graph, Writer writer) throws IOException {
        writeRow(writer, "entity_id", "type", "text", "normalized", "confidence", "sources");
        long count = 0;
        for (GlobalEntity entity : graph.entities()) {
            writeRow(writer,
                    entity.getId(),
                    entity.getType().name(),
                    entity.getText(),
                    entity.getNormalized(),
                    formatNumber(entity.getConfidence()),
                    joinSources(entity.getSources()));
            count++;
        }
        writer.flush();
        return count;
    }

    public long writeLocations(KnowledgeGraph graph, Writer writer) throws IOException {
        writeRow(writer, "entity_id", "latitude", "longitude", "display_name", "location_type",
                "importance", "bbox_south", "bbox_north", "bbox_west", "bbox_east");
        long count = 0;
        for (GlobalEntity entity : graph.entities()) {
            if (entity.getType() != EntityType.LOCATION) {
                continue;
            }
            LocationAttributes location = entity.getLocation() != null
                    ? entity.getLocation() : LocationAttributes.builder().build();
            writeRow(writer,
                    entity.getId(),
                    formatNumber(location.getLatitude()),
                    formatNumber(location.getLongitude()),
                    location.getDisplayName(),
                    location.getLocationType(),
                    formatNumber(location.getImportance()),
                    formatNumber(location.getBboxSouth()),
                    formatNumber(location.getBboxNorth()),
                    formatNumber(location.getBboxWest()),
                    formatNumber(location.getBboxEast()));
            count++;
        }
        writer.flush();
        return count;
    }

    public long writeTimeperiods(KnowledgeGraph graph, Writer writer) throws IOException {
        writeRow(writer, "entity_id", "precision", "type", "start_date", "end_date", "date_reliability");
        long count = 0;
        for (GlobalEntity entity : graph.entities()) {
            if (entity.getType() != EntityType.TIME) {
                continue;
            }
            TimeAttributes time = entity.getTime() != null ? entity.getTime() : TimeAttributes.builder().build();
            writeRow(writer,
                    entity.getId(),
                    time.getPrecision() != null ? time.getPrecision().name() : null,
                    time.getType() != null ? time.getType().name() : null,
                    time.getStartDate(),
                    time.getEndDate(),
                    formatNumber(time.getDateReliability()));
            count++;
        }
        writer.flush();
        return count;
    }

    public long writeRelations(KnowledgeGraph graph, Writer writer) throws IOException {
        writeRow(writer, "relation_id", "subject_id", "predicate", "object_id", "confidence",
                "context_time_id", "context_location_id", "sources");
        long count = 0;
        for (GlobalRelation relation : graph.relations()) {
            writeRow(writer,
                    relation.getId(),
                    relation.getSubject(),
                    relation.getPredicate(),
                    relation.getObject(),
                    formatNumber(relation.getConfidence()),
                    relation.getContextTime(),
                    relation.getContextLocation(),
                    joinSources(relation.getSources()));
            count++;
        }
        writer.flush();
        return count;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private static void writeRow(Writer writer, String... fields) throws IOException {
        for (int i = 0; i < fields.length; i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(csvEscape(fields[i]));
        }
        writer.write(LINE_END);
    }

    private static String joinSources(List<String> sources) {
        return String.join(SOURCE_SEPARATOR, sources);
    }

    /**
     * Shortest decimal form of the value, always with a fractional part ("1.0", "48.2082").
     * Null becomes an empty cell.
     */
    static String formatNumber(Double value) {
        if (value == null) {
            return null;
        }
        if (value.isNaN() || value.isInfinite()) {
            return value.toString();
        }
        String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
