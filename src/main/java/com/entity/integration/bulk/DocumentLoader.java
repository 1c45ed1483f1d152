package com.entity.integration.bulk;

import com.entity.integration.core.model.DocumentRecord;
import com.entity.integration.core.model.EntityType;
import com.entity.integration.core.model.LocalEntity;
import com.entity.integration.core.model.LocalRelation;
import com.entity.integration.core.model.LocationAttributes;
import com.entity.integration.core.model.LocationRecord;
import com.entity.integration.core.model.TimeAttributes;
import com.entity.integration.core.model.TimePeriodRecord;
import com.entity.integration.core.model.TimePrecision;
import com.entity.integration.core.model.TimeType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads enhanced extraction output from JSON.
 *
 * <p>Two layouts are accepted:</p>
 * <pre>
 * // one document per file, document id = file name without ".json"
 * {"entities": [...], "relations": [...], "locations": [...], "timeperiods": [...]}
 *
 * // several documents per file, document id = "&lt;file name&gt;_&lt;key&gt;"
 * {"article1": {"entities": [...], ...}, "article2": {...}}
 * </pre>
 *
 * <p>Field presence is checked defensively: absent optional fields are treated as absent,
 * entities without an id, text or known type are skipped (and counted on the
 * {@link DocumentRecord}), relations without subject,
 * predicate or object are skipped. Only an unreadable or structurally unusable file
 * raises {@link DocumentLoadException}.</p>
 */
public class DocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);
    private static final String JSON_SUFFIX = ".json";

    private final ObjectMapper objectMapper;

    public DocumentLoader() {
        this(new ObjectMapper());
    }

    public DocumentLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads every document contained in a file.
     *
     * @throws DocumentLoadException if the file cannot be read or parsed
     */
    public List<LoadedDocument> load(Path file) {
        String baseName = baseName(file);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(baseName, reader);
        } catch (IOException e) {
            throw new DocumentLoadException(file.toString(), "Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads every document from a reader.
     *
     * @param baseName name the document ids are derived from
     * @throws DocumentLoadException if the content is not a JSON object
     */
    public List<LoadedDocument> load(String baseName, Reader reader) {
        JsonNode root;
        try {
            root = objectMapper.readTree(reader);
        } catch (JsonProcessingException e) {
            throw new DocumentLoadException(baseName, "Malformed JSON in " + baseName + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DocumentLoadException(baseName, "Cannot read " + baseName + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DocumentLoadException(baseName, "Expected a JSON object at the root of " + baseName);
        }

        List<LoadedDocument> documents = new ArrayList<>();
        if (isMultiDocument(root)) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String documentId = baseName + "_" + field.getKey();
                documents.add(new LoadedDocument(documentId, parseDocument(documentId, field.getValue())));
            }
        } else {
            documents.add(new LoadedDocument(baseName, parseDocument(baseName, root)));
        }
        return documents;
    }

    /**
     * A root object is a document map when it has no entity list and every value is an object.
     */
    static boolean isMultiDocument(JsonNode root) {
        if (root.has("entities")) {
            return false;
        }
        for (JsonNode value : root) {
            if (!value.isObject()) {
                return false;
            }
        }
        return true;
    }

    DocumentRecord parseDocument(String documentId, JsonNode node) {
        List<LocalEntity> entities = new ArrayList<>();
        int entitiesSkipped = 0;
        for (JsonNode entityNode : arrayOf(node, "entities")) {
            Optional<LocalEntity> entity = parseEntity(documentId, entityNode);
            if (entity.isPresent()) {
                entities.add(entity.get());
            } else {
                entitiesSkipped++;
            }
        }

        List<LocalRelation> relations = new ArrayList<>();
        for (JsonNode relationNode : arrayOf(node, "relations")) {
            parseRelation(documentId, relationNode).ifPresent(relations::add);
        }

        List<LocationRecord> locations = new ArrayList<>();
        for (JsonNode row : arrayOf(node, "locations")) {
            String entityId = text(row, "entity_id");
            if (entityId == null) {
                log.debug("document.location.skipped documentId={} reason=missing entity_id", documentId);
                continue;
            }
            locations.add(new LocationRecord(entityId, parseLocation(row)));
        }

        List<TimePeriodRecord> timeperiods = new ArrayList<>();
        for (JsonNode row : arrayOf(node, "timeperiods")) {
            String entityId = text(row, "entity_id");
            if (entityId == null) {
                log.debug("document.timeperiod.skipped documentId={} reason=missing entity_id", documentId);
                continue;
            }
            timeperiods.add(new TimePeriodRecord(entityId, parseTime(row)));
        }

        return new DocumentRecord(entities, relations, locations, timeperiods, entitiesSkipped);
    }

    private Optional<LocalEntity> parseEntity(String documentId, JsonNode node) {
        String id = text(node, "id");
        String text = text(node, "text");
        String rawType = text(node, "type");
        Optional<EntityType> type = EntityType.fromValue(rawType);
        if (id == null || text == null || type.isEmpty()) {
            log.warn("document.entity.skipped documentId={} id={} type={} reason=missing id, text or known type",
                    documentId, id, rawType);
            return Optional.empty();
        }
        Double confidence = number(node, "confidence");
        return Optional.of(new LocalEntity(id, type.get(), text, text(node, "normalized"),
                confidence != null ? confidence : 0.0));
    }

    private Optional<LocalRelation> parseRelation(String documentId, JsonNode node) {
        String subject = text(node, "subject");
        String predicate = text(node, "predicate");
        String object = text(node, "object");
        if (subject == null || predicate == null || object == null) {
            log.warn("document.relation.skipped documentId={} subject={} predicate={} object={}",
                    documentId, subject, predicate, object);
            return Optional.empty();
        }
        Double confidence = number(node, "confidence");
        return Optional.of(new LocalRelation(subject, predicate, object,
                confidence != null ? confidence : 0.0,
                text(node, "context_time"),
                text(node, "context_location")));
    }

    private LocationAttributes parseLocation(JsonNode row) {
        return LocationAttributes.builder()
                .latitude(number(row, "latitude"))
                .longitude(number(row, "longitude"))
                .displayName(text(row, "display_name"))
                .locationType(text(row, "location_type"))
                .importance(number(row, "importance"))
                .osmId(text(row, "osm_id"))
                .bboxSouth(number(row, "bbox_south"))
                .bboxNorth(number(row, "bbox_north"))
                .bboxWest(number(row, "bbox_west"))
                .bboxEast(number(row, "bbox_east"))
                .build();
    }

    private TimeAttributes parseTime(JsonNode row) {
        String precision = text(row, "precision");
        String type = text(row, "type");
        return TimeAttributes.builder()
                .precision(precision != null ? TimePrecision.fromValue(precision) : null)
                .type(type != null ? TimeType.fromValue(type) : null)
                .startDate(text(row, "start_date"))
                .endDate(text(row, "end_date"))
                .dateReliability(number(row, "date_reliability"))
                .build();
    }

    private static Iterable<JsonNode> arrayOf(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            return List.of();
        }
        List<JsonNode> objects = new ArrayList<>();
        for (JsonNode element : value) {
            if (element.isObject()) {
                objects.add(element);
            }
        }
        return objects;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        return value.asText();
    }

    /**
     * Reads a JSON number or numeric string. NaN and infinities (including overflowing
     * literals such as {@code 1e400}) are treated as absent.
     */
    static Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        Double parsed = null;
        if (value.isNumber()) {
            parsed = value.doubleValue();
        } else if (value.isTextual() && !value.asText().isBlank()) {
            try {
                parsed = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                log.debug("document.field.ignored field={} value='{}' reason=not a number", field, value.asText());
            }
        }
        if (parsed != null && !Double.isFinite(parsed)) {
            log.debug("document.field.ignored field={} value='{}' reason=not finite", field, value.asText());
            return null;
        }
        return parsed;
    }

    static String baseName(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(JSON_SUFFIX) ? name.substring(0, name.length() - JSON_SUFFIX.length()) : name;
    }
}
