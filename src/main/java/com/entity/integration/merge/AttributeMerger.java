package com.entity.integration.merge;

import com.entity.integration.core.model.CandidateEntity;
import com.entity.integration.core.model.GlobalEntity;
import com.entity.integration.core.model.LocationAttributes;
import com.entity.integration.core.model.TimeAttributes;
import com.entity.integration.core.model.TimePrecision;
import com.entity.integration.core.model.TimeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Folds an incoming record's attributes into an existing global entity.
 *
 * <p>Merge policy:</p>
 * <ol>
 *   <li>Completeness: any attribute the global entity lacks (null, empty or zero) is taken
 *       from the incoming record. The time {@code type} is excluded from this rule.</li>
 *   <li>Location refinement: a strictly longer display name wins. Coordinates with strictly
 *       more decimal digits replace latitude, longitude and the whole bounding box together.</li>
 *   <li>Time refinement: a strictly finer precision replaces precision, type, start date,
 *       end date and reliability together.</li>
 *   <li>Core fields: text, confidence and normalized form follow the record with the
 *       strictly higher confidence.</li>
 * </ol>
 *
 * <p>All merges happen in place. No attribute that is present before a merge is absent after it.</p>
 */
public class AttributeMerger {
    private static final Logger log = LoggerFactory.getLogger(AttributeMerger.class);

    private static final List<Attribute<LocationAttributes, ?>> LOCATION_ATTRIBUTES = List.of(
            new Attribute<LocationAttributes, Double>("latitude", LocationAttributes::getLatitude, LocationAttributes::setLatitude),
            new Attribute<LocationAttributes, Double>("longitude", LocationAttributes::getLongitude, LocationAttributes::setLongitude),
            new Attribute<LocationAttributes, String>("display_name", LocationAttributes::getDisplayName, LocationAttributes::setDisplayName),
            new Attribute<LocationAttributes, String>("location_type", LocationAttributes::getLocationType, LocationAttributes::setLocationType),
            new Attribute<LocationAttributes, Double>("importance", LocationAttributes::getImportance, LocationAttributes::setImportance),
            new Attribute<LocationAttributes, String>("osm_id", LocationAttributes::getOsmId, LocationAttributes::setOsmId),
            new Attribute<LocationAttributes, Double>("bbox_south", LocationAttributes::getBboxSouth, LocationAttributes::setBboxSouth),
            new Attribute<LocationAttributes, Double>("bbox_north", LocationAttributes::getBboxNorth, LocationAttributes::setBboxNorth),
            new Attribute<LocationAttributes, Double>("bbox_west", LocationAttributes::getBboxWest, LocationAttributes::setBboxWest),
            new Attribute<LocationAttributes, Double>("bbox_east", LocationAttributes::getBboxEast, LocationAttributes::setBboxEast)
    );

    private static final List<Attribute<LocationAttributes, ?>> COORDINATE_GROUP = List.of(
            LOCATION_ATTRIBUTES.get(0),
            LOCATION_ATTRIBUTES.get(1),
            LOCATION_ATTRIBUTES.get(6),
            LOCATION_ATTRIBUTES.get(7),
            LOCATION_ATTRIBUTES.get(8),
            LOCATION_ATTRIBUTES.get(9)
    );

    // no time type here: only a precision upgrade changes it
    private static final List<Attribute<TimeAttributes, ?>> TIME_COMPLETENESS_ATTRIBUTES = List.of(
            new Attribute<TimeAttributes, TimePrecision>("precision", TimeAttributes::getPrecision, TimeAttributes::setPrecision),
            new Attribute<TimeAttributes, String>("start_date", TimeAttributes::getStartDate, TimeAttributes::setStartDate),
            new Attribute<TimeAttributes, String>("end_date", TimeAttributes::getEndDate, TimeAttributes::setEndDate),
            new Attribute<TimeAttributes, Double>("date_reliability", TimeAttributes::getDateReliability, TimeAttributes::setDateReliability)
    );

    private static final List<Attribute<TimeAttributes, ?>> TIME_GROUP = List.of(
            TIME_COMPLETENESS_ATTRIBUTES.get(0),
            new Attribute<TimeAttributes, TimeType>("type", TimeAttributes::getType, TimeAttributes::setType),
            TIME_COMPLETENESS_ATTRIBUTES.get(1),
            TIME_COMPLETENESS_ATTRIBUTES.get(2),
            TIME_COMPLETENESS_ATTRIBUTES.get(3)
    );

    /**
     * Merges a candidate's top-level fields into the global entity.
     * Text, confidence and normalized form are replaced only when the candidate's
     * confidence is strictly higher.
     *
     * @return true if the global entity was updated
     */
    public boolean mergeCoreFields(GlobalEntity global, CandidateEntity candidate) {
        if (candidate.getConfidence() <= global.getConfidence()) {
            return false;
        }
        global.setText(candidate.getText());
        global.setConfidence(candidate.getConfidence());
        if (candidate.getNormalized() != null) {
            global.setNormalized(candidate.getNormalized());
        }
        return true;
    }

    /**
     * Merges incoming location attributes into the global entity.
     */
    public void mergeLocation(GlobalEntity global, LocationAttributes incoming) {
        if (incoming == null) {
            return;
        }
        LocationAttributes current = global.getLocation();
        if (current == null) {
            current = LocationAttributes.builder().build();
            global.setLocation(current);
        }

        List<String> changed = new ArrayList<>();
        for (Attribute<LocationAttributes, ?> attribute : LOCATION_ATTRIBUTES) {
            if (attribute.fillIfMissing(current, incoming)) {
                changed.add(attribute.name());
            }
        }

        if (incoming.getDisplayName() != null && current.getDisplayName() != null
                && incoming.getDisplayName().length() > current.getDisplayName().length()) {
            current.setDisplayName(incoming.getDisplayName());
            changed.add("display_name");
        }

        if (incoming.hasCoordinates() && current.hasCoordinates()
                && (decimalPlaces(incoming.getLatitude()) > decimalPlaces(current.getLatitude())
                || decimalPlaces(incoming.getLongitude()) > decimalPlaces(current.getLongitude()))) {
            for (Attribute<LocationAttributes, ?> attribute : COORDINATE_GROUP) {
                attribute.replaceIfPresent(current, incoming);
            }
            changed.add("coordinates");
        }

        if (!changed.isEmpty()) {
            log.debug("merge.location.updated entityId={} attributes={}", global.getId(), changed);
        }
    }

    /**
     * Merges incoming time attributes into the global entity.
     */
    public void mergeTime(GlobalEntity global, TimeAttributes incoming) {
        if (incoming == null) {
            return;
        }
        TimeAttributes current = global.getTime();
        if (current == null) {
            current = TimeAttributes.builder().build();
            global.setTime(current);
        }

        List<String> changed = new ArrayList<>();
        for (Attribute<TimeAttributes, ?> attribute : TIME_COMPLETENESS_ATTRIBUTES) {
            if (attribute.fillIfMissing(current, incoming)) {
                changed.add(attribute.name());
            }
        }

        if (incoming.getPrecision() != null && current.getPrecision() != null
                && incoming.getPrecision().isFinerThan(current.getPrecision())) {
            for (Attribute<TimeAttributes, ?> attribute : TIME_GROUP) {
                attribute.replaceIfPresent(current, incoming);
            }
            changed.add("precision:" + current.getPrecision());
        }

        if (!changed.isEmpty()) {
            log.debug("merge.time.updated entityId={} attributes={}", global.getId(), changed);
        }
    }

    /**
     * Number of digits after the decimal point in the shortest decimal form of the value.
     */
    static int decimalPlaces(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0;
        }
        return Math.max(0, BigDecimal.valueOf(value).stripTrailingZeros().scale());
    }

    /**
     * Absent, empty or zero values count as missing for the completeness rule.
     */
    static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String s) {
            return s.isEmpty();
        }
        if (value instanceof Number n) {
            return n.doubleValue() == 0.0;
        }
        return false;
    }

    private record Attribute<T, V>(String name, Function<T, V> getter, BiConsumer<T, V> setter) {

        boolean fillIfMissing(T target, T source) {
            V incoming = getter.apply(source);
            if (incoming != null && isMissing(getter.apply(target))) {
                setter.accept(target, incoming);
                return true;
            }
            return false;
        }

        void replaceIfPresent(T target, T source) {
            V incoming = getter.apply(source);
            if (incoming != null) {
                setter.accept(target, incoming);
            }
        }
    }
}
