package com.entity.integration.similarity;

import com.entity.integration.core.model.EntityRecord;
import com.entity.integration.core.model.EntityType;
import com.entity.integration.core.model.GlobalEntity;
import com.entity.integration.core.model.LocationAttributes;
import com.entity.integration.core.model.TimeAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether two entity records denote the same real-world referent.
 *
 * <p>Rules by type:</p>
 * <ul>
 *   <li>different types never match</li>
 *   <li>LOCATION: when both sides have coordinates, match iff the haversine distance is
 *       below the configured limit (1 km by default)</li>
 *   <li>TIME: when both sides have a start date, match iff the dates are equal; otherwise,
 *       when both have a normalized form, match iff those are equal</li>
 *   <li>everything else, and the cases above that lack the data: lowercased text
 *       similarity at or above the threshold (0.8 by default)</li>
 * </ul>
 *
 * <p>Every rule is symmetric in its two arguments.</p>
 */
public class EntityMatcher {
    private static final Logger log = LoggerFactory.getLogger(EntityMatcher.class);

    public static final double DEFAULT_THRESHOLD = 0.8;
    public static final double DEFAULT_MAX_DISTANCE_KM = 1.0;

    private final SimilarityAlgorithm textSimilarity;
    private final double threshold;
    private final double maxDistanceKm;

    public EntityMatcher() {
        this(new SequenceMatcherSimilarity(), DEFAULT_THRESHOLD, DEFAULT_MAX_DISTANCE_KM);
    }

    public EntityMatcher(double threshold, double maxDistanceKm) {
        this(new SequenceMatcherSimilarity(), threshold, maxDistanceKm);
    }

    public EntityMatcher(SimilarityAlgorithm textSimilarity, double threshold, double maxDistanceKm) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0, got " + threshold);
        }
        if (maxDistanceKm <= 0.0) {
            throw new IllegalArgumentException("maxDistanceKm must be > 0, got " + maxDistanceKm);
        }
        this.textSimilarity = textSimilarity;
        this.threshold = threshold;
        this.maxDistanceKm = maxDistanceKm;
    }

    /**
     * Returns true if the two records are judged to be the same entity at the configured threshold.
     */
    public boolean similar(EntityRecord a, EntityRecord b) {
        return similar(a, b, threshold);
    }

    /**
     * Returns true if the two records are judged to be the same entity.
     *
     * @param threshold minimum text similarity used by the text fallback
     */
    public boolean similar(EntityRecord a, EntityRecord b, double threshold) {
        if (a.getType() != b.getType()) {
            return false;
        }

        if (a.getType() == EntityType.LOCATION) {
            LocationAttributes la = a.getLocation();
            LocationAttributes lb = b.getLocation();
            if (la != null && lb != null && la.hasCoordinates() && lb.hasCoordinates()) {
                double distance = GeoDistance.haversineKm(
                        la.getLatitude(), la.getLongitude(), lb.getLatitude(), lb.getLongitude());
                log.trace("match.location distance={}km limit={}km", distance, maxDistanceKm);
                return distance < maxDistanceKm;
            }
        } else if (a.getType() == EntityType.TIME) {
            TimeAttributes ta = a.getTime();
            TimeAttributes tb = b.getTime();
            if (ta != null && tb != null && ta.getStartDate() != null && tb.getStartDate() != null) {
                return ta.getStartDate().equals(tb.getStartDate());
            }
            if (a.getNormalized() != null && b.getNormalized() != null) {
                return a.getNormalized().equals(b.getNormalized());
            }
        }

        return textScore(a, b) >= threshold;
    }

    /**
     * Lowercased text similarity of the two records' best available text.
     */
    public double textScore(EntityRecord a, EntityRecord b) {
        String left = lower(a.getComparableText());
        String right = lower(b.getComparableText());
        double score = textSimilarity.compute(left, right);
        log.trace("match.text left='{}' right='{}' algorithm={} score={}",
                left, right, textSimilarity.getName(), score);
        return score;
    }

    /**
     * Scans the candidates in iteration order and returns the first one similar to the record.
     * When several candidates qualify the earliest wins, which makes the outcome depend on
     * insertion order.
     */
    public Optional<GlobalEntity> findFirstMatch(Iterable<GlobalEntity> candidates, EntityRecord record) {
        for (GlobalEntity candidate : candidates) {
            if (similar(record, candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public double getThreshold() {
        return threshold;
    }

    public double getMaxDistanceKm() {
        return maxDistanceKm;
    }

    private static String lower(String value) {
        return value != null ? value.toLowerCase(Locale.ROOT) : "";
    }
}
