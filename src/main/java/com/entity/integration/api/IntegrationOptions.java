package com.entity.integration.api;

import java.util.Properties;

/**
 * Options for an integration run.
 * Configures the matching thresholds and how input files are read.
 */
public class IntegrationOptions {

    public static final String SIMILARITY_THRESHOLD_KEY = "integration.similarity-threshold";
    public static final String GEO_MATCH_DISTANCE_KEY = "integration.geo-match-distance-km";
    public static final String PARSE_PARALLELISM_KEY = "integration.parse-parallelism";

    private static final double DEFAULT_SIMILARITY_THRESHOLD = 0.8;
    private static final double DEFAULT_GEO_MATCH_DISTANCE_KM = 1.0;
    private static final int DEFAULT_PARSE_PARALLELISM = 1;

    private final double similarityThreshold;
    private final double geoMatchDistanceKm;
    private final int parseParallelism;

    private IntegrationOptions(Builder builder) {
        this.similarityThreshold = builder.similarityThreshold;
        this.geoMatchDistanceKm = builder.geoMatchDistanceKm;
        this.parseParallelism = builder.parseParallelism;
    }

    /**
     * Minimum text similarity for two entities to be considered the same.
     */
    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    /**
     * Two locations closer than this distance are considered the same place.
     */
    public double getGeoMatchDistanceKm() {
        return geoMatchDistanceKm;
    }

    /**
     * Number of threads used to read and parse input files. Integration itself is always sequential.
     */
    public int getParseParallelism() {
        return parseParallelism;
    }

    /**
     * Creates default options.
     */
    public static IntegrationOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options from properties, falling back to defaults for absent keys.
     *
     * @throws IllegalArgumentException if a present value is not a valid number or out of range
     */
    public static IntegrationOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String threshold = properties.getProperty(SIMILARITY_THRESHOLD_KEY);
        if (threshold != null) {
            builder.similarityThreshold(parseDouble(SIMILARITY_THRESHOLD_KEY, threshold));
        }
        String distance = properties.getProperty(GEO_MATCH_DISTANCE_KEY);
        if (distance != null) {
            builder.geoMatchDistanceKm(parseDouble(GEO_MATCH_DISTANCE_KEY, distance));
        }
        String parallelism = properties.getProperty(PARSE_PARALLELISM_KEY);
        if (parallelism != null) {
            try {
                builder.parseParallelism(Integer.parseInt(parallelism.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(PARSE_PARALLELISM_KEY + " must be an integer, got '" + parallelism + "'", e);
            }
        }
        return builder.build();
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        return "IntegrationOptions{" +
                "similarityThreshold=" + similarityThreshold +
                ", geoMatchDistanceKm=" + geoMatchDistanceKm +
                ", parseParallelism=" + parseParallelism +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;
        private double geoMatchDistanceKm = DEFAULT_GEO_MATCH_DISTANCE_KM;
        private int parseParallelism = DEFAULT_PARSE_PARALLELISM;

        public Builder similarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
            return this;
        }

        public Builder geoMatchDistanceKm(double geoMatchDistanceKm) {
            this.geoMatchDistanceKm = geoMatchDistanceKm;
            return this;
        }

        public Builder parseParallelism(int parseParallelism) {
            this.parseParallelism = parseParallelism;
            return this;
        }

        public IntegrationOptions build() {
            if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
                throw new IllegalArgumentException("similarityThreshold must be between 0.0 and 1.0");
            }
            if (geoMatchDistanceKm <= 0.0) {
                throw new IllegalArgumentException("geoMatchDistanceKm must be > 0");
            }
            if (parseParallelism < 1) {
                throw new IllegalArgumentException("parseParallelism must be >= 1");
            }
            return new IntegrationOptions(this);
        }
    }
}
