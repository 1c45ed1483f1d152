package com.entity.integration.core.model;

/**
 * Geocoding attributes attached to a LOCATION entity.
 * Every field is optional; a location whose lookup failed carries none of them.
 */
public class LocationAttributes {
    private Double latitude;
    private Double longitude;
    private String displayName;
    private String locationType;
    private Double importance;
    private String osmId;
    private Double bboxSouth;
    private Double bboxNorth;
    private Double bboxWest;
    private Double bboxEast;

    private LocationAttributes(Builder builder) {
        this.latitude = builder.latitude;
        this.longitude = builder.longitude;
        this.displayName = builder.displayName;
        this.locationType = builder.locationType;
        this.importance = builder.importance;
        this.osmId = builder.osmId;
        this.bboxSouth = builder.bboxSouth;
        this.bboxNorth = builder.bboxNorth;
        this.bboxWest = builder.bboxWest;
        this.bboxEast = builder.bboxEast;
    }

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getLocationType() {
        return locationType;
    }

    public void setLocationType(String locationType) {
        this.locationType = locationType;
    }

    public Double getImportance() {
        return importance;
    }

    public void setImportance(Double importance) {
        this.importance = importance;
    }

    public String getOsmId() {
        return osmId;
    }

    public void setOsmId(String osmId) {
        this.osmId = osmId;
    }

    public Double getBboxSouth() {
        return bboxSouth;
    }

    public void setBboxSouth(Double bboxSouth) {
        this.bboxSouth = bboxSouth;
    }

    public Double getBboxNorth() {
        return bboxNorth;
    }

    public void setBboxNorth(Double bboxNorth) {
        this.bboxNorth = bboxNorth;
    }

    public Double getBboxWest() {
        return bboxWest;
    }

    public void setBboxWest(Double bboxWest) {
        this.bboxWest = bboxWest;
    }

    public Double getBboxEast() {
        return bboxEast;
    }

    public void setBboxEast(Double bboxEast) {
        this.bboxEast = bboxEast;
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    /**
     * Returns a detached copy so that a global entity never shares state with the
     * document record it was created from.
     */
    public LocationAttributes copy() {
        return builder(this).build();
    }

    @Override
    public String toString() {
        return "LocationAttributes{" +
                "latitude=" + latitude +
                ", longitude=" + longitude +
                ", displayName='" + displayName + '\'' +
                ", locationType='" + locationType + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(LocationAttributes attributes) {
        return new Builder()
                .latitude(attributes.latitude)
                .longitude(attributes.longitude)
                .displayName(attributes.displayName)
                .locationType(attributes.locationType)
                .importance(attributes.importance)
                .osmId(attributes.osmId)
                .bboxSouth(attributes.bboxSouth)
                .bboxNorth(attributes.bboxNorth)
                .bboxWest(attributes.bboxWest)
                .bboxEast(attributes.bboxEast);
    }

    public static class Builder {
        private Double latitude;
        private Double longitude;
        private String displayName;
        private String locationType;
        private Double importance;
        private String osmId;
        private Double bboxSouth;
        private Double bboxNorth;
        private Double bboxWest;
        private Double bboxEast;

        public Builder latitude(Double latitude) {
            this.latitude = latitude;
            return this;
        }

        public Builder longitude(Double longitude) {
            this.longitude = longitude;
            return this;
        }

        public Builder coordinates(double latitude, double longitude) {
            this.latitude = latitude;
            this.longitude = longitude;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder locationType(String locationType) {
            this.locationType = locationType;
            return this;
        }

        public Builder importance(Double importance) {
            this.importance = importance;
            return this;
        }

        public Builder osmId(String osmId) {
            this.osmId = osmId;
            return this;
        }

        public Builder bboxSouth(Double bboxSouth) {
            this.bboxSouth = bboxSouth;
            return this;
        }

        public Builder bboxNorth(Double bboxNorth) {
            this.bboxNorth = bboxNorth;
            return this;
        }

        public Builder bboxWest(Double bboxWest) {
            this.bboxWest = bboxWest;
            return this;
        }

        public Builder bboxEast(Double bboxEast) {
            this.bboxEast = bboxEast;
            return this;
        }

        public Builder boundingBox(double south, double north, double west, double east) {
            this.bboxSouth = south;
            this.bboxNorth = north;
            this.bboxWest = west;
            this.bboxEast = east;
            return this;
        }

        public LocationAttributes build() {
            return new LocationAttributes(this);
        }
    }
}
