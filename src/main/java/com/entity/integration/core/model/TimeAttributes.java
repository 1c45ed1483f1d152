package com.entity.integration.core.model;

/**
 * Temporal attributes attached to a TIME entity.
 * Dates are kept as the ISO-8601 strings produced upstream; they are compared, never parsed.
 */
public class TimeAttributes {
    private TimePrecision precision;
    private TimeType type;
    private String startDate;
    private String endDate;
    private Double dateReliability;

    private TimeAttributes(Builder builder) {
        this.precision = builder.precision;
        this.type = builder.type;
        this.startDate = builder.startDate;
        this.endDate = builder.endDate;
        this.dateReliability = builder.dateReliability;
    }

    public TimePrecision getPrecision() {
        return precision;
    }

    public void setPrecision(TimePrecision precision) {
        this.precision = precision;
    }

    public TimeType getType() {
        return type;
    }

    public void setType(TimeType type) {
        this.type = type;
    }

    public String getStartDate() {
        return startDate;
    }

    public void setStartDate(String startDate) {
        this.startDate = startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    public void setEndDate(String endDate) {
        this.endDate = endDate;
    }

    public Double getDateReliability() {
        return dateReliability;
    }

    public void setDateReliability(Double dateReliability) {
        this.dateReliability = dateReliability;
    }

    public boolean hasStartDate() {
        return startDate != null && !startDate.isEmpty();
    }

    public TimeAttributes copy() {
        return builder(this).build();
    }

    @Override
    public String toString() {
        return "TimeAttributes{" +
                "precision=" + precision +
                ", type=" + type +
                ", startDate='" + startDate + '\'' +
                ", endDate='" + endDate + '\'' +
                ", dateReliability=" + dateReliability +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(TimeAttributes attributes) {
        return new Builder()
                .precision(attributes.precision)
                .type(attributes.type)
                .startDate(attributes.startDate)
                .endDate(attributes.endDate)
                .dateReliability(attributes.dateReliability);
    }

    public static class Builder {
        private TimePrecision precision;
        private TimeType type;
        private String startDate;
        private String endDate;
        private Double dateReliability;

        public Builder precision(TimePrecision precision) {
            this.precision = precision;
            return this;
        }

        public Builder type(TimeType type) {
            this.type = type;
            return this;
        }

        public Builder startDate(String startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(String endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder dateReliability(Double dateReliability) {
            this.dateReliability = dateReliability;
            return this;
        }

        public TimeAttributes build() {
            return new TimeAttributes(this);
        }
    }
}
