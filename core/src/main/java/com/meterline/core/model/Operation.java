package com.meterline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Aggregation applied by a metric worker to every recorded value.
 */
public enum Operation {
    SUM,
    MIN,
    MAX,
    AVERAGE,
    COUNT,
    LAST;

    /**
     * Parses an operation name; anything unknown (or missing) aggregates as {@link #SUM}.
     */
    @JsonCreator
    public static Operation parse(String name) {
        if (name == null) {
            return SUM;
        }
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "MIN":
                return MIN;
            case "MAX":
                return MAX;
            case "AVG":
            case "AVERAGE":
                return AVERAGE;
            case "COUNT":
                return COUNT;
            case "LAST":
                return LAST;
            default:
                return SUM;
        }
    }

    /**
     * Folds {@code sample} into {@code current}.
     *
     * @param current     current aggregate
     * @param sample      newly recorded value
     * @param sampleCount number of samples in the window including this one
     * @return new aggregate
     */
    public double apply(double current, double sample, long sampleCount) {
        switch (this) {
            case MIN:
                return sampleCount <= 1 ? sample : Math.min(current, sample);
            case MAX:
                return sampleCount <= 1 ? sample : Math.max(current, sample);
            case AVERAGE:
                return current + (sample - current) / Math.max(1, sampleCount);
            case COUNT:
                return current + 1.0;
            case LAST:
                return sample;
            case SUM:
            default:
                return current + sample;
        }
    }
}
