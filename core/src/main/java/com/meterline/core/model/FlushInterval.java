package com.meterline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Named tick/flush intervals.
 * <p>
 * A month is a fixed 30 days so that every interval has a constant length and
 * boundaries can be aligned with {@code now + (size - now % size)}.
 * </p>
 */
public enum FlushInterval {
    ONE_SECOND("1s", Duration.ofSeconds(1)),
    FIVE_SECONDS("5s", Duration.ofSeconds(5)),
    FIFTEEN_SECONDS("15s", Duration.ofSeconds(15)),
    THIRTY_SECONDS("30s", Duration.ofSeconds(30)),
    ONE_MINUTE("1m", Duration.ofMinutes(1)),
    FIVE_MINUTES("5m", Duration.ofMinutes(5)),
    FIFTEEN_MINUTES("15m", Duration.ofMinutes(15)),
    THIRTY_MINUTES("30m", Duration.ofMinutes(30)),
    ONE_HOUR("1h", Duration.ofHours(1)),
    SIX_HOURS("6h", Duration.ofHours(6)),
    ONE_DAY("1d", Duration.ofDays(1)),
    ONE_WEEK("1w", Duration.ofDays(7)),
    ONE_MONTH("1mo", Duration.ofDays(30));

    private final String label;
    private final Duration duration;

    FlushInterval(String label, Duration duration) {
        this.label = label;
        this.duration = duration;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public Duration duration() {
        return duration;
    }

    public long millis() {
        return duration.toMillis();
    }

    /**
     * Next boundary strictly after {@code nowMillis}, aligned to the interval size.
     */
    public long nextBoundary(long nowMillis) {
        long size = millis();
        return nowMillis + (size - Math.floorMod(nowMillis, size));
    }

    public static Optional<FlushInterval> find(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("tick_")) {
            normalized = normalized.substring("tick_".length());
        }
        String candidate = normalized;
        return Arrays.stream(values())
            .filter(interval -> interval.label.equals(candidate) || interval.name().equalsIgnoreCase(candidate))
            .findFirst();
    }

    @JsonCreator
    public static FlushInterval fromLabel(String label) {
        return find(label).orElseThrow(() -> new IllegalArgumentException("Unknown flush interval: " + label));
    }

    @Override
    public String toString() {
        return label;
    }
}
