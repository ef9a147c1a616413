package com.meterline.core.model;

/**
 * Published by the tick scheduler on {@code tick:<interval>} and {@code tick:all}.
 *
 * @param interval  interval that fired
 * @param timestamp wall-clock time of the wake, epoch millis
 */
public record TickEvent(FlushInterval interval, long timestamp) {
}
