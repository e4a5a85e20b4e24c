package com.officehours.queue.service;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open instant range {@code [start, end)}.
 */
public record TimeWindow(Instant start, Instant end) {

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    /**
     * Start of timeslot {@code timeslot} when every timeslot lasts {@code durationMinutes}.
     */
    public Instant timeslotStart(int timeslot, int durationMinutes) {
        return start.plus(Duration.ofMinutes((long) timeslot * durationMinutes));
    }
}
