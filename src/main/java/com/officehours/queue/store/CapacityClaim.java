package com.officehours.queue.store;

import java.time.Instant;

/**
 * Identifies the counted resource of a conditional write: the claimed appointments at
 * {@code timeslot} of one weekday window of a queue.
 */
public record CapacityClaim(Long queueId, int day, Instant windowStart, Instant windowEnd, int timeslot, int capacity) {
}
