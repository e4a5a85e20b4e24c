package com.officehours.queue.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

/**
 * Capacity profile of one weekday of a queue.
 * <p>
 * {@code schedule} holds one decimal digit per timeslot, so a single timeslot can never
 * offer more than 9 concurrent appointments. Timeslot {@code i} starts
 * {@code i * duration} minutes after the weekday's local midnight.
 */
@Entity
@Table(name = "appointment_schedule", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"queue_id", "weekday"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppointmentSchedule {

    public static final int MAX_CAPACITY = 9;

    @JsonIgnore
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "queue_id", nullable = false)
    private Long queueId;

    /** 0 = Sunday ... 6 = Saturday. */
    @Column(name = "weekday", nullable = false)
    private int day;

    /** Minutes per timeslot. */
    @Column(nullable = false)
    private int duration;

    @Column(name = "capacities", nullable = false, length = 288)
    private String schedule;

    public int timeslotCount() {
        return schedule == null ? 0 : schedule.length();
    }

    public boolean hasTimeslot(int timeslot) {
        return timeslot >= 0 && timeslot < timeslotCount();
    }

    public int capacityAt(int timeslot) {
        if (!hasTimeslot(timeslot)) {
            throw new IndexOutOfBoundsException("timeslot " + timeslot + " of " + timeslotCount());
        }
        return Character.digit(schedule.charAt(timeslot), 10);
    }

    /**
     * True when every character is a decimal digit and the duration is positive.
     */
    public static boolean isWellFormed(String schedule, Integer duration) {
        if (schedule == null || duration == null || duration <= 0) return false;
        for (int i = 0; i < schedule.length(); i++) {
            char c = schedule.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }
}
