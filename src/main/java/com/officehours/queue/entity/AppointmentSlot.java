package com.officehours.queue.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One booked or vacated claim at a timeslot of a queue's weekday.
 * A null {@code studentEmail} means the slot is open. Only templated rows, opened by an
 * admin with pre-defined contents, are handed out by the claim path.
 */
@Entity
@Table(name = "appointment_slot", indexes = {
    @Index(name = "idx_appointment_slot_queue_time", columnList = "queue_id, scheduled_time, timeslot")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class AppointmentSlot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "queue_id", nullable = false)
    private Long queueId;

    @Column(nullable = false)
    private int timeslot;

    @Column(name = "scheduled_time", nullable = false)
    private Instant scheduledTime;

    /** Minutes. */
    @Column(nullable = false)
    private int duration;

    @Column(name = "student_email", length = 320)
    private String studentEmail;

    @Column(length = 200)
    private String name;

    @Column(length = 2000)
    private String description;

    @Column(length = 500)
    private String location;

    @Column(name = "map_x")
    private Float mapX;

    @Column(name = "map_y")
    private Float mapY;

    /** Contents were set by an admin template and not edited since. */
    @Column(nullable = false)
    private boolean templated;

    @JsonIgnore
    @Version
    private Long version;

    @JsonIgnore
    public boolean isClaimed() {
        return studentEmail != null;
    }
}
