package com.officehours.queue.store;

import com.officehours.queue.entity.AppointmentSlot;

import java.time.Instant;
import java.util.List;

/**
 * Read access to appointments of a queue. Every window is half-open, {@code [from, to)}.
 */
public interface AppointmentQueries {

    List<AppointmentSlot> findAppointments(Long queueId, Instant from, Instant to);

    List<AppointmentSlot> findAppointmentsForStudent(Long queueId, Instant from, Instant to, String email);

    List<AppointmentSlot> findAppointmentsByTimeslot(Long queueId, Instant from, Instant to, int timeslot);

    /**
     * Appointments of {@code email} scheduled at or after {@code from}, with no upper bound.
     */
    List<AppointmentSlot> findUpcomingForStudent(Long queueId, Instant from, String email);
}
