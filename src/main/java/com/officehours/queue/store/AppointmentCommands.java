package com.officehours.queue.store;

import com.officehours.queue.entity.AppointmentSlot;

import java.util.List;
import java.util.Optional;

/**
 * Writes to the appointment store. Each call commits on its own.
 */
public interface AppointmentCommands {

    /**
     * Inserts a claimed appointment only if fewer than the timeslot's capacity are
     * already claimed. The count and the insert are atomic with respect to every other
     * conditional write on the same queue and weekday.
     *
     * @throws CapacityExceededException when the timeslot is full
     */
    AppointmentSlot signupForAppointment(CapacityClaim claim, AppointmentSlot appointment);

    /**
     * Claims the oldest open templated row at the timeslot under the same guarantee as
     * {@link #signupForAppointment}. Vacated signups are never handed out. Empty when no
     * templated row is open.
     *
     * @throws CapacityExceededException when the timeslot is full
     */
    Optional<AppointmentSlot> claimTimeslot(CapacityClaim claim, String email);

    List<AppointmentSlot> createOpenSlots(List<AppointmentSlot> slots);

    /**
     * Copies the editable fields of {@code changes} onto the stored appointment, provided
     * it is still claimed by {@code owner}. The claim itself never changes here.
     *
     * @return false when the appointment is gone or no longer held by {@code owner}
     */
    boolean updateAppointment(Long appointmentId, String owner, AppointmentSlot changes);

    /**
     * Vacates the appointment, provided it is still claimed by {@code owner}.
     *
     * @return false when the appointment is gone or no longer held by {@code owner}
     */
    boolean removeAppointmentSignup(Long appointmentId, String owner);
}
