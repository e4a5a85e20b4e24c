package com.officehours.queue.dto;

import com.officehours.queue.entity.AppointmentSlot;

/**
 * Result of updating an appointment: either edited in place or moved to a new record.
 */
public record UpdateOutcome(boolean moved, AppointmentSlot appointment) {

    public static UpdateOutcome updatedInPlace(AppointmentSlot appointment) {
        return new UpdateOutcome(false, appointment);
    }

    public static UpdateOutcome moved(AppointmentSlot created) {
        return new UpdateOutcome(true, created);
    }
}
