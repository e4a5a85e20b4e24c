package com.officehours.queue.store;

import com.officehours.queue.entity.AppointmentSlot;

import java.util.Optional;

public interface AppointmentFinder {

    Optional<AppointmentSlot> findAppointment(Long appointmentId);
}
