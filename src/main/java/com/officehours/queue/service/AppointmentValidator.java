package com.officehours.queue.service;

import com.officehours.queue.dto.AppointmentRequest;
import com.officehours.queue.dto.ScheduleRequest;
import com.officehours.queue.entity.AppointmentSchedule;
import com.officehours.queue.entity.AppointmentSlot;
import com.officehours.queue.exception.BookingException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;

/**
 * Structural, ownership and timing checks shared by the booking operations.
 */
@Component
public class AppointmentValidator {

    private static final Logger log = LoggerFactory.getLogger(AppointmentValidator.class);

    public void requireComplete(AppointmentRequest request) {
        if (request == null
                || StringUtils.isBlank(request.getName())
                || StringUtils.isBlank(request.getDescription())
                || StringUtils.isBlank(request.getLocation())) {
            log.warn("Got incomplete appointment: {}", request);
            throw BookingException.badRequest("It looks like you left out some fields in the appointment.");
        }
    }

    public void requireWellFormed(ScheduleRequest request) {
        if (request == null || !AppointmentSchedule.isWellFormed(request.getSchedule(), request.getDuration())) {
            log.warn("Got malformed schedule: {}", request);
            throw BookingException.badRequest(
                    "A schedule needs a positive duration and one capacity digit (0-9) per timeslot.");
        }
    }

    public void requireOwner(AppointmentSlot appointment, String email, String action) {
        if (!Objects.equals(appointment.getStudentEmail(), email)) {
            log.warn("{} attempted to {} appointment {} owned by {}",
                    email, action, appointment.getId(), appointment.getStudentEmail());
            throw BookingException.forbidden("You can't " + action + " someone else's appointment!")
                    .with("appointment_id", appointment.getId());
        }
    }

    public void requireTimeslot(AppointmentSchedule schedule, int timeslot) {
        if (!schedule.hasTimeslot(timeslot)) {
            log.warn("Timeslot {} does not exist; queue={} day={} has {} timeslots",
                    timeslot, schedule.getQueueId(), schedule.getDay(), schedule.timeslotCount());
            throw BookingException.notFound("That timeslot doesn't exist!")
                    .with("timeslot", timeslot)
                    .with("num_slots", schedule.timeslotCount());
        }
    }

    public void requireNotPast(Instant scheduledTime, Instant now, String message) {
        if (now.isAfter(scheduledTime)) {
            log.warn("Rejected past time {} at {}", scheduledTime, now);
            throw BookingException.badRequest(message).with("scheduled_time", scheduledTime);
        }
    }
}
