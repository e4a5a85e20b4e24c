package com.officehours.queue.controller;

import com.officehours.queue.entity.AppointmentSlot;
import com.officehours.queue.entity.Queue;
import com.officehours.queue.exception.BookingException;
import com.officehours.queue.repository.QueueRepository;
import com.officehours.queue.store.AppointmentFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns path identifiers into the queue and appointment the operations act on.
 */
@Component
public class RequestResolver {

    private static final Logger log = LoggerFactory.getLogger(RequestResolver.class);

    private final QueueRepository queueRepository;
    private final AppointmentFinder appointmentFinder;

    public RequestResolver(QueueRepository queueRepository, AppointmentFinder appointmentFinder) {
        this.queueRepository = queueRepository;
        this.appointmentFinder = appointmentFinder;
    }

    public Queue queue(Long queueId) {
        return queueRepository.findById(queueId).orElseThrow(() -> {
            log.warn("Queue {} not found", queueId);
            return BookingException.notFound("That queue doesn't exist.").with("queue_id", queueId);
        });
    }

    public AppointmentSlot appointment(Long appointmentId) {
        return appointmentFinder.findAppointment(appointmentId).orElseThrow(() -> {
            log.warn("Failed to get non-existent appointment {}", appointmentId);
            return BookingException.notFound(
                    "I called for help, but I couldn't find that appointment anywhere. Was it just deleted?")
                    .with("appointment_id", appointmentId);
        });
    }
}
