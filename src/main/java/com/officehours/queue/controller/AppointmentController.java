package com.officehours.queue.controller;

import com.officehours.queue.dto.AppointmentRequest;
import com.officehours.queue.dto.RemovalOutcome;
import com.officehours.queue.dto.UpdateOutcome;
import com.officehours.queue.entity.AppointmentSlot;
import com.officehours.queue.entity.Queue;
import com.officehours.queue.service.BookingCoordinator;
import com.officehours.queue.service.SlotService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class AppointmentController {

    /** Set by the authentication layer in front of this service. */
    public static final String IDENTITY_HEADER = "X-User-Email";

    private final BookingCoordinator coordinator;
    private final SlotService slotService;
    private final RequestResolver resolver;

    public AppointmentController(BookingCoordinator coordinator, SlotService slotService, RequestResolver resolver) {
        this.coordinator = coordinator;
        this.slotService = slotService;
        this.resolver = resolver;
    }

    @GetMapping("/queues/{queueId}/appointments/{day}")
    public ResponseEntity<List<AppointmentSlot>> getAppointments(@PathVariable Long queueId,
                                                                 @PathVariable int day,
                                                                 @RequestHeader(IDENTITY_HEADER) String email) {
        Queue queue = resolver.queue(queueId);
        return ResponseEntity.ok(coordinator.appointmentsForDay(queue, day, email, queue.isAdmin(email)));
    }

    @GetMapping("/queues/{queueId}/appointments/{day}/@me")
    public ResponseEntity<List<AppointmentSlot>> getAppointmentsForCurrentUser(@PathVariable Long queueId,
                                                                               @PathVariable int day,
                                                                               @RequestHeader(IDENTITY_HEADER) String email) {
        return ResponseEntity.ok(coordinator.appointmentsForUser(resolver.queue(queueId), day, email));
    }

    @PostMapping("/queues/{queueId}/appointments/{day}/slots")
    public ResponseEntity<List<AppointmentSlot>> openTemplatedSlots(@PathVariable Long queueId,
                                                                    @PathVariable int day,
                                                                    @RequestBody AppointmentRequest template,
                                                                    @RequestHeader(IDENTITY_HEADER) String email) {
        Queue queue = resolver.queue(queueId);
        List<AppointmentSlot> created = slotService.openTemplatedSlots(queue, day, template, queue.isAdmin(email));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PostMapping("/queues/{queueId}/appointments/{day}/{timeslot}")
    public ResponseEntity<AppointmentSlot> signupForAppointment(@PathVariable Long queueId,
                                                                @PathVariable int day,
                                                                @PathVariable int timeslot,
                                                                @RequestBody AppointmentRequest request,
                                                                @RequestHeader(IDENTITY_HEADER) String email) {
        AppointmentSlot created = coordinator.signupForAppointment(resolver.queue(queueId), day, timeslot, request, email);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PostMapping("/queues/{queueId}/appointments/{day}/{timeslot}/claim")
    public ResponseEntity<AppointmentSlot> claimTimeslot(@PathVariable Long queueId,
                                                         @PathVariable int day,
                                                         @PathVariable int timeslot,
                                                         @RequestHeader(IDENTITY_HEADER) String email) {
        AppointmentSlot claimed = coordinator.claimTimeslot(resolver.queue(queueId), day, timeslot, email);
        return ResponseEntity.status(HttpStatus.CREATED).body(claimed);
    }

    @PutMapping("/appointments/{appointmentId}")
    public ResponseEntity<AppointmentSlot> updateAppointment(@PathVariable Long appointmentId,
                                                             @RequestBody AppointmentRequest request,
                                                             @RequestHeader(IDENTITY_HEADER) String email) {
        AppointmentSlot appointment = resolver.appointment(appointmentId);
        Queue queue = resolver.queue(appointment.getQueueId());
        UpdateOutcome outcome = coordinator.updateAppointment(queue, appointment, request, email);
        if (outcome.moved()) {
            return ResponseEntity.status(HttpStatus.CREATED).body(outcome.appointment());
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/appointments/{appointmentId}")
    public ResponseEntity<Void> removeAppointmentSignup(@PathVariable Long appointmentId,
                                                        @RequestHeader(IDENTITY_HEADER) String email) {
        RemovalOutcome outcome = coordinator.removeAppointmentSignup(resolver.appointment(appointmentId), email);
        // A repeated delete still had the intended effect
        if (outcome == RemovalOutcome.ALREADY_REMOVED) {
            return ResponseEntity.ok().build();
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/appointments/{appointmentId}/claim")
    public ResponseEntity<Void> unclaimAppointment(@PathVariable Long appointmentId,
                                                   @RequestHeader(IDENTITY_HEADER) String email) {
        AppointmentSlot appointment = resolver.appointment(appointmentId);
        Queue queue = resolver.queue(appointment.getQueueId());
        coordinator.unclaimAppointment(queue, appointment, email, queue.isAdmin(email));
        return ResponseEntity.noContent().build();
    }
}
