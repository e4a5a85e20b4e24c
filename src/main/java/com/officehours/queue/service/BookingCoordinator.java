package com.officehours.queue.service;

import com.officehours.queue.dto.AppointmentRequest;
import com.officehours.queue.dto.RemovalOutcome;
import com.officehours.queue.dto.ScheduleRequest;
import com.officehours.queue.dto.UpdateOutcome;
import com.officehours.queue.entity.AppointmentSchedule;
import com.officehours.queue.entity.AppointmentSlot;
import com.officehours.queue.entity.Queue;
import com.officehours.queue.exception.BookingException;
import com.officehours.queue.store.AppointmentCommands;
import com.officehours.queue.store.AppointmentQueries;
import com.officehours.queue.store.CapacityClaim;
import com.officehours.queue.store.CapacityExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Creates, moves and cancels appointment claims.
 * <p>
 * Capacity is enforced twice: a read-side check that produces a precise error, then the
 * store's conditional write, which re-counts under a per-(queue, weekday) lock. Only the
 * second one is authoritative when requests race.
 */
@Service
public class BookingCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BookingCoordinator.class);

    private static final Float ZERO = 0f;

    private final ScheduleService scheduleService;
    private final AppointmentQueries appointmentQueries;
    private final AppointmentCommands appointmentCommands;
    private final TimeWindowCalculator windows;
    private final AppointmentValidator validator;

    public BookingCoordinator(ScheduleService scheduleService,
                              AppointmentQueries appointmentQueries,
                              AppointmentCommands appointmentCommands,
                              TimeWindowCalculator windows,
                              AppointmentValidator validator) {
        this.scheduleService = scheduleService;
        this.appointmentQueries = appointmentQueries;
        this.appointmentCommands = appointmentCommands;
        this.windows = windows;
        this.validator = validator;
    }

    // =========================================================
    // READS
    // =========================================================

    /**
     * Admins see every appointment of the day, everyone else only their own.
     */
    public List<AppointmentSlot> appointmentsForDay(Queue queue, int day, String email, boolean callerIsAdmin) {
        if (!callerIsAdmin) {
            return appointmentsForUser(queue, day, email);
        }
        ScheduleService.requireWeekday(day);
        TimeWindow window = windows.weekdayBounds(day, queue.zone());
        return StoreCall.get(log, "get appointments of queue " + queue.getId(),
                () -> appointmentQueries.findAppointments(queue.getId(), window.start(), window.end()));
    }

    public List<AppointmentSlot> appointmentsForUser(Queue queue, int day, String email) {
        ScheduleService.requireWeekday(day);
        TimeWindow window = windows.weekdayBounds(day, queue.zone());
        return StoreCall.get(log, "get appointments of " + email + " in queue " + queue.getId(),
                () -> appointmentQueries.findAppointmentsForStudent(queue.getId(), window.start(), window.end(), email));
    }

    // =========================================================
    // CLAIM TEMPLATED TIMESLOT
    // =========================================================

    public AppointmentSlot claimTimeslot(Queue queue, int day, int timeslot, String email) {
        AppointmentSchedule schedule = scheduleService.scheduleForDay(queue, day);
        validator.requireTimeslot(schedule, timeslot);

        TimeWindow window = windows.weekdayBounds(day, queue.zone());
        Instant now = windows.now();
        validator.requireNotPast(window.timeslotStart(timeslot, schedule.getDuration()), now,
                "You can't claim a timeslot that already started!");
        requireNoActiveAppointment(queue, email, now, schedule.getDuration());

        CapacityClaim claim = capacityClaim(queue, day, window, timeslot, schedule);
        Optional<AppointmentSlot> claimed;
        try {
            claimed = StoreCall.get(log, "claim timeslot " + timeslot + " of queue " + queue.getId(),
                    () -> appointmentCommands.claimTimeslot(claim, email));
        } catch (CapacityExceededException e) {
            throw noRoom(queue, day, timeslot, e.getCapacity(), e.getClaimed());
        }

        AppointmentSlot appointment = claimed.orElseThrow(() -> {
            log.warn("No open templated slot to claim: queue={} day={} timeslot={} email={}",
                    queue.getId(), day, timeslot, email);
            return BookingException.conflict("Failed to claim timeslot. Perhaps it has already been claimed?")
                    .with("timeslot", timeslot);
        });
        log.info("Appointment claimed: id={} queue={} day={} timeslot={} email={}",
                appointment.getId(), queue.getId(), day, timeslot, email);
        return appointment;
    }

    // =========================================================
    // SIGN UP
    // =========================================================

    public AppointmentSlot signupForAppointment(Queue queue, int day, int timeslot,
                                                AppointmentRequest request, String email) {
        validator.requireComplete(request);

        AppointmentSchedule schedule = scheduleService.scheduleForDay(queue, day);
        validator.requireTimeslot(schedule, timeslot);

        TimeWindow window = windows.weekdayBounds(day, queue.zone());
        Instant scheduledTime = window.timeslotStart(timeslot, schedule.getDuration());
        Instant now = windows.now();
        validator.requireNotPast(scheduledTime, now, "You can't sign up for a time that already passed!");

        requireOpenCapacity(queue, day, window, timeslot, schedule.capacityAt(timeslot));
        requireNoActiveAppointment(queue, email, now, schedule.getDuration());

        AppointmentSlot appointment = AppointmentSlot.builder()
                .queueId(queue.getId())
                .timeslot(timeslot)
                .scheduledTime(scheduledTime)
                .duration(schedule.getDuration())
                .studentEmail(email)
                .name(request.getName())
                .description(request.getDescription())
                .location(request.getLocation())
                .mapX(orZero(request.getMapX()))
                .mapY(orZero(request.getMapY()))
                .build();

        AppointmentSlot created = insertWithinCapacity(capacityClaim(queue, day, window, timeslot, schedule), appointment);
        log.info("New appointment sign up: id={} queue={} day={} timeslot={} email={}",
                created.getId(), queue.getId(), day, timeslot, email);
        return created;
    }

    // =========================================================
    // UPDATE / MOVE
    // =========================================================

    /**
     * Edits an appointment in place, or moves it when the requested timeslot differs.
     * <p>
     * A move always targets today's weekday. The new appointment is created before the
     * old claim is removed, so a failure can leave the student with two bookings but
     * never with none.
     */
    public UpdateOutcome updateAppointment(Queue queue, AppointmentSlot appointment,
                                           AppointmentRequest request, String email) {
        if (!appointment.isClaimed()) {
            log.warn("Attempted to update deleted appointment {}", appointment.getId());
            throw appointmentGone(appointment);
        }
        validator.requireOwner(appointment, email, "update");
        validator.requireComplete(request);

        int timeslot = request.getTimeslot() == null ? appointment.getTimeslot() : request.getTimeslot();
        AppointmentSlot changes = appointment.toBuilder()
                .name(request.getName())
                .description(request.getDescription())
                .location(request.getLocation())
                .mapX(orZero(request.getMapX()))
                .mapY(orZero(request.getMapY()))
                .templated(false)
                .build();

        if (timeslot == appointment.getTimeslot()) {
            boolean updated = StoreCall.get(log, "update appointment " + appointment.getId(),
                    () -> appointmentCommands.updateAppointment(appointment.getId(), email, changes));
            if (!updated) {
                log.warn("Appointment {} was vacated before update by {}", appointment.getId(), email);
                throw appointmentGone(appointment);
            }
            log.info("Updated appointment {} email={}", appointment.getId(), email);
            return UpdateOutcome.updatedInPlace(changes);
        }

        return move(queue, appointment, changes, timeslot, email);
    }

    private UpdateOutcome move(Queue queue, AppointmentSlot appointment, AppointmentSlot changes,
                               int timeslot, String email) {
        int day = windows.currentWeekday(queue.zone());
        TimeWindow window = windows.weekdayBounds(day, queue.zone());
        AppointmentSchedule schedule = scheduleService.scheduleForDay(queue, day);
        validator.requireTimeslot(schedule, timeslot);

        Instant newTime = window.timeslotStart(timeslot, schedule.getDuration());
        validator.requireNotPast(newTime, windows.now(),
                "You can't change your appointment to the past! Let us know if you have a time machine.");
        requireOpenCapacity(queue, day, window, timeslot, schedule.capacityAt(timeslot));

        AppointmentSlot replacement = changes.toBuilder()
                .id(null)
                .version(null)
                .queueId(queue.getId())
                .timeslot(timeslot)
                .scheduledTime(newTime)
                .duration(schedule.getDuration())
                .build();

        // Create first so the student keeps a booking if anything below fails.
        AppointmentSlot created = insertWithinCapacity(capacityClaim(queue, day, window, timeslot, schedule), replacement);
        log.info("Created appointment {} for move of {} email={}", created.getId(), appointment.getId(), email);

        boolean removed;
        try {
            removed = appointmentCommands.removeAppointmentSignup(appointment.getId(), email);
        } catch (DataAccessException e) {
            log.error("Failed to remove appointment {} after creating {} for move; student holds both",
                    appointment.getId(), created.getId(), e);
            throw BookingException.internal(
                            "Your new appointment is booked, but we couldn't release the old one. Please try again.", e)
                    .with("appointment_id", appointment.getId())
                    .with("new_appointment_id", created.getId())
                    .with("retryable", true);
        }
        if (removed) {
            log.info("Removed appointment {} for move to {}", appointment.getId(), created.getId());
        } else {
            log.warn("Appointment {} was already vacated during move to {}", appointment.getId(), created.getId());
        }
        return UpdateOutcome.moved(created);
    }

    // =========================================================
    // CANCEL
    // =========================================================

    /**
     * Idempotent: cancelling an already vacated appointment succeeds without writing.
     */
    public RemovalOutcome removeAppointmentSignup(AppointmentSlot appointment, String email) {
        if (!appointment.isClaimed()) {
            log.warn("Attempted to remove signup for already deleted appointment {} email={}",
                    appointment.getId(), email);
            return RemovalOutcome.ALREADY_REMOVED;
        }
        validator.requireOwner(appointment, email, "delete");
        validator.requireNotPast(appointment.getScheduledTime(), windows.now(),
                "You can't delete an appointment that already happened! Let's try not to cause a paradox here.");

        boolean removed = StoreCall.get(log, "remove signup for appointment " + appointment.getId(),
                () -> appointmentCommands.removeAppointmentSignup(appointment.getId(), email));
        if (!removed) {
            log.warn("Appointment {} was vacated before removal by {}", appointment.getId(), email);
            return RemovalOutcome.ALREADY_REMOVED;
        }
        log.info("Removed signup for appointment {} email={}", appointment.getId(), email);
        return RemovalOutcome.REMOVED;
    }

    /**
     * Admin override: vacates a claim regardless of owner or time. Vacating an open
     * appointment is a no-op.
     */
    public RemovalOutcome unclaimAppointment(Queue queue, AppointmentSlot appointment, String email,
                                             boolean callerIsAdmin) {
        if (!callerIsAdmin) {
            log.warn("Non-admin {} attempted to unclaim appointment {} in queue {}",
                    email, appointment.getId(), queue.getId());
            throw BookingException.forbidden("Only queue admins can remove someone's claim.")
                    .with("appointment_id", appointment.getId());
        }
        if (!appointment.isClaimed()) {
            log.warn("Attempted to unclaim open appointment {} admin={}", appointment.getId(), email);
            return RemovalOutcome.ALREADY_REMOVED;
        }

        String owner = appointment.getStudentEmail();
        boolean removed = StoreCall.get(log, "remove claim of appointment " + appointment.getId(),
                () -> appointmentCommands.removeAppointmentSignup(appointment.getId(), owner));
        if (!removed) {
            return RemovalOutcome.ALREADY_REMOVED;
        }
        log.info("Removed appointment claim: id={} owner={} admin={}", appointment.getId(), owner, email);
        return RemovalOutcome.REMOVED;
    }

    // =========================================================
    // SCHEDULE
    // =========================================================

    public AppointmentSchedule updateAppointmentSchedule(Queue queue, int day, ScheduleRequest request,
                                                         boolean callerIsAdmin) {
        if (!callerIsAdmin) {
            log.warn("Non-admin attempted to update appointment schedule: queue={} day={}", queue.getId(), day);
            throw BookingException.forbidden("Only queue admins can change the appointment schedule.");
        }
        validator.requireWellFormed(request);
        return scheduleService.replaceSchedule(queue, day, request);
    }

    // =========================================================
    // HELPERS
    // =========================================================

    private void requireOpenCapacity(Queue queue, int day, TimeWindow window, int timeslot, int capacity) {
        List<AppointmentSlot> atTimeslot = StoreCall.get(log, "get appointments for timeslot " + timeslot,
                () -> appointmentQueries.findAppointmentsByTimeslot(queue.getId(), window.start(), window.end(), timeslot));
        int open = CapacityEvaluator.openSlots(capacity, atTimeslot);
        if (open < 1) {
            throw noRoom(queue, day, timeslot, capacity, (long) capacity - open);
        }
    }

    /**
     * A student may hold one appointment that is ongoing or upcoming per queue.
     */
    private void requireNoActiveAppointment(Queue queue, String email, Instant now, int durationMinutes) {
        Instant from = now.minus(Duration.ofMinutes(durationMinutes));
        List<AppointmentSlot> upcoming = StoreCall.get(log, "get future appointments of " + email,
                () -> appointmentQueries.findUpcomingForStudent(queue.getId(), from, email));
        if (!upcoming.isEmpty()) {
            log.warn("User {} attempted to sign up with appointment {} in the future", email, upcoming.get(0).getId());
            throw BookingException.conflict("You already have an appointment in the future!")
                    .with("appointment_id", upcoming.get(0).getId());
        }
    }

    private AppointmentSlot insertWithinCapacity(CapacityClaim claim, AppointmentSlot appointment) {
        try {
            return StoreCall.get(log, "sign up for appointment at timeslot " + claim.timeslot(),
                    () -> appointmentCommands.signupForAppointment(claim, appointment));
        } catch (CapacityExceededException e) {
            throw noRoom(claim, e);
        }
    }

    private static CapacityClaim capacityClaim(Queue queue, int day, TimeWindow window, int timeslot,
                                               AppointmentSchedule schedule) {
        return new CapacityClaim(queue.getId(), day, window.start(), window.end(), timeslot, schedule.capacityAt(timeslot));
    }

    private static BookingException noRoom(CapacityClaim claim, CapacityExceededException e) {
        log.warn("Lost race for timeslot: {}", e.getMessage());
        return BookingException.conflict("There are no slots open at that time!")
                .with("timeslot", claim.timeslot())
                .with("capacity", e.getCapacity())
                .with("claimed", e.getClaimed());
    }

    private static BookingException noRoom(Queue queue, int day, int timeslot, int capacity, long claimed) {
        log.warn("No appointment slots available: queue={} day={} timeslot={} capacity={} claimed={}",
                queue.getId(), day, timeslot, capacity, claimed);
        return BookingException.conflict("There are no slots open at that time!")
                .with("timeslot", timeslot)
                .with("capacity", capacity)
                .with("claimed", claimed);
    }

    private static BookingException appointmentGone(AppointmentSlot appointment) {
        return BookingException.notFound("This appointment doesn't exist. Perhaps it was already deleted?")
                .with("appointment_id", appointment.getId());
    }

    private static Float orZero(Float value) {
        return value == null ? ZERO : value;
    }
}
