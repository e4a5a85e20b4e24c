package com.officehours.queue.service;

import com.officehours.queue.dto.ScheduleRequest;
import com.officehours.queue.entity.AppointmentSchedule;
import com.officehours.queue.entity.AppointmentSlot;
import com.officehours.queue.entity.Queue;
import com.officehours.queue.exception.BookingException;
import com.officehours.queue.store.AppointmentQueries;
import com.officehours.queue.store.ScheduleInUseException;
import com.officehours.queue.store.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Weekly capacity profiles of a queue. A weekday's profile is frozen while any
 * appointment exists in that weekday's current window.
 */
@Service
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleStore scheduleStore;
    private final AppointmentQueries appointmentQueries;
    private final TimeWindowCalculator windows;

    public ScheduleService(ScheduleStore scheduleStore,
                           AppointmentQueries appointmentQueries,
                           TimeWindowCalculator windows) {
        this.scheduleStore = scheduleStore;
        this.appointmentQueries = appointmentQueries;
        this.windows = windows;
    }

    public List<AppointmentSchedule> scheduleForWeek(Queue queue) {
        return StoreCall.get(log, "get appointment schedule of queue " + queue.getId(),
                () -> scheduleStore.findSchedules(queue.getId()));
    }

    public AppointmentSchedule scheduleForDay(Queue queue, int day) {
        requireWeekday(day);
        return StoreCall.get(log, "get appointment schedule of queue " + queue.getId() + " day " + day,
                        () -> scheduleStore.findScheduleForDay(queue.getId(), day))
                .orElseThrow(() -> BookingException.notFound("There's no appointment schedule for that day.")
                        .with("queue_id", queue.getId())
                        .with("day", day));
    }

    public AppointmentSchedule replaceSchedule(Queue queue, int day, ScheduleRequest request) {
        requireWeekday(day);
        TimeWindow window = windows.weekdayBounds(day, queue.zone());

        List<AppointmentSlot> existing = StoreCall.get(log, "get appointments of queue " + queue.getId(),
                () -> appointmentQueries.findAppointments(queue.getId(), window.start(), window.end()));
        if (!existing.isEmpty()) {
            throw scheduleInUse(queue, day, existing.size());
        }

        try {
            AppointmentSchedule saved = StoreCall.get(log, "update appointment schedule of queue " + queue.getId(),
                    () -> storeSchedule(queue, day, window, request));
            log.info("Updated appointment schedule: queue={} day={} duration={} schedule={}",
                    queue.getId(), day, saved.getDuration(), saved.getSchedule());
            return saved;
        } catch (ScheduleInUseException e) {
            throw scheduleInUse(queue, day, e.getAppointments());
        }
    }

    private AppointmentSchedule storeSchedule(Queue queue, int day, TimeWindow window, ScheduleRequest request) {
        try {
            return scheduleStore.replaceSchedule(queue.getId(), day, window.start(), window.end(),
                    request.getDuration(), request.getSchedule());
        } catch (DataIntegrityViolationException e) {
            // Two first-time writes for the same weekday; the (queue, weekday) key kept one
            log.warn("Concurrent creation of appointment schedule: queue={} day={}", queue.getId(), day, e);
            throw BookingException.conflict("Someone else changed this schedule at the same time. Please try again.")
                    .with("queue_id", queue.getId())
                    .with("day", day);
        }
    }

    static void requireWeekday(int day) {
        if (!TimeWindowCalculator.isWeekday(day)) {
            throw BookingException.notFound("Invalid day \"" + day + "\"").with("day", day);
        }
    }

    private static BookingException scheduleInUse(Queue queue, int day, long appointments) {
        log.warn("Appointment schedule update attempted with {} existing appointments: queue={} day={}",
                appointments, queue.getId(), day);
        return BookingException.conflict("The schedule can't be changed while there are appointments on that day.")
                .with("queue_id", queue.getId())
                .with("day", day)
                .with("appointments", appointments);
    }
}
