package com.officehours.queue.service;

import com.officehours.queue.dto.AppointmentRequest;
import com.officehours.queue.entity.AppointmentSchedule;
import com.officehours.queue.entity.AppointmentSlot;
import com.officehours.queue.entity.Queue;
import com.officehours.queue.exception.BookingException;
import com.officehours.queue.store.AppointmentCommands;
import com.officehours.queue.store.AppointmentQueries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Generation of open, pre-described slots that students claim as-is.
 */
@Service
public class SlotService {

    private static final Logger log = LoggerFactory.getLogger(SlotService.class);

    private final ScheduleService scheduleService;
    private final AppointmentQueries appointmentQueries;
    private final AppointmentCommands appointmentCommands;
    private final TimeWindowCalculator windows;
    private final AppointmentValidator validator;

    public SlotService(ScheduleService scheduleService,
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

    /**
     * Tops every upcoming timeslot of the day up to its capacity with open slots copied
     * from {@code template}. Claimed rows and templated rows, open or not, count towards
     * the capacity, so calling this twice creates nothing the second time. Vacated signups
     * do not count; they are never offered to the claim path.
     */
    public List<AppointmentSlot> openTemplatedSlots(Queue queue, int day, AppointmentRequest template,
                                                    boolean callerIsAdmin) {
        if (!callerIsAdmin) {
            log.warn("Non-admin attempted to open templated slots: queue={} day={}", queue.getId(), day);
            throw BookingException.forbidden("Only queue admins can open appointment slots.");
        }
        validator.requireComplete(template);

        AppointmentSchedule schedule = scheduleService.scheduleForDay(queue, day);
        TimeWindow window = windows.weekdayBounds(day, queue.zone());
        Instant now = windows.now();

        List<AppointmentSlot> existing = StoreCall.get(log, "get appointments of queue " + queue.getId(),
                () -> appointmentQueries.findAppointments(queue.getId(), window.start(), window.end()));
        int[] rowsPerTimeslot = new int[schedule.timeslotCount()];
        for (AppointmentSlot a : existing) {
            if (schedule.hasTimeslot(a.getTimeslot()) && (a.isTemplated() || a.isClaimed())) {
                rowsPerTimeslot[a.getTimeslot()]++;
            }
        }

        List<AppointmentSlot> slots = new ArrayList<>();
        for (int timeslot = 0; timeslot < schedule.timeslotCount(); timeslot++) {
            Instant start = window.timeslotStart(timeslot, schedule.getDuration());
            if (now.isAfter(start)) continue;
            for (int n = rowsPerTimeslot[timeslot]; n < schedule.capacityAt(timeslot); n++) {
                slots.add(AppointmentSlot.builder()
                        .queueId(queue.getId())
                        .timeslot(timeslot)
                        .scheduledTime(start)
                        .duration(schedule.getDuration())
                        .name(template.getName())
                        .description(template.getDescription())
                        .location(template.getLocation())
                        .mapX(template.getMapX() == null ? 0f : template.getMapX())
                        .mapY(template.getMapY() == null ? 0f : template.getMapY())
                        .templated(true)
                        .build());
            }
        }
        if (slots.isEmpty()) return List.of();

        List<AppointmentSlot> created = StoreCall.get(log, "create open slots for queue " + queue.getId(),
                () -> appointmentCommands.createOpenSlots(slots));
        log.info("Generated {} open slots for queue={} day={}", created.size(), queue.getId(), day);
        return created;
    }
}
