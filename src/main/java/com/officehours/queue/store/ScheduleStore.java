package com.officehours.queue.store;

import com.officehours.queue.entity.AppointmentSchedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduleStore {

    List<AppointmentSchedule> findSchedules(Long queueId);

    Optional<AppointmentSchedule> findScheduleForDay(Long queueId, int day);

    /**
     * Creates or replaces the schedule of a weekday, provided no appointment exists in
     * {@code [from, to)}.
     *
     * @throws ScheduleInUseException when appointments exist in the window
     */
    AppointmentSchedule replaceSchedule(Long queueId, int day, Instant from, Instant to, int duration, String schedule);
}
