package com.officehours.queue.store;

import com.officehours.queue.entity.AppointmentSchedule;
import com.officehours.queue.repository.AppointmentScheduleRepository;
import com.officehours.queue.repository.AppointmentSlotRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
public class JpaScheduleStore implements ScheduleStore {

    private final AppointmentScheduleRepository scheduleRepository;
    private final AppointmentSlotRepository slotRepository;

    public JpaScheduleStore(AppointmentScheduleRepository scheduleRepository,
                            AppointmentSlotRepository slotRepository) {
        this.scheduleRepository = scheduleRepository;
        this.slotRepository = slotRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<AppointmentSchedule> findSchedules(Long queueId) {
        return scheduleRepository.findByQueueIdOrderByDayAsc(queueId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AppointmentSchedule> findScheduleForDay(Long queueId, int day) {
        return scheduleRepository.findByQueueIdAndDay(queueId, day);
    }

    @Override
    @Transactional
    public AppointmentSchedule replaceSchedule(Long queueId, int day, Instant from, Instant to, int duration, String schedule) {
        AppointmentSchedule current = scheduleRepository.findByQueueIdAndDayForUpdate(queueId, day)
                .orElseGet(() -> AppointmentSchedule.builder().queueId(queueId).day(day).build());

        long appointments = slotRepository.countByQueueIdAndScheduledTimeGreaterThanEqualAndScheduledTimeLessThan(
                queueId, from, to);
        if (appointments > 0) {
            throw new ScheduleInUseException(queueId, day, appointments);
        }

        current.setDuration(duration);
        current.setSchedule(schedule);
        // A first-time row was never locked; flush so a duplicate fails inside this call
        return scheduleRepository.saveAndFlush(current);
    }
}
