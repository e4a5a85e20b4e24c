package com.officehours.queue.config;

import com.officehours.queue.entity.AppointmentSchedule;
import com.officehours.queue.entity.Queue;
import com.officehours.queue.repository.AppointmentScheduleRepository;
import com.officehours.queue.repository.QueueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.Set;

/**
 * Idempotent seeder: inserts a demo queue with weekday schedules if not present.
 * Safe to re-run.
 */
@Component
@ConditionalOnProperty(name = "officehours.seed-demo", havingValue = "true")
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    static final String DEMO_QUEUE = "Demo Office Hours";
    static final int SLOT_DURATION_MINUTES = 30;
    // Closed until 09:00, then 09:00-13:00 with two seats for the first two hours
    static final String DEMO_SCHEDULE = "0".repeat(18) + "22221111";

    private final QueueRepository queueRepository;
    private final AppointmentScheduleRepository scheduleRepository;

    @Value("${officehours.default-time-zone:UTC}")
    private String defaultTimeZone;

    @Value("${officehours.demo-admin:admin@example.edu}")
    private String demoAdmin;

    public DataInitializer(QueueRepository queueRepository,
                           AppointmentScheduleRepository scheduleRepository) {
        this.queueRepository = queueRepository;
        this.scheduleRepository = scheduleRepository;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void seed() {
        Queue queue = queueRepository.findFirstByNameIgnoreCase(DEMO_QUEUE).orElse(null);
        if (queue == null) {
            log.info("Seeding demo queue...");
            queue = queueRepository.save(Queue.builder()
                    .name(DEMO_QUEUE)
                    .timeZone(defaultTimeZone)
                    .admins(new HashSet<>(Set.of(demoAdmin)))
                    .build());
        }

        int added = 0;
        // Monday (1) to Friday (5)
        for (int day = 1; day <= 5; day++) {
            if (scheduleRepository.findByQueueIdAndDay(queue.getId(), day).isEmpty()) {
                scheduleRepository.save(AppointmentSchedule.builder()
                        .queueId(queue.getId())
                        .day(day)
                        .duration(SLOT_DURATION_MINUTES)
                        .schedule(DEMO_SCHEDULE)
                        .build());
                added++;
            }
        }
        log.info("DataInitializer: queue={} ({}), schedules added={}", queue.getId(), queue.getName(), added);
    }
}
