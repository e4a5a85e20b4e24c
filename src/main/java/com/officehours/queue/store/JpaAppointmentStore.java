package com.officehours.queue.store;

import com.officehours.queue.entity.AppointmentSlot;
import com.officehours.queue.repository.AppointmentScheduleRepository;
import com.officehours.queue.repository.AppointmentSlotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Appointment store backed by Spring Data JPA.
 * Conditional writes lock the (queue, weekday) schedule row with PESSIMISTIC_WRITE, so the
 * claimed count read inside the transaction cannot change until the insert commits.
 */
@Component
public class JpaAppointmentStore implements AppointmentFinder, AppointmentQueries, AppointmentCommands {

    private static final Logger log = LoggerFactory.getLogger(JpaAppointmentStore.class);

    private final AppointmentSlotRepository slotRepository;
    private final AppointmentScheduleRepository scheduleRepository;

    public JpaAppointmentStore(AppointmentSlotRepository slotRepository,
                               AppointmentScheduleRepository scheduleRepository) {
        this.slotRepository = slotRepository;
        this.scheduleRepository = scheduleRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AppointmentSlot> findAppointment(Long appointmentId) {
        return slotRepository.findById(appointmentId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AppointmentSlot> findAppointments(Long queueId, Instant from, Instant to) {
        return slotRepository.findByQueueIdAndScheduledTimeGreaterThanEqualAndScheduledTimeLessThanOrderByScheduledTimeAscIdAsc(
                queueId, from, to);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AppointmentSlot> findAppointmentsForStudent(Long queueId, Instant from, Instant to, String email) {
        return slotRepository.findByQueueIdAndStudentEmailAndScheduledTimeGreaterThanEqualAndScheduledTimeLessThanOrderByScheduledTimeAscIdAsc(
                queueId, email, from, to);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AppointmentSlot> findAppointmentsByTimeslot(Long queueId, Instant from, Instant to, int timeslot) {
        return slotRepository.findByQueueIdAndTimeslotAndScheduledTimeGreaterThanEqualAndScheduledTimeLessThanOrderByIdAsc(
                queueId, timeslot, from, to);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AppointmentSlot> findUpcomingForStudent(Long queueId, Instant from, String email) {
        return slotRepository.findByQueueIdAndStudentEmailAndScheduledTimeGreaterThanEqualOrderByScheduledTimeAsc(
                queueId, email, from);
    }

    @Override
    @Transactional
    public AppointmentSlot signupForAppointment(CapacityClaim claim, AppointmentSlot appointment) {
        lockAndCheckCapacity(claim);
        AppointmentSlot saved = slotRepository.save(appointment);
        log.debug("Inserted appointment {} at queue={} day={} timeslot={}",
                saved.getId(), claim.queueId(), claim.day(), claim.timeslot());
        return saved;
    }

    @Override
    @Transactional
    public Optional<AppointmentSlot> claimTimeslot(CapacityClaim claim, String email) {
        lockAndCheckCapacity(claim);
        List<AppointmentSlot> open = slotRepository
                .findByQueueIdAndTimeslotAndScheduledTimeGreaterThanEqualAndScheduledTimeLessThanAndStudentEmailIsNullAndTemplatedTrueOrderByIdAsc(
                        claim.queueId(), claim.timeslot(), claim.windowStart(), claim.windowEnd());
        for (AppointmentSlot candidate : open) {
            if (slotRepository.claimIfOpen(candidate.getId(), email) == 1) {
                return slotRepository.findById(candidate.getId());
            }
        }
        return Optional.empty();
    }

    @Override
    @Transactional
    public List<AppointmentSlot> createOpenSlots(List<AppointmentSlot> slots) {
        return slotRepository.saveAll(slots);
    }

    @Override
    @Transactional
    public boolean updateAppointment(Long appointmentId, String owner, AppointmentSlot changes) {
        int updated = slotRepository.updateIfOwnedBy(appointmentId, owner,
                changes.getName(), changes.getDescription(), changes.getLocation(),
                changes.getMapX(), changes.getMapY());
        if (updated == 0) {
            log.debug("Appointment {} is no longer held by {}; nothing updated", appointmentId, owner);
        }
        return updated == 1;
    }

    @Override
    @Transactional
    public boolean removeAppointmentSignup(Long appointmentId, String owner) {
        int cleared = slotRepository.clearClaimIfOwnedBy(appointmentId, owner);
        if (cleared == 0) {
            log.debug("Appointment {} is no longer held by {}; nothing cleared", appointmentId, owner);
        }
        return cleared == 1;
    }

    private void lockAndCheckCapacity(CapacityClaim claim) {
        // Re-read the capacity from the locked row; the caller's copy may be stale.
        int capacity = scheduleRepository.findByQueueIdAndDayForUpdate(claim.queueId(), claim.day())
                .filter(s -> s.hasTimeslot(claim.timeslot()))
                .map(s -> s.capacityAt(claim.timeslot()))
                .orElse(0);
        long claimed = slotRepository
                .countByQueueIdAndTimeslotAndScheduledTimeGreaterThanEqualAndScheduledTimeLessThanAndStudentEmailIsNotNull(
                        claim.queueId(), claim.timeslot(), claim.windowStart(), claim.windowEnd());
        if (claimed >= capacity) {
            throw new CapacityExceededException(claim, capacity, claimed);
        }
    }
}
