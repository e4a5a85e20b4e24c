package com.officehours.queue.repository;

import com.officehours.queue.entity.AppointmentSlot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Time windows are half-open: {@code from <= scheduledTime < to}.
 */
@Repository
public interface AppointmentSlotRepository extends JpaRepository<AppointmentSlot, Long> {

    List<AppointmentSlot> findByQueueIdAndScheduledTimeGreaterThanEqualAndScheduledTimeLessThanOrderByScheduledTimeAscIdAsc(
            Long queueId,
            Instant from,
            Instant to
    );

    List<AppointmentSlot> findByQueueIdAndStudentEmailAndScheduledTimeGreaterThanEqualAndScheduledTimeLessThanOrderByScheduledTimeAscIdAsc(
            Long queueId,
            String studentEmail,
            Instant from,
            Instant to
    );

    List<AppointmentSlot> findByQueueIdAndTimeslotAndScheduledTimeGreaterThanEqualAndScheduledTimeLessThanOrderByIdAsc(
            Long queueId,
            int timeslot,
            Instant from,
            Instant to
    );

    List<AppointmentSlot> findByQueueIdAndStudentEmailAndScheduledTimeGreaterThanEqualOrderByScheduledTimeAsc(
            Long queueId,
            String studentEmail,
            Instant from
    );

    List<AppointmentSlot> findByQueueIdAndTimeslotAndScheduledTimeGreaterThanEqualAndScheduledTimeLessThanAndStudentEmailIsNullAndTemplatedTrueOrderByIdAsc(
            Long queueId,
            int timeslot,
            Instant from,
            Instant to
    );

    long countByQueueIdAndTimeslotAndScheduledTimeGreaterThanEqualAndScheduledTimeLessThanAndStudentEmailIsNotNull(
            Long queueId,
            int timeslot,
            Instant from,
            Instant to
    );

    long countByQueueIdAndScheduledTimeGreaterThanEqualAndScheduledTimeLessThan(
            Long queueId,
            Instant from,
            Instant to
    );

    @Modifying(clearAutomatically = true)
    @Query("UPDATE AppointmentSlot s SET s.studentEmail = :email, s.version = s.version + 1 "
            + "WHERE s.id = :id AND s.studentEmail IS NULL AND s.templated = true")
    int claimIfOpen(@Param("id") Long id, @Param("email") String email);

    /**
     * Edits the contents of an appointment still held by {@code owner}. An edited row is no
     * longer templated, so it is never handed to another student after a cancel.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE AppointmentSlot s SET s.name = :name, s.description = :description, s.location = :location, "
            + "s.mapX = :mapX, s.mapY = :mapY, s.templated = false, s.version = s.version + 1 "
            + "WHERE s.id = :id AND s.studentEmail = :owner")
    int updateIfOwnedBy(@Param("id") Long id,
                        @Param("owner") String owner,
                        @Param("name") String name,
                        @Param("description") String description,
                        @Param("location") String location,
                        @Param("mapX") Float mapX,
                        @Param("mapY") Float mapY);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE AppointmentSlot s SET s.studentEmail = NULL, s.version = s.version + 1 "
            + "WHERE s.id = :id AND s.studentEmail = :owner")
    int clearClaimIfOwnedBy(@Param("id") Long id, @Param("owner") String owner);
}
