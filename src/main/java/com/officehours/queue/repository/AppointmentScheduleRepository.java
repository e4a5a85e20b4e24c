package com.officehours.queue.repository;

import com.officehours.queue.entity.AppointmentSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

@Repository
public interface AppointmentScheduleRepository extends JpaRepository<AppointmentSchedule, Long> {

    List<AppointmentSchedule> findByQueueIdOrderByDayAsc(Long queueId);

    Optional<AppointmentSchedule> findByQueueIdAndDay(Long queueId, int day);

    /**
     * Serializes every capacity-changing write of one (queue, weekday).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM AppointmentSchedule s WHERE s.queueId = :queueId AND s.day = :day")
    Optional<AppointmentSchedule> findByQueueIdAndDayForUpdate(@Param("queueId") Long queueId, @Param("day") int day);
}
