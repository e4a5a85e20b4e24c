package com.officehours.queue.controller;

import com.officehours.queue.dto.ScheduleRequest;
import com.officehours.queue.entity.AppointmentSchedule;
import com.officehours.queue.entity.Queue;
import com.officehours.queue.service.BookingCoordinator;
import com.officehours.queue.service.ScheduleService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.officehours.queue.controller.AppointmentController.IDENTITY_HEADER;

@RestController
@RequestMapping("/queues/{queueId}/schedule")
public class ScheduleController {

    private final ScheduleService scheduleService;
    private final BookingCoordinator coordinator;
    private final RequestResolver resolver;

    public ScheduleController(ScheduleService scheduleService, BookingCoordinator coordinator, RequestResolver resolver) {
        this.scheduleService = scheduleService;
        this.coordinator = coordinator;
        this.resolver = resolver;
    }

    @GetMapping
    public ResponseEntity<List<AppointmentSchedule>> getAppointmentSchedule(@PathVariable Long queueId) {
        return ResponseEntity.ok(scheduleService.scheduleForWeek(resolver.queue(queueId)));
    }

    @GetMapping("/{day}")
    public ResponseEntity<AppointmentSchedule> getAppointmentScheduleForDay(@PathVariable Long queueId,
                                                                            @PathVariable int day) {
        return ResponseEntity.ok(scheduleService.scheduleForDay(resolver.queue(queueId), day));
    }

    @PutMapping("/{day}")
    public ResponseEntity<Void> updateAppointmentSchedule(@PathVariable Long queueId,
                                                          @PathVariable int day,
                                                          @RequestBody ScheduleRequest request,
                                                          @RequestHeader(IDENTITY_HEADER) String email) {
        Queue queue = resolver.queue(queueId);
        coordinator.updateAppointmentSchedule(queue, day, request, queue.isAdmin(email));
        return ResponseEntity.noContent().build();
    }
}
