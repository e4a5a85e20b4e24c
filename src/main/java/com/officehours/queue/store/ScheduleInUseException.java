package com.officehours.queue.store;

import lombok.Getter;

@Getter
public class ScheduleInUseException extends RuntimeException {

    private final long appointments;

    public ScheduleInUseException(Long queueId, int day, long appointments) {
        super("Schedule of queue " + queueId + " day " + day + " has " + appointments + " appointments");
        this.appointments = appointments;
    }
}
