package com.officehours.queue.store;

import lombok.Getter;

@Getter
public class CapacityExceededException extends RuntimeException {

    private final int capacity;
    private final long claimed;

    public CapacityExceededException(CapacityClaim claim, int capacity, long claimed) {
        super("Timeslot " + claim.timeslot() + " of queue " + claim.queueId() + " day " + claim.day()
                + " is full: " + claimed + "/" + capacity);
        this.capacity = capacity;
        this.claimed = claimed;
    }
}
