package com.officehours.queue.service;

import com.officehours.queue.entity.AppointmentSlot;

import java.util.Collection;

/**
 * Open capacity at a single timeslot.
 */
public final class CapacityEvaluator {

    private CapacityEvaluator() {
    }

    /**
     * Capacity minus the claimed appointments in {@code atTimeslot}. Negative when the
     * capacity was lowered below existing claims; treat anything below 1 as full.
     */
    public static int openSlots(int capacity, Collection<AppointmentSlot> atTimeslot) {
        int open = capacity;
        for (AppointmentSlot a : atTimeslot) {
            if (a.isClaimed()) {
                open--;
            }
        }
        return open;
    }

    public static boolean hasRoom(int capacity, Collection<AppointmentSlot> atTimeslot) {
        return openSlots(capacity, atTimeslot) >= 1;
    }
}
