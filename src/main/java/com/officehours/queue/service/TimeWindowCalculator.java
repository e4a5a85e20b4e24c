package com.officehours.queue.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Weekday windows relative to the current week.
 * Weekday indices run from 0 (Sunday) to 6 (Saturday) and weeks start on Sunday.
 */
@Component
public class TimeWindowCalculator {

    public static final int DAYS_PER_WEEK = 7;

    private final Clock clock;

    public TimeWindowCalculator(Clock clock) {
        this.clock = clock;
    }

    /**
     * The occurrence of {@code weekday} in the current week of {@code zone}, from local
     * midnight to the next local midnight.
     */
    public TimeWindow weekdayBounds(int weekday, ZoneId zone) {
        if (!isWeekday(weekday)) {
            throw new IllegalArgumentException("weekday must be in [0, 6], got " + weekday);
        }
        LocalDate today = LocalDate.now(clock.withZone(zone));
        LocalDate target = today.plusDays(weekday - weekdayIndex(today));
        return new TimeWindow(
                target.atStartOfDay(zone).toInstant(),
                target.plusDays(1).atStartOfDay(zone).toInstant());
    }

    public int currentWeekday(ZoneId zone) {
        return weekdayIndex(LocalDate.now(clock.withZone(zone)));
    }

    public Instant now() {
        return clock.instant();
    }

    public static boolean isWeekday(int weekday) {
        return weekday >= 0 && weekday < DAYS_PER_WEEK;
    }

    private static int weekdayIndex(LocalDate date) {
        // DayOfWeek runs 1 (Monday) .. 7 (Sunday)
        return date.getDayOfWeek().getValue() % DAYS_PER_WEEK;
    }
}
