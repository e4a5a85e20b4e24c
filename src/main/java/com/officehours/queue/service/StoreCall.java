package com.officehours.queue.service;

import com.officehours.queue.exception.BookingException;
import org.slf4j.Logger;
import org.springframework.dao.DataAccessException;

import java.util.function.Supplier;

/**
 * Runs a store call, turning persistence failures into a logged {@code INTERNAL} error
 * whose message hides the cause.
 */
final class StoreCall {

    static final String GENERIC_FAILURE = "Something went wrong on our end. Please try again.";

    private StoreCall() {
    }

    static <T> T get(Logger log, String what, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("Failed to {}", what, e);
            throw BookingException.internal(GENERIC_FAILURE, e);
        }
    }

    static void run(Logger log, String what, Runnable call) {
        get(log, what, () -> {
            call.run();
            return null;
        });
    }
}
