package com.officehours.queue.service;

import com.officehours.queue.entity.AppointmentSlot;
import com.officehours.queue.exception.BookingError;
import com.officehours.queue.exception.BookingException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.officehours.queue.service.BookingFixture.TUESDAY;
import static org.assertj.core.api.Assertions.assertThat;

class BookingCoordinatorConcurrencyTest {

    private static final int STUDENTS = 16;

    @Test
    void racingSignupsNeverExceedCapacity() throws Exception {
        BookingFixture f = new BookingFixture();
        List<BookingError> failures = race(f, email -> f.signup(TUESDAY, 0, email));

        assertThat(f.claimedAt(TUESDAY, 0)).isEqualTo(2);
        assertThat(failures).hasSize(STUDENTS - 2).containsOnly(BookingError.CONFLICT);
    }

    @Test
    void racingClaimsTakeEachOpenSlotOnce() throws Exception {
        BookingFixture f = new BookingFixture();
        f.slotService.openTemplatedSlots(f.queue, TUESDAY, BookingFixture.request("drop-in"), true);

        List<BookingError> failures = race(f, email -> f.coordinator.claimTimeslot(f.queue, TUESDAY, 0, email));

        assertThat(f.claimedAt(TUESDAY, 0)).isEqualTo(2);
        assertThat(failures).hasSize(STUDENTS - 2).containsOnly(BookingError.CONFLICT);
        assertThat(f.appointments.all())
                .filteredOn(a -> a.getTimeslot() == 0)
                .extracting(AppointmentSlot::getStudentEmail)
                .doesNotHaveDuplicates();
    }

    private interface Attempt {
        void run(String email);
    }

    private static List<BookingError> race(BookingFixture f, Attempt attempt) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(STUDENTS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<BookingError>> results = new ArrayList<>();
        try {
            for (int i = 0; i < STUDENTS; i++) {
                String email = "student" + i + "@example.edu";
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        attempt.run(email);
                        return null;
                    } catch (BookingException e) {
                        return e.getError();
                    }
                }));
            }
            start.countDown();

            List<BookingError> failures = new ArrayList<>();
            for (Future<BookingError> result : results) {
                BookingError error = result.get(10, TimeUnit.SECONDS);
                if (error != null) {
                    failures.add(error);
                }
            }
            return failures;
        } finally {
            pool.shutdownNow();
        }
    }
}
