package com.officehours.queue.service;

import com.officehours.queue.dto.AppointmentRequest;
import com.officehours.queue.dto.RemovalOutcome;
import com.officehours.queue.dto.ScheduleRequest;
import com.officehours.queue.dto.UpdateOutcome;
import com.officehours.queue.entity.AppointmentSchedule;
import com.officehours.queue.entity.AppointmentSlot;
import com.officehours.queue.exception.BookingError;
import com.officehours.queue.exception.BookingException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.time.Instant;
import java.util.List;

import static com.officehours.queue.service.BookingFixture.ADMIN;
import static com.officehours.queue.service.BookingFixture.ALICE;
import static com.officehours.queue.service.BookingFixture.BOB;
import static com.officehours.queue.service.BookingFixture.CAROL;
import static com.officehours.queue.service.BookingFixture.SUNDAY;
import static com.officehours.queue.service.BookingFixture.TUESDAY;
import static com.officehours.queue.service.BookingFixture.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BookingCoordinatorTest {

    private final BookingFixture f = new BookingFixture();

    private static BookingException assertFails(BookingError expected, Executable call) {
        BookingException e = assertThrows(BookingException.class, call);
        assertThat(e.getError()).isEqualTo(expected);
        return e;
    }

    @Nested
    class Signup {

        @Test
        void fillsTimeslotUpToItsCapacityDigit() {
            f.signup(TUESDAY, 0, ALICE);
            f.signup(TUESDAY, 0, BOB);

            BookingException e = assertFails(BookingError.CONFLICT, () -> f.signup(TUESDAY, 0, CAROL));
            assertThat(e.getDetails()).containsEntry("capacity", 2).containsEntry("claimed", 2L);
            assertThat(f.claimedAt(TUESDAY, 0)).isEqualTo(2);
        }

        @Test
        void zeroCapacityTimeslotIsAlwaysFull() {
            assertFails(BookingError.CONFLICT, () -> f.signup(TUESDAY, 3, ALICE));
            assertThat(f.appointments.all()).isEmpty();
        }

        @Test
        void unknownTimeslotIsNotFound() {
            assertFails(BookingError.NOT_FOUND, () -> f.signup(TUESDAY, 5, ALICE));
            assertFails(BookingError.NOT_FOUND, () -> f.signup(TUESDAY, 4, ALICE));
            assertFails(BookingError.NOT_FOUND, () -> f.signup(TUESDAY, -1, ALICE));
        }

        @Test
        void dayWithoutScheduleIsNotFound() {
            assertFails(BookingError.NOT_FOUND, () -> f.signup(3, 0, ALICE));
            assertFails(BookingError.NOT_FOUND, () -> f.signup(7, 0, ALICE));
        }

        @Test
        void stampsServerSideFields() {
            AppointmentSlot created = f.coordinator.signupForAppointment(f.queue, TUESDAY, 1,
                    AppointmentRequest.builder()
                            .name("Lab 2")
                            .description("segfault")
                            .location("Room 101")
                            .timeslot(3)
                            .mapY(4.5f)
                            .build(),
                    ALICE);

            assertThat(created.getId()).isNotNull();
            assertThat(created.getQueueId()).isEqualTo(f.queue.getId());
            assertThat(created.getTimeslot()).isEqualTo(1);
            assertThat(created.getScheduledTime()).isEqualTo(Instant.parse("2026-10-20T00:30:00Z"));
            assertThat(created.getDuration()).isEqualTo(30);
            assertThat(created.getStudentEmail()).isEqualTo(ALICE);
            assertThat(created.getMapX()).isZero();
            assertThat(created.getMapY()).isEqualTo(4.5f);
        }

        @Test
        void incompletePayloadIsBadRequest() {
            AppointmentRequest missingLocation = AppointmentRequest.builder()
                    .name("Lab 2")
                    .description("segfault")
                    .location("  ")
                    .build();

            assertFails(BookingError.BAD_REQUEST,
                    () -> f.coordinator.signupForAppointment(f.queue, TUESDAY, 0, missingLocation, ALICE));
            assertFails(BookingError.BAD_REQUEST,
                    () -> f.coordinator.signupForAppointment(f.queue, TUESDAY, 0, null, ALICE));
        }

        @Test
        void studentHoldsOneUpcomingAppointmentPerQueue() {
            AppointmentSlot first = f.signup(TUESDAY, 1, ALICE);

            BookingException e = assertFails(BookingError.CONFLICT, () -> f.signup(TUESDAY, 2, ALICE));
            assertThat(e.getDetails()).containsEntry("appointment_id", first.getId());

            f.coordinator.removeAppointmentSignup(first, ALICE);
            assertThat(f.signup(TUESDAY, 2, ALICE).getTimeslot()).isEqualTo(2);
        }

        @Test
        void pastTimeslotIsBadRequest() {
            // today is Sunday 08:00, so Sunday 01:00 already passed
            assertFails(BookingError.BAD_REQUEST, () -> f.signup(SUNDAY, 2, ALICE));
        }
    }

    @Nested
    class Cancel {

        @Test
        void repeatedCancelSucceedsWithoutWriting() {
            AppointmentSlot booked = f.signup(TUESDAY, 0, ALICE);

            assertThat(f.coordinator.removeAppointmentSignup(booked, ALICE)).isEqualTo(RemovalOutcome.REMOVED);
            AppointmentSlot vacated = f.appointments.findAppointment(booked.getId()).orElseThrow();
            assertThat(f.coordinator.removeAppointmentSignup(vacated, ALICE)).isEqualTo(RemovalOutcome.ALREADY_REMOVED);

            assertThat(f.appointments.removals()).isEqualTo(1);
            assertThat(vacated.isClaimed()).isFalse();
        }

        @Test
        void cannotCancelSomeoneElsesAppointment() {
            AppointmentSlot booked = f.signup(TUESDAY, 0, ALICE);

            assertFails(BookingError.FORBIDDEN, () -> f.coordinator.removeAppointmentSignup(booked, BOB));
            assertThat(f.claimedAt(TUESDAY, 0)).isEqualTo(1);
        }

        @Test
        void cannotCancelThePast() {
            AppointmentSlot past = f.appointments.put(AppointmentSlot.builder()
                    .queueId(f.queue.getId())
                    .timeslot(14)
                    .scheduledTime(Instant.parse("2026-10-18T07:00:00Z"))
                    .duration(30)
                    .studentEmail(ALICE)
                    .build());

            assertFails(BookingError.BAD_REQUEST, () -> f.coordinator.removeAppointmentSignup(past, ALICE));
            assertThat(f.appointments.removals()).isZero();
        }

        @Test
        void replayedCancelLeavesTheNextClaimAlone() {
            f.slotService.openTemplatedSlots(f.queue, TUESDAY, request("drop-in"), true);
            AppointmentSlot aliceCopy = f.coordinator.claimTimeslot(f.queue, TUESDAY, 1, ALICE);
            f.coordinator.removeAppointmentSignup(aliceCopy, ALICE);
            AppointmentSlot carols = f.coordinator.claimTimeslot(f.queue, TUESDAY, 1, CAROL);
            assertThat(carols.getId()).isEqualTo(aliceCopy.getId());

            assertThat(f.coordinator.removeAppointmentSignup(aliceCopy, ALICE)).isEqualTo(RemovalOutcome.ALREADY_REMOVED);
            assertThat(f.appointments.findAppointment(carols.getId()).orElseThrow().getStudentEmail()).isEqualTo(CAROL);
        }

        @Test
        void cancelledCapacityCanBeReused() {
            AppointmentSlot booked = f.signup(TUESDAY, 1, ALICE);
            f.coordinator.removeAppointmentSignup(booked, ALICE);

            assertThat(f.signup(TUESDAY, 1, BOB).getStudentEmail()).isEqualTo(BOB);
        }
    }

    @Nested
    class Update {

        @Test
        void sameTimeslotUpdatesInPlace() {
            AppointmentSlot booked = f.signup(TUESDAY, 0, ALICE);
            AppointmentRequest edit = request("actually about pointers");
            edit.setTimeslot(0);

            UpdateOutcome outcome = f.coordinator.updateAppointment(f.queue, booked, edit, ALICE);

            assertThat(outcome.moved()).isFalse();
            assertThat(f.appointments.all()).hasSize(1);
            assertThat(f.appointments.findAppointment(booked.getId()).orElseThrow().getDescription())
                    .isEqualTo("actually about pointers");
        }

        @Test
        void missingTimeslotMeansUnchanged() {
            AppointmentSlot booked = f.signup(TUESDAY, 0, ALICE);

            UpdateOutcome outcome = f.coordinator.updateAppointment(f.queue, booked, request("new"), ALICE);

            assertThat(outcome.moved()).isFalse();
            assertThat(f.appointments.all()).hasSize(1);
        }

        @Test
        void staleCopyCannotTakeBackVacatedAppointment() {
            AppointmentSlot aliceCopy = f.signup(TUESDAY, 1, ALICE);
            f.coordinator.removeAppointmentSignup(aliceCopy, ALICE);
            f.signup(TUESDAY, 1, BOB);

            assertFails(BookingError.NOT_FOUND,
                    () -> f.coordinator.updateAppointment(f.queue, aliceCopy, request("still mine?"), ALICE));

            assertThat(f.claimedAt(TUESDAY, 1)).isEqualTo(1);
            AppointmentSlot vacated = f.appointments.findAppointment(aliceCopy.getId()).orElseThrow();
            assertThat(vacated.isClaimed()).isFalse();
            assertThat(vacated.getDescription()).isEqualTo("question about recursion");
        }

        @Test
        void vacatedAppointmentIsNotFound() {
            AppointmentSlot booked = f.signup(TUESDAY, 0, ALICE);
            f.coordinator.removeAppointmentSignup(booked, ALICE);
            AppointmentSlot vacated = f.appointments.findAppointment(booked.getId()).orElseThrow();

            assertFails(BookingError.NOT_FOUND,
                    () -> f.coordinator.updateAppointment(f.queue, vacated, request("x"), ALICE));
        }

        @Test
        void cannotUpdateSomeoneElsesAppointment() {
            AppointmentSlot booked = f.signup(TUESDAY, 0, ALICE);

            assertFails(BookingError.FORBIDDEN,
                    () -> f.coordinator.updateAppointment(f.queue, booked, request("mine now"), BOB));
        }

        @Test
        void moveCreatesNewAppointmentTodayThenVacatesOld() {
            AppointmentSlot booked = f.signup(SUNDAY, 20, ALICE);
            AppointmentRequest move = request("later please");
            move.setTimeslot(22);

            UpdateOutcome outcome = f.coordinator.updateAppointment(f.queue, booked, move, ALICE);

            assertThat(outcome.moved()).isTrue();
            AppointmentSlot created = outcome.appointment();
            assertThat(created.getId()).isNotEqualTo(booked.getId());
            assertThat(created.getTimeslot()).isEqualTo(22);
            assertThat(created.getScheduledTime()).isEqualTo(Instant.parse("2026-10-18T11:00:00Z"));
            assertThat(created.getStudentEmail()).isEqualTo(ALICE);
            assertThat(created.getDescription()).isEqualTo("later please");
            assertThat(f.appointments.findAppointment(booked.getId()).orElseThrow().isClaimed()).isFalse();
        }

        @Test
        void moveIntoThePastIsBadRequest() {
            AppointmentSlot booked = f.signup(SUNDAY, 20, ALICE);
            AppointmentRequest move = request("earlier");
            move.setTimeslot(2);

            assertFails(BookingError.BAD_REQUEST, () -> f.coordinator.updateAppointment(f.queue, booked, move, ALICE));
            assertThat(f.appointments.findAppointment(booked.getId()).orElseThrow().isClaimed()).isTrue();
        }

        @Test
        void moveIntoFullTimeslotIsConflict() {
            f.signup(SUNDAY, 22, BOB);
            AppointmentSlot booked = f.signup(SUNDAY, 20, ALICE);
            AppointmentRequest move = request("later");
            move.setTimeslot(22);

            assertFails(BookingError.CONFLICT, () -> f.coordinator.updateAppointment(f.queue, booked, move, ALICE));
            assertThat(f.appointments.all()).hasSize(2);
        }

        @Test
        void moveToUnknownTimeslotIsNotFound() {
            AppointmentSlot booked = f.signup(SUNDAY, 20, ALICE);
            AppointmentRequest move = request("later");
            move.setTimeslot(40);

            assertFails(BookingError.NOT_FOUND, () -> f.coordinator.updateAppointment(f.queue, booked, move, ALICE));
        }

        @Test
        void failedRemovalAfterCreateLeavesTwoBookings() {
            AppointmentSlot booked = f.signup(SUNDAY, 20, ALICE);
            f.appointments.failRemovals();
            AppointmentRequest move = request("later");
            move.setTimeslot(21);

            BookingException e = assertFails(BookingError.INTERNAL,
                    () -> f.coordinator.updateAppointment(f.queue, booked, move, ALICE));

            assertThat(e.getDetails()).containsEntry("retryable", true)
                    .containsEntry("appointment_id", booked.getId())
                    .containsKey("new_appointment_id");
            assertThat(f.appointments.all())
                    .filteredOn(a -> ALICE.equals(a.getStudentEmail()))
                    .extracting(AppointmentSlot::getTimeslot)
                    .containsExactlyInAnyOrder(20, 21);
        }

        @Test
        void failedCreateKeepsOriginalBooking() {
            AppointmentSlot booked = f.signup(SUNDAY, 20, ALICE);
            f.appointments.failInserts();
            AppointmentRequest move = request("later");
            move.setTimeslot(21);

            BookingException e = assertFails(BookingError.INTERNAL,
                    () -> f.coordinator.updateAppointment(f.queue, booked, move, ALICE));

            assertThat(e.getMessage()).doesNotContain("simulated");
            List<AppointmentSlot> all = f.appointments.all();
            assertThat(all).hasSize(1);
            assertThat(all.get(0).getStudentEmail()).isEqualTo(ALICE);
            assertThat(all.get(0).getTimeslot()).isEqualTo(20);
        }
    }

    @Nested
    class Schedule {

        private final ScheduleRequest wednesday = ScheduleRequest.builder().duration(15).schedule("1234").build();

        @Test
        void onlyAdminsMayReplaceSchedule() {
            assertFails(BookingError.FORBIDDEN,
                    () -> f.coordinator.updateAppointmentSchedule(f.queue, 3, wednesday, false));
        }

        @Test
        void replacesScheduleWhenDayHasNoAppointments() {
            AppointmentSchedule saved = f.coordinator.updateAppointmentSchedule(f.queue, 3, wednesday, true);

            assertThat(saved.getSchedule()).isEqualTo("1234");
            assertThat(f.scheduleService.scheduleForDay(f.queue, 3).getDuration()).isEqualTo(15);
        }

        @Test
        void scheduleIsFrozenWhileAppointmentsExist() {
            f.signup(TUESDAY, 0, ALICE);
            ScheduleRequest change = ScheduleRequest.builder().duration(30).schedule("9999").build();

            BookingException e = assertFails(BookingError.CONFLICT,
                    () -> f.coordinator.updateAppointmentSchedule(f.queue, TUESDAY, change, true));

            assertThat(e.getDetails()).containsEntry("appointments", 1L);
            assertThat(f.scheduleService.scheduleForDay(f.queue, TUESDAY).getSchedule()).isEqualTo("2110");
        }

        @Test
        void vacatedAppointmentsStillFreezeSchedule() {
            AppointmentSlot booked = f.signup(TUESDAY, 0, ALICE);
            f.coordinator.removeAppointmentSignup(booked, ALICE);

            assertFails(BookingError.CONFLICT, () -> f.coordinator.updateAppointmentSchedule(f.queue, TUESDAY,
                    ScheduleRequest.builder().duration(30).schedule("1").build(), true));
        }

        @Test
        void concurrentFirstTimeCreationIsConflict() {
            f.schedules.duplicateOnNextReplace();

            assertFails(BookingError.CONFLICT, () -> f.coordinator.updateAppointmentSchedule(f.queue, 3, wednesday, true));
            assertThat(f.coordinator.updateAppointmentSchedule(f.queue, 3, wednesday, true).getSchedule()).isEqualTo("1234");
        }

        @Test
        void malformedScheduleIsBadRequest() {
            assertFails(BookingError.BAD_REQUEST, () -> f.coordinator.updateAppointmentSchedule(f.queue, 3,
                    ScheduleRequest.builder().duration(30).schedule("21a0").build(), true));
            assertFails(BookingError.BAD_REQUEST, () -> f.coordinator.updateAppointmentSchedule(f.queue, 3,
                    ScheduleRequest.builder().duration(0).schedule("2110").build(), true));
        }
    }

    @Nested
    class Claim {

        @Test
        void claimsOpenTemplatedSlot() {
            f.slotService.openTemplatedSlots(f.queue, TUESDAY, request("drop-in"), true);

            AppointmentSlot claimed = f.coordinator.claimTimeslot(f.queue, TUESDAY, 1, ALICE);

            assertThat(claimed.getStudentEmail()).isEqualTo(ALICE);
            assertThat(claimed.getDescription()).isEqualTo("drop-in");
            assertThat(f.claimedAt(TUESDAY, 1)).isEqualTo(1);
        }

        @Test
        void claimingTakenTimeslotIsConflict() {
            f.slotService.openTemplatedSlots(f.queue, TUESDAY, request("drop-in"), true);
            f.coordinator.claimTimeslot(f.queue, TUESDAY, 1, ALICE);

            assertFails(BookingError.CONFLICT, () -> f.coordinator.claimTimeslot(f.queue, TUESDAY, 1, BOB));
        }

        @Test
        void vacatedSignupIsNeverHandedToAnotherStudent() {
            AppointmentSlot alices = f.coordinator.signupForAppointment(f.queue, TUESDAY, 1,
                    request("my grade appeal"), ALICE);
            f.coordinator.removeAppointmentSignup(alices, ALICE);

            assertFails(BookingError.CONFLICT, () -> f.coordinator.claimTimeslot(f.queue, TUESDAY, 1, CAROL));
            assertThat(f.appointments.findAppointment(alices.getId()).orElseThrow().isClaimed()).isFalse();
        }

        @Test
        void editedTemplatedSlotIsReplacedNotReoffered() {
            f.slotService.openTemplatedSlots(f.queue, TUESDAY, request("drop-in"), true);
            AppointmentSlot alices = f.coordinator.claimTimeslot(f.queue, TUESDAY, 1, ALICE);
            AppointmentRequest edit = request("my grade appeal");
            f.coordinator.updateAppointment(f.queue, alices, edit, ALICE);
            f.coordinator.removeAppointmentSignup(alices, ALICE);

            assertFails(BookingError.CONFLICT, () -> f.coordinator.claimTimeslot(f.queue, TUESDAY, 1, CAROL));

            f.slotService.openTemplatedSlots(f.queue, TUESDAY, request("drop-in"), true);
            AppointmentSlot carols = f.coordinator.claimTimeslot(f.queue, TUESDAY, 1, CAROL);
            assertThat(carols.getId()).isNotEqualTo(alices.getId());
            assertThat(carols.getDescription()).isEqualTo("drop-in");
        }

        @Test
        void claimWithoutTemplatedSlotIsConflict() {
            assertFails(BookingError.CONFLICT, () -> f.coordinator.claimTimeslot(f.queue, TUESDAY, 0, ALICE));
        }
    }

    @Nested
    class Unclaim {

        @Test
        void adminVacatesAnyClaim() {
            AppointmentSlot booked = f.signup(TUESDAY, 0, ALICE);

            assertThat(f.coordinator.unclaimAppointment(f.queue, booked, ADMIN, true)).isEqualTo(RemovalOutcome.REMOVED);
            assertThat(f.claimedAt(TUESDAY, 0)).isZero();
        }

        @Test
        void adminMayVacatePastClaims() {
            AppointmentSlot past = f.appointments.put(AppointmentSlot.builder()
                    .queueId(f.queue.getId())
                    .timeslot(14)
                    .scheduledTime(Instant.parse("2026-10-18T07:00:00Z"))
                    .duration(30)
                    .studentEmail(ALICE)
                    .build());

            assertThat(f.coordinator.unclaimAppointment(f.queue, past, ADMIN, true)).isEqualTo(RemovalOutcome.REMOVED);
        }

        @Test
        void studentsCannotUnclaim() {
            AppointmentSlot booked = f.signup(TUESDAY, 0, ALICE);

            assertFails(BookingError.FORBIDDEN, () -> f.coordinator.unclaimAppointment(f.queue, booked, ALICE, false));
            assertThat(f.claimedAt(TUESDAY, 0)).isEqualTo(1);
        }

        @Test
        void openAppointmentIsLeftAlone() {
            AppointmentSlot booked = f.signup(TUESDAY, 0, ALICE);
            f.coordinator.removeAppointmentSignup(booked, ALICE);
            AppointmentSlot vacated = f.appointments.findAppointment(booked.getId()).orElseThrow();

            assertThat(f.coordinator.unclaimAppointment(f.queue, vacated, ADMIN, true))
                    .isEqualTo(RemovalOutcome.ALREADY_REMOVED);
            assertThat(f.appointments.removals()).isEqualTo(1);
        }
    }

    @Nested
    class Reads {

        @Test
        void adminsSeeEveryAppointmentOthersOnlyTheirOwn() {
            f.signup(TUESDAY, 0, ALICE);
            f.signup(TUESDAY, 0, BOB);

            assertThat(f.coordinator.appointmentsForDay(f.queue, TUESDAY, ADMIN, true)).hasSize(2);
            assertThat(f.coordinator.appointmentsForDay(f.queue, TUESDAY, ALICE, false))
                    .extracting(AppointmentSlot::getStudentEmail)
                    .containsExactly(ALICE);
            assertThat(f.coordinator.appointmentsForUser(f.queue, SUNDAY, ALICE)).isEmpty();
        }
    }
}
