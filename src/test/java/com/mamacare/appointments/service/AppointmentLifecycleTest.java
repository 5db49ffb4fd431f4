package com.mamacare.appointments.service;

import com.mamacare.appointments.auth.Actor;
import com.mamacare.appointments.entity.Appointment;
import com.mamacare.appointments.entity.AppointmentStatus;
import com.mamacare.appointments.entity.UserRole;
import com.mamacare.appointments.exception.AppointmentException;
import com.mamacare.appointments.exception.AuthException;
import com.mamacare.appointments.exception.InvalidTransitionException;
import com.mamacare.appointments.exception.NotFoundException;
import com.mamacare.appointments.exception.NotificationException;
import com.mamacare.appointments.exception.StoreException;
import com.mamacare.appointments.exception.ValidationException;
import com.mamacare.appointments.exception.VersionConflictException;
import com.mamacare.appointments.notification.AppointmentNotifier;
import com.mamacare.appointments.support.AppointmentFixtures;
import com.mamacare.appointments.support.RecordingNotificationGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.mamacare.appointments.support.AppointmentFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the real service against the in-memory store, end to end through the lifecycle.
 */
public class AppointmentLifecycleTest {

    private static final Set<String> LEGAL = Set.of(
            "PENDING>CONFIRMED:DOCTOR",
            "PENDING>DECLINED:DOCTOR",
            "PENDING>CANCELLED:PATIENT",
            "CONFIRMED>CANCELLED:PATIENT",
            "SCHEDULED>CANCELLED:PATIENT",
            "CONFIRMED>SCHEDULED:DOCTOR",
            "CONFIRMED>SCHEDULED:NURSE",
            "CONFIRMED>COMPLETED:DOCTOR",
            "SCHEDULED>COMPLETED:DOCTOR"
    );

    private AppointmentFixtures fixtures;
    private AppointmentService service;
    private ExecutorService pool;

    @BeforeEach
    public void setUp() {
        fixtures = new AppointmentFixtures();
        service = fixtures.service;
        pool = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    public void tearDown() {
        pool.shutdownNow();
    }

    private static Actor participant(UserRole role) {
        switch (role) {
            case PATIENT:
                return patient();
            case DOCTOR:
                return doctor();
            default:
                return nurse();
        }
    }

    @Test
    public void testEveryTransitionThroughServiceMatchesTable() {
        UserRole[] roles = {UserRole.PATIENT, UserRole.DOCTOR, UserRole.NURSE};
        for (AppointmentStatus from : AppointmentStatus.values()) {
            for (AppointmentStatus to : AppointmentStatus.values()) {
                for (UserRole role : roles) {
                    Appointment before = fixtures.seed(from);
                    String label = from + " -> " + to + " as " + role;

                    if (LEGAL.contains(from + ">" + to + ":" + role)) {
                        Appointment after = service.setStatus(before.getId(), to, participant(role));
                        assertEquals(to, after.getStatus(), label);
                        assertEquals(before.getVersion() + 1, after.getVersion(), label);
                    } else {
                        assertThrows(InvalidTransitionException.class,
                                () -> service.setStatus(before.getId(), to, participant(role)), label);
                        Appointment unchanged = fixtures.store.get(before.getId());
                        assertEquals(before, unchanged, label);
                    }
                }
            }
        }
    }

    @Test
    public void testCreateThenGetRoundTrip() {
        Appointment created = fixtures.request("Prenatal checkup", TOMORROW_10);

        Appointment loaded = service.getAppointment(created.getId(), patient());

        assertEquals(created, loaded);
        assertEquals(AppointmentStatus.PENDING, loaded.getStatus());
        assertEquals("Ada Nwosu", loaded.getPatientName());
        assertEquals("Amina Okafor", loaded.getDoctorName());
        assertEquals(NOW, loaded.getCreatedAt());
        assertEquals(NOW, loaded.getUpdatedAt());
        assertNotNull(loaded.getId());
    }

    @Test
    public void testRequestNotifiesDoctorOnly() {
        Appointment created = fixtures.request("Prenatal checkup", TOMORROW_10);

        List<RecordingNotificationGateway.Sent> sent = fixtures.gateway.all();
        assertEquals(1, sent.size());
        assertEquals(DOCTOR, sent.get(0).target);
        assertEquals("New Appointment Request", sent.get(0).title);
        assertEquals(AppointmentNotifier.TYPE_REQUEST, sent.get(0).data.get("type"));
        assertEquals(String.valueOf(created.getId()), sent.get(0).data.get("appointmentId"));
    }

    @Test
    public void testConcurrentConfirmAndDeclineLeaveOneWinner() throws Exception {
        Appointment pending = fixtures.seed(AppointmentStatus.PENDING);
        fixtures.store.holdFirstReads(2);

        Callable<Appointment> confirm = () -> service.setStatus(pending.getId(), AppointmentStatus.CONFIRMED, doctor());
        Callable<Appointment> decline = () -> service.setStatus(pending.getId(), AppointmentStatus.DECLINED, doctor());
        List<Future<Appointment>> futures = new ArrayList<>();
        futures.add(pool.submit(confirm));
        futures.add(pool.submit(decline));

        int successes = 0;
        List<Throwable> failures = new ArrayList<>();
        for (Future<Appointment> future : futures) {
            try {
                future.get(10, TimeUnit.SECONDS);
                successes++;
            } catch (ExecutionException e) {
                failures.add(e.getCause());
            }
        }

        assertEquals(1, successes);
        assertEquals(1, failures.size());
        assertInstanceOf(InvalidTransitionException.class, failures.get(0));

        Appointment stored = fixtures.store.get(pending.getId());
        assertTrue(stored.getStatus() == AppointmentStatus.CONFIRMED
                || stored.getStatus() == AppointmentStatus.DECLINED);
        assertEquals(1L, stored.getVersion());
        assertEquals(2, fixtures.store.updateCalls());
    }

    @Test
    public void testSingleRetryAfterVersionConflict() {
        Appointment pending = fixtures.seed(AppointmentStatus.PENDING);
        fixtures.store.failNextUpdate(new VersionConflictException(pending.getId()));

        Appointment confirmed = service.setStatus(pending.getId(), AppointmentStatus.CONFIRMED, doctor());

        assertEquals(AppointmentStatus.CONFIRMED, confirmed.getStatus());
        assertEquals(2, fixtures.store.updateCalls());
    }

    @Test
    public void testStoreFailureLeavesRecordAndSkipsNotification() {
        Appointment pending = fixtures.seed(AppointmentStatus.PENDING);
        fixtures.store.failNextUpdate(new StoreException(StoreException.RETRY_MESSAGE));

        StoreException e = assertThrows(StoreException.class,
                () -> service.setStatus(pending.getId(), AppointmentStatus.CONFIRMED, doctor()));

        assertEquals(StoreException.RETRY_MESSAGE, e.getMessage());
        assertEquals(pending, fixtures.store.get(pending.getId()));
        assertTrue(fixtures.gateway.all().isEmpty());
    }

    @Test
    public void testSameStatusIsRejected() {
        Appointment confirmed = fixtures.seed(AppointmentStatus.CONFIRMED);

        assertThrows(InvalidTransitionException.class,
                () -> service.setStatus(confirmed.getId(), AppointmentStatus.CONFIRMED, doctor()));
        assertEquals(0, fixtures.store.updateCalls());
    }

    @Test
    public void testDeleteOnlyTerminalRecords() {
        for (AppointmentStatus status : AppointmentStatus.values()) {
            Appointment record = fixtures.seed(status);
            int sizeBefore = fixtures.store.size();

            if (status.isTerminal()) {
                service.deleteAppointment(record.getId(), doctor());
                assertEquals(sizeBefore - 1, fixtures.store.size(), status.name());
                assertThrows(NotFoundException.class, () -> fixtures.store.get(record.getId()));
            } else {
                assertThrows(InvalidTransitionException.class,
                        () -> service.deleteAppointment(record.getId(), doctor()), status.name());
                assertEquals(sizeBefore, fixtures.store.size(), status.name());
                assertEquals(record, fixtures.store.get(record.getId()));
            }
        }
    }

    @Test
    public void testOtherDoctorCannotDelete() {
        Appointment completed = fixtures.seed(AppointmentStatus.COMPLETED);

        assertThrows(AuthException.class,
                () -> service.deleteAppointment(completed.getId(), Actor.doctor(OTHER_DOCTOR)));
        assertEquals(1, fixtures.store.size());
    }

    @Test
    public void testPatientCannotCancelCompleted() {
        Appointment completed = fixtures.seed(AppointmentStatus.COMPLETED);

        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                () -> service.setStatus(completed.getId(), AppointmentStatus.CANCELLED, patient()));

        assertEquals(AppointmentStatus.COMPLETED, e.getFrom());
        assertEquals(AppointmentStatus.COMPLETED, fixtures.store.get(completed.getId()).getStatus());
    }

    @Test
    public void testOwnershipCheckedBeforeTransition() {
        Appointment completed = fixtures.seed(AppointmentStatus.COMPLETED);

        assertThrows(AuthException.class,
                () -> service.setStatus(completed.getId(), AppointmentStatus.CANCELLED, Actor.patient(OTHER_PATIENT)));
    }

    @Test
    public void testNurseMustBeAssigned() {
        Appointment confirmed = fixtures.seed(AppointmentStatus.CONFIRMED);

        assertThrows(AuthException.class,
                () -> service.setStatus(confirmed.getId(), AppointmentStatus.SCHEDULED, Actor.nurse("nurse-other")));

        Appointment scheduled = service.setStatus(confirmed.getId(), AppointmentStatus.SCHEDULED, nurse());
        assertEquals(AppointmentStatus.SCHEDULED, scheduled.getStatus());
    }

    @Test
    public void testNotificationFailureNeverReachesCaller() {
        Appointment pending = fixtures.seed(AppointmentStatus.PENDING);
        fixtures.gateway.failWith(new NotificationException("push backend down"));

        Appointment confirmed = service.setStatus(pending.getId(), AppointmentStatus.CONFIRMED, doctor());
        assertEquals(AppointmentStatus.CONFIRMED, confirmed.getStatus());

        fixtures.gateway.failWith(new IllegalStateException("boom"));
        Appointment completed = service.setStatus(pending.getId(), AppointmentStatus.COMPLETED, doctor());
        assertEquals(AppointmentStatus.COMPLETED, completed.getStatus());
    }

    @Test
    public void testDeclineNotifiesPatientWithReason() {
        Appointment pending = fixtures.seed(AppointmentStatus.PENDING);

        service.setStatus(pending.getId(), AppointmentStatus.DECLINED, doctor(), "Fully booked that day");

        List<RecordingNotificationGateway.Sent> sent = fixtures.gateway.all();
        assertEquals(1, sent.size());
        assertEquals(PATIENT, sent.get(0).target);
        assertEquals("Appointment Declined", sent.get(0).title);
        assertTrue(sent.get(0).body.startsWith("Your appointment with Dr. Amina Okafor"));
        assertTrue(sent.get(0).body.endsWith("Reason: Fully booked that day"));
        assertEquals("declined", sent.get(0).data.get("status"));
    }

    @Test
    public void testNurseActionNotifiesPatientAndDoctor() {
        Appointment confirmed = fixtures.seed(AppointmentStatus.CONFIRMED);

        service.setStatus(confirmed.getId(), AppointmentStatus.SCHEDULED, nurse());

        assertEquals(List.of(PATIENT, DOCTOR), fixtures.gateway.targets());
    }

    @Test
    public void testRescheduleKeepsStatus() {
        Appointment confirmed = fixtures.seed(AppointmentStatus.CONFIRMED);

        Appointment moved = service.reschedule(confirmed.getId(), later(Duration.ofDays(2)), patient());

        assertEquals(AppointmentStatus.CONFIRMED, moved.getStatus());
        assertEquals(later(Duration.ofDays(2)), moved.getDateTime());
        assertEquals(List.of(DOCTOR), fixtures.gateway.targets());
        assertEquals("Appointment Rescheduled", fixtures.gateway.all().get(0).title);
    }

    @Test
    public void testRescheduleResetPolicy() {
        AppointmentFixtures resetting = new AppointmentFixtures(ReschedulePolicy.RESET_TO_PENDING);
        Appointment patientConfirmed = resetting.seed(AppointmentStatus.CONFIRMED);
        Appointment moved = resetting.service.reschedule(patientConfirmed.getId(), later(Duration.ofHours(3)), patient());
        assertEquals(AppointmentStatus.PENDING, moved.getStatus());

        Appointment scheduled = resetting.seed(AppointmentStatus.SCHEDULED);
        Appointment stillScheduled = resetting.service.reschedule(scheduled.getId(), later(Duration.ofHours(2)), patient());
        assertEquals(AppointmentStatus.SCHEDULED, stillScheduled.getStatus());

        Appointment confirmed = resetting.seed(AppointmentStatus.CONFIRMED);
        Appointment doctorMoved = resetting.service.reschedule(confirmed.getId(), later(Duration.ofHours(3)), doctor());
        assertEquals(AppointmentStatus.CONFIRMED, doctorMoved.getStatus());
    }

    @Test
    public void testRescheduleTerminalIsRejected() {
        Appointment cancelled = fixtures.seed(AppointmentStatus.CANCELLED);

        assertThrows(InvalidTransitionException.class,
                () -> service.reschedule(cancelled.getId(), later(Duration.ofDays(1)), patient()));
    }

    @Test
    public void testRescheduleIntoPastIsValidationError() {
        Appointment pending = fixtures.seed(AppointmentStatus.PENDING);

        assertThrows(ValidationException.class,
                () -> service.reschedule(pending.getId(), NOW.minus(Duration.ofHours(1)), doctor()));
    }

    @Test
    public void testAssignNurseAndClear() {
        Appointment pending = fixtures.request("Scan", TOMORROW_10);
        fixtures.gateway.clear();

        Appointment assigned = service.assignNurse(pending.getId(), NURSE, doctor());
        assertEquals(NURSE, assigned.getNurseId());
        assertEquals(List.of(NURSE), fixtures.gateway.targets());
        assertEquals(1, service.listForRole(nurse(), null).size());

        assertThrows(ValidationException.class, () -> service.assignNurse(pending.getId(), NURSE, doctor()));
        assertThrows(ValidationException.class, () -> service.assignNurse(pending.getId(), "patient-mary", doctor()));
        assertThrows(AuthException.class, () -> service.assignNurse(pending.getId(), NURSE, patient()));

        Appointment cleared = service.assignNurse(pending.getId(), "", doctor());
        assertNull(cleared.getNurseId());
        assertTrue(service.listForRole(nurse(), null).isEmpty());
    }

    @Test
    public void testFullLifecycleScenario() {
        Appointment requested = fixtures.request("Prenatal checkup", TOMORROW_10);
        Long id = requested.getId();

        service.setStatus(id, AppointmentStatus.CONFIRMED, doctor());

        List<Appointment> confirmedForPatient = service.listForRole(patient(), AppointmentStatus.CONFIRMED);
        assertEquals(1, confirmedForPatient.size());
        assertEquals(id, confirmedForPatient.get(0).getId());
        assertTrue(service.listForRole(patient(), AppointmentStatus.PENDING).isEmpty());

        service.setStatus(id, AppointmentStatus.COMPLETED, doctor());

        assertEquals(1, service.listForRole(doctor(), AppointmentStatus.COMPLETED).size());
        assertTrue(service.listForRole(doctor(), AppointmentStatus.CONFIRMED).isEmpty());

        AppointmentException cancel = assertThrows(InvalidTransitionException.class,
                () -> service.setStatus(id, AppointmentStatus.CANCELLED, patient()));
        assertNotNull(cancel.getMessage());

        service.deleteAppointment(id, doctor());
        assertTrue(service.listForRole(doctor(), null).isEmpty());
        assertThrows(NotFoundException.class, () -> service.deleteAppointment(id, doctor()));
    }

    @Test
    public void testListsAreScopedAndOrdered() {
        fixtures.request("Later visit", later(Duration.ofDays(5)));
        fixtures.request("Sooner visit", later(Duration.ofDays(1)));
        service.requestAppointment(Actor.patient(OTHER_PATIENT), null, OTHER_DOCTOR, "Other", TOMORROW_10, null);

        List<Appointment> mine = service.listForRole(patient(), null);
        assertEquals(2, mine.size());
        assertEquals("Sooner visit", mine.get(0).getReason());
        assertEquals("Later visit", mine.get(1).getReason());

        assertEquals(2, service.listForRole(doctor(), null).size());
        assertEquals(1, service.listForRole(Actor.doctor(OTHER_DOCTOR), null).size());
        assertTrue(service.listForRole(nurse(), null).isEmpty());
    }
}
