package com.mamacare.appointments.policy;

import com.mamacare.appointments.entity.AppointmentStatus;
import com.mamacare.appointments.entity.UserRole;
import com.mamacare.appointments.exception.InvalidTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.mamacare.appointments.entity.AppointmentStatus.*;

/**
 * Legal status transitions and the role allowed to apply each one.
 *
 * <pre>
 * pending    -> confirmed   doctor
 * pending    -> declined    doctor
 * pending    -> cancelled   patient
 * confirmed  -> cancelled   patient
 * scheduled  -> cancelled   patient
 * confirmed  -> scheduled   doctor, nurse
 * confirmed  -> completed   doctor
 * scheduled  -> completed   doctor
 * </pre>
 *
 * Terminal statuses (completed, cancelled, declined) have no outgoing transitions. Moving to the
 * current status is not a transition.
 */
public final class StatusPolicy {

    private static final Map<AppointmentStatus, Map<AppointmentStatus, Set<UserRole>>> TRANSITIONS =
            new EnumMap<>(AppointmentStatus.class);

    private static final Set<UserRole> RESCHEDULERS =
            Collections.unmodifiableSet(EnumSet.of(UserRole.PATIENT, UserRole.DOCTOR));

    static {
        allow(PENDING, CONFIRMED, UserRole.DOCTOR);
        allow(PENDING, DECLINED, UserRole.DOCTOR);
        allow(PENDING, CANCELLED, UserRole.PATIENT);
        allow(CONFIRMED, CANCELLED, UserRole.PATIENT);
        allow(SCHEDULED, CANCELLED, UserRole.PATIENT);
        allow(CONFIRMED, SCHEDULED, UserRole.DOCTOR, UserRole.NURSE);
        allow(CONFIRMED, COMPLETED, UserRole.DOCTOR);
        allow(SCHEDULED, COMPLETED, UserRole.DOCTOR);
    }

    private StatusPolicy() {
    }

    private static void allow(AppointmentStatus from, AppointmentStatus to, UserRole first, UserRole... rest) {
        TRANSITIONS.computeIfAbsent(from, k -> new EnumMap<>(AppointmentStatus.class))
                .put(to, Collections.unmodifiableSet(EnumSet.of(first, rest)));
    }

    public static boolean isAllowed(AppointmentStatus from, AppointmentStatus to, UserRole role) {
        if (from == null || to == null || role == null) return false;
        Map<AppointmentStatus, Set<UserRole>> targets = TRANSITIONS.get(from);
        if (targets == null) return false;
        Set<UserRole> roles = targets.get(to);
        return roles != null && roles.contains(role);
    }

    /**
     * @throws InvalidTransitionException if {@code role} may not move a record from {@code from} to {@code to}
     */
    public static void checkTransition(AppointmentStatus from, AppointmentStatus to, UserRole role) {
        if (!isAllowed(from, to, role)) {
            throw new InvalidTransitionException(from, to, role);
        }
    }

    /** Statuses {@code role} may move a record in {@code from} to. */
    public static Set<AppointmentStatus> allowedTargets(AppointmentStatus from, UserRole role) {
        Set<AppointmentStatus> result = EnumSet.noneOf(AppointmentStatus.class);
        Map<AppointmentStatus, Set<UserRole>> targets = TRANSITIONS.get(from);
        if (targets != null) {
            targets.forEach((to, roles) -> {
                if (roles.contains(role)) result.add(to);
            });
        }
        return result;
    }

    public static boolean canBeApprovedOrDeclined(AppointmentStatus status) {
        return status == PENDING;
    }

    public static boolean canBeCancelled(AppointmentStatus status) {
        return status == PENDING || status == CONFIRMED || status == SCHEDULED;
    }

    public static boolean canBeCompletedByDoctor(AppointmentStatus status) {
        return status == CONFIRMED || status == SCHEDULED;
    }

    public static boolean canBeRescheduled(AppointmentStatus status) {
        return status == PENDING || status == CONFIRMED || status == SCHEDULED;
    }

    /** Only terminal records may be purged. */
    public static boolean canBeDeletedByDoctor(AppointmentStatus status) {
        return status == COMPLETED || status == CANCELLED || status == DECLINED;
    }

    public static boolean canReschedule(AppointmentStatus status, UserRole role) {
        return canBeRescheduled(status) && RESCHEDULERS.contains(role);
    }

    public static boolean canAssignNurse(AppointmentStatus status, UserRole role) {
        return role == UserRole.DOCTOR && status != null && !status.isTerminal();
    }
}
