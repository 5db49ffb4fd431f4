package com.mamacare.appointments.entity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AppointmentStatusTest {

    private final AppointmentStatusConverter converter = new AppointmentStatusConverter();

    @Test
    public void testUnknownValuesDecodeToPending() {
        assertEquals(AppointmentStatus.PENDING, AppointmentStatus.fromString(null));
        assertEquals(AppointmentStatus.PENDING, AppointmentStatus.fromString(""));
        assertEquals(AppointmentStatus.PENDING, AppointmentStatus.fromString("declined_doctor"));
        assertEquals(AppointmentStatus.PENDING, converter.convertToEntityAttribute("archived"));
    }

    @Test
    public void testKnownValuesDecodeCaseInsensitively() {
        assertEquals(AppointmentStatus.CONFIRMED, AppointmentStatus.fromString("confirmed"));
        assertEquals(AppointmentStatus.DECLINED, AppointmentStatus.fromString(" Declined "));
        assertEquals(AppointmentStatus.COMPLETED, converter.convertToEntityAttribute("COMPLETED"));
    }

    @Test
    public void testStrictParseRejectsUnknown() {
        assertNull(AppointmentStatus.parseOrNull("archived"));
        assertNull(AppointmentStatus.parseOrNull(" "));
        assertEquals(AppointmentStatus.SCHEDULED, AppointmentStatus.parseOrNull("scheduled"));
    }

    @Test
    public void testDatabaseColumnIsLowerCase() {
        assertEquals("cancelled", converter.convertToDatabaseColumn(AppointmentStatus.CANCELLED));
        assertEquals("pending", converter.convertToDatabaseColumn(null));
    }
}
