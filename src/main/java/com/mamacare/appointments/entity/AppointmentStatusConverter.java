package com.mamacare.appointments.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores statuses as their lower-case names and reads anything unrecognised back as pending.
 */
@Converter
public class AppointmentStatusConverter implements AttributeConverter<AppointmentStatus, String> {

    @Override
    public String convertToDatabaseColumn(AppointmentStatus status) {
        return status == null ? AppointmentStatus.PENDING.wireValue() : status.wireValue();
    }

    @Override
    public AppointmentStatus convertToEntityAttribute(String value) {
        return AppointmentStatus.fromString(value);
    }
}
