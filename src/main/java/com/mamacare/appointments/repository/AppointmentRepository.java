package com.mamacare.appointments.repository;

import com.mamacare.appointments.entity.Appointment;
import com.mamacare.appointments.entity.AppointmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    List<Appointment> findByPatientIdOrderByDateTimeAsc(String patientId);

    List<Appointment> findByPatientIdAndStatusOrderByDateTimeAsc(String patientId, AppointmentStatus status);

    List<Appointment> findByDoctorIdOrderByDateTimeAsc(String doctorId);

    List<Appointment> findByDoctorIdAndStatusOrderByDateTimeAsc(String doctorId, AppointmentStatus status);

    List<Appointment> findByNurseIdOrderByDateTimeAsc(String nurseId);

    List<Appointment> findByNurseIdAndStatusOrderByDateTimeAsc(String nurseId, AppointmentStatus status);
}
