package com.mamacare.appointments.controller;

import com.mamacare.appointments.directory.DoctorDirectory;
import com.mamacare.appointments.directory.DoctorSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/doctors")
public class DoctorController {

    private final DoctorDirectory doctorDirectory;

    public DoctorController(DoctorDirectory doctorDirectory) {
        this.doctorDirectory = doctorDirectory;
    }

    @GetMapping
    public ResponseEntity<List<DoctorSummary>> available(@RequestParam(required = false) String specialty) {
        return ResponseEntity.ok(doctorDirectory.listAvailable(specialty));
    }
}
