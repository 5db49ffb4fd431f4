package com.mamacare.appointments.directory;

import com.mamacare.appointments.entity.UserAccount;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class DoctorSummary {

    private final String id;
    private final String name;
    private final String specialty;

    public static DoctorSummary from(UserAccount account) {
        return new DoctorSummary(account.getId(), account.getName(), account.getSpecialty());
    }
}
