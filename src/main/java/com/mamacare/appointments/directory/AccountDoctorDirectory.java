package com.mamacare.appointments.directory;

import com.mamacare.appointments.entity.UserAccount;
import com.mamacare.appointments.entity.UserRole;
import com.mamacare.appointments.repository.UserAccountRepository;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
public class AccountDoctorDirectory implements DoctorDirectory {

    private final UserAccountRepository userAccountRepository;

    public AccountDoctorDirectory(UserAccountRepository userAccountRepository) {
        this.userAccountRepository = userAccountRepository;
    }

    @Override
    public boolean exists(String doctorId) {
        return find(doctorId).isPresent();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DoctorSummary> find(String doctorId) {
        if (StringUtils.isBlank(doctorId)) return Optional.empty();
        return userAccountRepository.findByIdAndRoleAndActiveTrue(doctorId, UserRole.DOCTOR)
                .map(DoctorSummary::from);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DoctorSummary> listAvailable(String specialtyFilter) {
        List<UserAccount> doctors = StringUtils.isBlank(specialtyFilter)
                ? userAccountRepository.findByRoleAndActiveTrueOrderByNameAsc(UserRole.DOCTOR)
                : userAccountRepository.findByRoleAndSpecialtyIgnoreCaseAndActiveTrueOrderByNameAsc(
                        UserRole.DOCTOR, specialtyFilter.trim());
        return doctors.stream()
                .map(DoctorSummary::from)
                .collect(Collectors.toList());
    }
}
