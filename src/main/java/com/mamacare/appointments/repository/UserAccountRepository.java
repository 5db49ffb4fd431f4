package com.mamacare.appointments.repository;

import com.mamacare.appointments.entity.UserAccount;
import com.mamacare.appointments.entity.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface UserAccountRepository extends JpaRepository<UserAccount, String> {

    Optional<UserAccount> findByIdAndActiveTrue(String id);

    Optional<UserAccount> findByIdAndRoleAndActiveTrue(String id, UserRole role);

    List<UserAccount> findByRoleAndActiveTrueOrderByNameAsc(UserRole role);

    List<UserAccount> findByRoleAndSpecialtyIgnoreCaseAndActiveTrueOrderByNameAsc(UserRole role, String specialty);
}
