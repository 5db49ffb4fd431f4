package com.mamacare.appointments.config;

import com.mamacare.appointments.entity.UserAccount;
import com.mamacare.appointments.entity.UserRole;
import com.mamacare.appointments.repository.UserAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
@ConditionalOnProperty(name = "appointments.seed.enabled", havingValue = "true")
public class DataSeeder {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    @Bean
    CommandLineRunner seedAccounts(UserAccountRepository accountRepo) {
        return args -> {
            if (accountRepo.count() > 0) {
                log.info("Accounts already seeded, skipping");
                return;
            }

            List<UserAccount> accounts = List.of(
                    UserAccount.builder().id("dr-amina").name("Amina Okafor").role(UserRole.DOCTOR)
                            .specialty("Obstetrics").build(),
                    UserAccount.builder().id("dr-kwame").name("Kwame Mensah").role(UserRole.DOCTOR)
                            .specialty("Gynecology").build(),
                    UserAccount.builder().id("dr-lena").name("Lena Hart").role(UserRole.DOCTOR)
                            .specialty("Obstetrics").build(),
                    UserAccount.builder().id("nurse-joy").name("Joy Adeyemi").role(UserRole.NURSE).build(),
                    UserAccount.builder().id("patient-ada").name("Ada Nwosu").role(UserRole.PATIENT).build(),
                    UserAccount.builder().id("patient-mary").name("Mary Boateng").role(UserRole.PATIENT).build(),
                    UserAccount.builder().id("admin").name("Clinic Admin").role(UserRole.ADMIN).build()
            );
            accountRepo.saveAll(accounts);
            log.info("Seeded {} accounts", accounts.size());
        };
    }
}
