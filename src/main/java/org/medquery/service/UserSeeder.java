package org.medquery.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.medquery.configuration.MedQueryProperties;
import org.medquery.models.enums.Role;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class UserSeeder implements ApplicationRunner {

    private final MedQueryProperties properties;
    private final UserService userService;

    @Override
    public void run(ApplicationArguments args) {
        MedQueryProperties.Seed seed = properties.getSeed();
        if (!seed.isEnabled()) {
            return;
        }
        for (MedQueryProperties.SeedUser user : seed.getUsers()) {
            if (!StringUtils.hasText(user.getUsername()) || !StringUtils.hasText(user.getPassword())) {
                log.warn("Skipping seed user without username or password");
                continue;
            }
            Role role = Role.fromClaim(user.getRole())
                    .orElseThrow(() -> new IllegalStateException("Unknown role for seed user " + user.getUsername()));
            userService.createIfAbsent(user.getUsername(), user.getPassword(), role, user.getFullName());
        }
    }
}
