package org.medquery.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.medquery.models.entity.ApplicationUser;
import org.medquery.models.enums.Role;
import org.medquery.repository.UserRepository;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService implements UserDetailsService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Override
    @Transactional(readOnly = true)
    public UserDetails loadUserByUsername(String username) {
        return userRepository.findByUsername(username)
                .orElseThrow(() -> new UsernameNotFoundException(username));
    }

    /**
     * Creates the user unless the username is taken.
     *
     * @return true when a user was created
     */
    @Transactional
    public boolean createIfAbsent(String username, String password, Role role, String fullName) {
        if (userRepository.existsByUsername(username)) {
            return false;
        }
        userRepository.save(new ApplicationUser(username, passwordEncoder.encode(password), role, fullName));
        log.info("Created user {} ({})", username, role.claimValue());
        return true;
    }
}
