package org.medquery.security;

import org.medquery.models.enums.Role;

/**
 * Authenticated caller for the duration of one request.
 */
public record Principal(String subject, Role role) {

    public boolean hasRole(Role candidate) {
        return role == candidate;
    }
}
