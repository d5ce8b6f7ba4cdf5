package org.medquery.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.medquery.exceptions.ForbiddenException;
import org.medquery.exceptions.UnauthorizedException;
import org.medquery.models.enums.Role;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class AccessGate {

    public static final String ROLE_CLAIM = "role";

    private final JwtDecoder jwtDecoder;

    /**
     * Verifies the credential and checks its role claim against {@code allowedRoles}.
     *
     * @throws UnauthorizedException when the credential is missing, malformed, expired or badly signed
     * @throws ForbiddenException    when the credential is valid but its role is not allowed
     */
    public Principal authorize(String credential, Set<Role> allowedRoles) {
        if (!StringUtils.hasText(credential)) {
            throw new UnauthorizedException("Missing credential");
        }

        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(credential.trim());
        } catch (JwtException exception) {
            log.debug("Rejected credential: {}", exception.getMessage());
            throw new UnauthorizedException("Session expired or invalid token", exception);
        }

        String subject = jwt.getSubject();
        if (!StringUtils.hasText(subject)) {
            throw new UnauthorizedException("Invalid token: missing subject");
        }

        Object roleClaim = jwt.getClaims().get(ROLE_CLAIM);
        Role role = Role.fromClaim(roleClaim).orElse(null);
        if (role == null || !allowedRoles.contains(role)) {
            throw new ForbiddenException("Access denied: " + roleClaim + " role does not have permission for this operation");
        }
        return new Principal(subject, role);
    }
}
