package org.medquery.security;

import org.junit.jupiter.api.Test;
import org.medquery.exceptions.ForbiddenException;
import org.medquery.exceptions.UnauthorizedException;
import org.medquery.models.enums.Role;
import org.medquery.support.TestTokens;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AccessGateTest {

    private static final Set<Role> ADMIN_ONLY = EnumSet.of(Role.ADMIN);
    private static final Set<Role> CLINICAL = EnumSet.of(Role.DOCTOR, Role.ADMIN);

    private final AccessGate accessGate = new AccessGate(TestTokens.decoder());

    @Test
    void validCredentialWithAllowedRoleYieldsPrincipal() {
        Principal principal = accessGate.authorize(TestTokens.token("doctor", "doctor"), CLINICAL);

        assertEquals(new Principal("doctor", Role.DOCTOR), principal);
    }

    @Test
    void missingCredentialIsUnauthorized() {
        assertThrows(UnauthorizedException.class, () -> accessGate.authorize(null, CLINICAL));
        assertThrows(UnauthorizedException.class, () -> accessGate.authorize("  ", CLINICAL));
    }

    @Test
    void garbageCredentialIsUnauthorized() {
        assertThrows(UnauthorizedException.class, () -> accessGate.authorize("not-a-token", CLINICAL));
    }

    @Test
    void expiredCredentialIsUnauthorized() {
        String expired = TestTokens.token(TestTokens.KEY, "admin", "admin", Instant.now().minus(Duration.ofHours(2)));

        assertThrows(UnauthorizedException.class, () -> accessGate.authorize(expired, ADMIN_ONLY));
    }

    @Test
    void credentialSignedWithAnotherKeyIsUnauthorized() {
        String forged = TestTokens.token(TestTokens.OTHER_KEY, "admin", "admin", Instant.now().plus(Duration.ofHours(1)));

        assertThrows(UnauthorizedException.class, () -> accessGate.authorize(forged, ADMIN_ONLY));
    }

    @Test
    void credentialWithoutSubjectIsUnauthorized() {
        String anonymous = TestTokens.token(TestTokens.KEY, null, "admin", Instant.now().plus(Duration.ofHours(1)));

        assertThrows(UnauthorizedException.class, () -> accessGate.authorize(anonymous, ADMIN_ONLY));
    }

    @Test
    void disallowedRoleIsForbidden() {
        String doctor = TestTokens.token("doctor", "doctor");

        assertThrows(ForbiddenException.class, () -> accessGate.authorize(doctor, ADMIN_ONLY));
    }

    @Test
    void missingOrUnknownRoleIsForbidden() {
        assertThrows(ForbiddenException.class, () -> accessGate.authorize(TestTokens.token("nurse", null), CLINICAL));
        assertThrows(ForbiddenException.class, () -> accessGate.authorize(TestTokens.token("nurse", "nurse"), CLINICAL));
    }
}
