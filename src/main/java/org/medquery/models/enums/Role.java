package org.medquery.models.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Role {
    DOCTOR,
    ADMIN;

    public String claimValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Role> fromClaim(Object claim) {
        if (claim == null) {
            return Optional.empty();
        }
        String value = claim.toString().trim();
        return Arrays.stream(values())
                .filter(role -> role.claimValue().equalsIgnoreCase(value))
                .findFirst();
    }
}
