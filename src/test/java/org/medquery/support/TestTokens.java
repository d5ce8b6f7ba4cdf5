package org.medquery.support;

import com.nimbusds.jose.jwk.source.ImmutableSecret;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

/**
 * Mints HS256 credentials with a fixed test key.
 */
public final class TestTokens {

    public static final SecretKey KEY = key("test-signing-secret-that-is-long-enough-0123");
    public static final SecretKey OTHER_KEY = key("another-signing-secret-that-is-long-enough-9");

    private TestTokens() {
    }

    public static JwtDecoder decoder() {
        return NimbusJwtDecoder.withSecretKey(KEY).macAlgorithm(MacAlgorithm.HS256).build();
    }

    public static JwtEncoder encoder(SecretKey key) {
        return new NimbusJwtEncoder(new ImmutableSecret<>(key));
    }

    public static String token(String subject, String role) {
        return token(KEY, subject, role, Instant.now().plus(Duration.ofHours(1)));
    }

    public static String token(SecretKey key, String subject, String role, Instant expiresAt) {
        JwtClaimsSet.Builder claims = JwtClaimsSet.builder()
                .issuer("medquery")
                .issuedAt(expiresAt.minus(Duration.ofHours(8)))
                .expiresAt(expiresAt);
        if (subject != null) {
            claims.subject(subject);
        }
        if (role != null) {
            claims.claim("role", role);
        }
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        return encoder(key).encode(JwtEncoderParameters.from(header, claims.build())).getTokenValue();
    }

    private static SecretKey key(String secret) {
        return new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
    }
}
