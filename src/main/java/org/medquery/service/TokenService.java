package org.medquery.service;

import org.medquery.configuration.MedQueryProperties;
import org.medquery.models.entity.ApplicationUser;
import org.medquery.security.AccessGate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

@Service
public class TokenService {

    private final JwtEncoder jwtEncoder;
    private final String issuer;
    private final Duration tokenTtl;

    public TokenService(JwtEncoder jwtEncoder,
                        MedQueryProperties properties,
                        @Value("${medquery.security.issuer:medquery}") String issuer) {
        this.jwtEncoder = jwtEncoder;
        this.issuer = issuer;
        this.tokenTtl = properties.getSecurity().getTokenTtl();
    }

    public String generateJwt(ApplicationUser user) {
        Instant now = Instant.now();

        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(issuer)
                .issuedAt(now)
                .expiresAt(now.plus(tokenTtl))
                .subject(user.getUsername())
                .id(UUID.randomUUID().toString())
                .claim(AccessGate.ROLE_CLAIM, user.getRole().claimValue())
                .claim("name", user.getFullName() == null ? user.getUsername() : user.getFullName())
                .build();

        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        return jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
    }
}
