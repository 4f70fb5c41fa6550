package com.jreinhal.haven.security;

import com.jreinhal.haven.model.Role;
import com.jreinhal.haven.model.User;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Signs session credentials.
 *
 * The role's permission set is flattened into the {@code permissions} claim so that
 * authorization needs no further lookup for the lifetime of the token.
 */
@Component
public class TokenIssuer {
    private static final Logger log = LoggerFactory.getLogger(TokenIssuer.class);

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_PERMISSIONS = "permissions";
    static final String CLAIM_TIER = "tier";

    private final JwtKeyProvider keyProvider;

    @Value("${app.jwt.validity:7d}")
    private Duration validity;

    @Value("${app.jwt.issuer:haven}")
    private String issuer;

    public TokenIssuer(JwtKeyProvider keyProvider) {
        this.keyProvider = keyProvider;
    }

    public IssuedToken issue(User user, Role role) {
        Instant issuedAt = Instant.now();
        Instant expiresAt = issuedAt.plus(validity);
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject(user.getId())
                .issuer(issuer)
                .jwtID(UUID.randomUUID().toString())
                .issueTime(Date.from(issuedAt))
                .expirationTime(Date.from(expiresAt))
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_ROLE, role.getName())
                .claim(CLAIM_PERMISSIONS, new ArrayList<>(role.getPermissions()))
                .claim(CLAIM_TIER, role.getTier() != null ? role.getTier().name() : null)
                .build();
        JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.HS256).type(JOSEObjectType.JWT).build();
        SignedJWT jwt = new SignedJWT(header, claims);
        try {
            jwt.sign(new MACSigner(keyProvider.getSecret()));
        } catch (JOSEException e) {
            throw new IllegalStateException("Unable to sign session token", e);
        }
        log.debug("Issued token for subject {} (role={}, expires={})", user.getId(), role.getName(), expiresAt);
        return new IssuedToken(jwt.serialize(), issuedAt, expiresAt);
    }

    public Duration getValidity() {
        return validity;
    }

    public record IssuedToken(String token, Instant issuedAt, Instant expiresAt) {
    }
}
