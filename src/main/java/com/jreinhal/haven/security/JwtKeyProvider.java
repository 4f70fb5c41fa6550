package com.jreinhal.haven.security;

import jakarta.annotation.PostConstruct;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the HMAC secret shared by {@link TokenIssuer} and {@link JwtValidator}.
 *
 * Configuration:
 * - app.jwt.secret: at least 32 bytes (HS256)
 * - app.jwt.allow-generated-secret: generate a per-process secret when none is set
 */
@Component
public class JwtKeyProvider {
    private static final Logger log = LoggerFactory.getLogger(JwtKeyProvider.class);
    static final int MIN_SECRET_BYTES = 32;

    @Value("${app.jwt.secret:}")
    private String secret;

    @Value("${app.jwt.allow-generated-secret:false}")
    private boolean allowGeneratedSecret;

    private byte[] secretBytes;

    @PostConstruct
    public void init() {
        byte[] configured = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (configured.length >= MIN_SECRET_BYTES) {
            this.secretBytes = configured;
            return;
        }
        if (!allowGeneratedSecret) {
            throw new IllegalStateException("app.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        log.warn("=================================================================");
        log.warn("  JWT secret missing or too short. Using a generated secret.");
        log.warn("  Tokens will not survive a restart. Set app.jwt.secret.");
        log.warn("=================================================================");
        byte[] generated = new byte[MIN_SECRET_BYTES * 2];
        new SecureRandom().nextBytes(generated);
        this.secretBytes = generated;
    }

    public byte[] getSecret() {
        if (secretBytes == null) {
            throw new IllegalStateException("JWT key provider not initialised");
        }
        return Arrays.copyOf(secretBytes, secretBytes.length);
    }
}
