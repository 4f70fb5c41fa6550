package com.jreinhal.haven.security;

import com.jreinhal.haven.model.CaseTier;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.time.Instant;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Verifies session credentials: signature, algorithm, expiry and issuer, then decodes the
 * claim snapshot. Purely in-memory; never touches the store.
 */
@Component
public class JwtValidator {
    private static final Logger log = LoggerFactory.getLogger(JwtValidator.class);
    private final JwtKeyProvider keyProvider;
    @Value("${app.jwt.issuer:haven}")
    private String expectedIssuer;
    @Value("${app.jwt.clock-skew-seconds:30}")
    private long clockSkewSeconds;

    public JwtValidator(JwtKeyProvider keyProvider) {
        this.keyProvider = keyProvider;
    }

    public ValidationResult validate(String token) {
        if (token == null || token.isEmpty()) {
            return ValidationResult.failure("Token is null or empty");
        }
        try {
            SignedJWT signedJWT = SignedJWT.parse(token);
            JWSAlgorithm algorithm = signedJWT.getHeader().getAlgorithm();
            if (!JWSAlgorithm.HS256.equals(algorithm)) {
                return ValidationResult.failure("Algorithm not allowed: " + algorithm);
            }
            if (!signedJWT.verify(new MACVerifier(keyProvider.getSecret()))) {
                return ValidationResult.failure("Signature verification failed");
            }
            JWTClaimsSet claims = signedJWT.getJWTClaimsSet();
            String claimsError = this.checkClaims(claims);
            if (claimsError != null) {
                return ValidationResult.failure(claimsError);
            }
            TokenClaims decoded = decode(claims);
            log.debug("JWT validated successfully for subject: {}", decoded.subjectId());
            return ValidationResult.success(decoded);
        } catch (ParseException e) {
            log.warn("Failed to parse JWT: {}", e.getMessage());
            return ValidationResult.failure("Invalid JWT format");
        } catch (JOSEException e) {
            log.error("JWT processing error: {}", e.getMessage());
            return ValidationResult.failure("JWT processing error");
        }
    }

    private String checkClaims(JWTClaimsSet claims) {
        Instant now = Instant.now();
        Date expirationTime = claims.getExpirationTime();
        if (expirationTime == null) {
            return "Token missing expiry";
        }
        if (now.isAfter(expirationTime.toInstant().plusSeconds(this.clockSkewSeconds))) {
            return "Token has expired";
        }
        Date issueTime = claims.getIssueTime();
        if (issueTime != null && now.isBefore(issueTime.toInstant().minusSeconds(this.clockSkewSeconds))) {
            return "Token issued in the future";
        }
        if (this.expectedIssuer != null && !this.expectedIssuer.isEmpty() && !this.expectedIssuer.equals(claims.getIssuer())) {
            return "Invalid issuer";
        }
        if (claims.getSubject() == null || claims.getSubject().isEmpty()) {
            return "Token missing subject claim";
        }
        return null;
    }

    private static TokenClaims decode(JWTClaimsSet claims) throws ParseException {
        List<String> permissions = claims.getStringListClaim(TokenIssuer.CLAIM_PERMISSIONS);
        String tierName = claims.getStringClaim(TokenIssuer.CLAIM_TIER);
        CaseTier tier = null;
        if (tierName != null) {
            try {
                tier = CaseTier.valueOf(tierName);
            } catch (IllegalArgumentException e) {
                throw new ParseException("Unknown tier claim: " + tierName, 0);
            }
        }
        return new TokenClaims(
                claims.getSubject(),
                claims.getStringClaim(TokenIssuer.CLAIM_EMAIL),
                claims.getStringClaim(TokenIssuer.CLAIM_ROLE),
                permissions == null ? null : new HashSet<>(permissions),
                tier,
                claims.getIssueTime() != null ? claims.getIssueTime().toInstant() : null,
                claims.getExpirationTime().toInstant());
    }

    public static class ValidationResult {
        private final boolean valid;
        private final TokenClaims claims;
        private final String error;

        private ValidationResult(boolean valid, TokenClaims claims, String error) {
            this.valid = valid;
            this.claims = claims;
            this.error = error;
        }

        public static ValidationResult success(TokenClaims claims) {
            return new ValidationResult(true, claims, null);
        }

        public static ValidationResult failure(String error) {
            return new ValidationResult(false, null, error);
        }

        public boolean isValid() {
            return this.valid;
        }

        public TokenClaims getClaims() {
            return this.claims;
        }

        public String getError() {
            return this.error;
        }
    }
}
