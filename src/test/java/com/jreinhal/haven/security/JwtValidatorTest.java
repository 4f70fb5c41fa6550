package com.jreinhal.haven.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.jreinhal.haven.model.CaseTier;
import com.jreinhal.haven.model.Role;
import com.jreinhal.haven.model.User;
import com.jreinhal.haven.model.UserStatus;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class JwtValidatorTest {

    private static final String SECRET = "test-secret-that-is-at-least-32-bytes-long!!";

    private JwtKeyProvider keyProvider;
    private TokenIssuer issuer;
    private JwtValidator validator;
    private User user;
    private Role role;

    @BeforeEach
    void setUp() {
        keyProvider = keyProvider(SECRET);
        issuer = new TokenIssuer(keyProvider);
        ReflectionTestUtils.setField(issuer, "validity", Duration.ofDays(7));
        ReflectionTestUtils.setField(issuer, "issuer", "haven");
        validator = validator(keyProvider);

        user = new User("psy@sos.tn", "hash", "Sophie", "Martin", "role-psy", "village-1", UserStatus.APPROVED);
        user.setId("user-1");
        role = new Role("Psychologue", "Psychologist", List.of("REPORT_READ", "REPORT_UPDATE", "DOC_READ"), CaseTier.ANALYST);
        role.setId("role-psy");
    }

    private static JwtKeyProvider keyProvider(String secret) {
        JwtKeyProvider provider = new JwtKeyProvider();
        ReflectionTestUtils.setField(provider, "secret", secret);
        provider.init();
        return provider;
    }

    private static JwtValidator validator(JwtKeyProvider provider) {
        JwtValidator jwtValidator = new JwtValidator(provider);
        ReflectionTestUtils.setField(jwtValidator, "expectedIssuer", "haven");
        ReflectionTestUtils.setField(jwtValidator, "clockSkewSeconds", 30L);
        return jwtValidator;
    }

    private String sign(JWTClaimsSet claims, byte[] secret) throws Exception {
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        jwt.sign(new MACSigner(secret));
        return jwt.serialize();
    }

    @Nested
    @DisplayName("Issued tokens")
    class IssuedTokens {

        @Test
        @DisplayName("Should decode the role snapshot taken at issuance")
        void shouldDecodeSnapshot() {
            TokenIssuer.IssuedToken token = issuer.issue(user, role);

            JwtValidator.ValidationResult result = validator.validate(token.token());

            assertThat(result.isValid()).isTrue();
            TokenClaims claims = result.getClaims();
            assertThat(claims.subjectId()).isEqualTo("user-1");
            assertThat(claims.email()).isEqualTo("psy@sos.tn");
            assertThat(claims.roleName()).isEqualTo("Psychologue");
            assertThat(claims.permissions()).containsExactlyInAnyOrder("REPORT_READ", "REPORT_UPDATE", "DOC_READ");
            assertThat(claims.tier()).isEqualTo(CaseTier.ANALYST);
            assertThat(claims.expiresAt()).isEqualTo(token.expiresAt().truncatedTo(ChronoUnit.SECONDS));
        }

        @Test
        @DisplayName("Should keep the old permission set after the role is edited")
        void shouldIgnoreLaterRoleEdits() {
            String token = issuer.issue(user, role).token();
            role.setPermissions(List.of("REPORT_READ"));

            TokenClaims claims = validator.validate(token).getClaims();

            assertThat(claims.permissions()).contains("REPORT_UPDATE", "DOC_READ");
        }

        @Test
        @DisplayName("Should expire seven days after issuance by default")
        void shouldUseSevenDayValidity() {
            TokenIssuer.IssuedToken token = issuer.issue(user, role);
            assertThat(Duration.between(token.issuedAt(), token.expiresAt())).isEqualTo(Duration.ofDays(7));
        }
    }

    @Nested
    @DisplayName("Rejected tokens")
    class RejectedTokens {

        @Test
        @DisplayName("Should reject a token with a modified payload")
        void shouldRejectTamperedToken() {
            String token = issuer.issue(user, role).token();
            String[] parts = token.split("\\.");
            JWTClaimsSet forged = new JWTClaimsSet.Builder()
                    .subject("user-1")
                    .issuer("haven")
                    .expirationTime(Date.from(Instant.now().plusSeconds(3600)))
                    .claim(TokenIssuer.CLAIM_PERMISSIONS, List.of("ROLE_CREATE"))
                    .build();
            String forgedPayload = Base64URL.encode(forged.toString()).toString();

            JwtValidator.ValidationResult result = validator.validate(parts[0] + "." + forgedPayload + "." + parts[2]);

            assertThat(result.isValid()).isFalse();
            assertThat(result.getError()).isEqualTo("Signature verification failed");
        }

        @Test
        @DisplayName("Should reject a token signed with another key")
        void shouldRejectForeignKey() {
            JwtKeyProvider other = keyProvider("another-secret-that-is-also-32-bytes-long");
            TokenIssuer otherIssuer = new TokenIssuer(other);
            ReflectionTestUtils.setField(otherIssuer, "validity", Duration.ofHours(1));
            ReflectionTestUtils.setField(otherIssuer, "issuer", "haven");
            String token = otherIssuer.issue(user, role).token();

            assertThat(validator.validate(token).isValid()).isFalse();
        }

        @Test
        @DisplayName("Should reject an expired token")
        void shouldRejectExpired() throws Exception {
            JWTClaimsSet claims = new JWTClaimsSet.Builder()
                    .subject("user-1")
                    .issuer("haven")
                    .issueTime(Date.from(Instant.now().minusSeconds(7200)))
                    .expirationTime(Date.from(Instant.now().minusSeconds(3600)))
                    .build();

            JwtValidator.ValidationResult result = validator.validate(sign(claims, keyProvider.getSecret()));

            assertThat(result.isValid()).isFalse();
            assertThat(result.getError()).isEqualTo("Token has expired");
        }

        @Test
        @DisplayName("Should reject a token without expiry")
        void shouldRejectMissingExpiry() throws Exception {
            JWTClaimsSet claims = new JWTClaimsSet.Builder().subject("user-1").issuer("haven").build();

            assertThat(validator.validate(sign(claims, keyProvider.getSecret())).getError()).isEqualTo("Token missing expiry");
        }

        @Test
        @DisplayName("Should reject a foreign issuer")
        void shouldRejectIssuer() throws Exception {
            JWTClaimsSet claims = new JWTClaimsSet.Builder()
                    .subject("user-1")
                    .issuer("someone-else")
                    .expirationTime(Date.from(Instant.now().plusSeconds(3600)))
                    .build();

            assertThat(validator.validate(sign(claims, keyProvider.getSecret())).getError()).isEqualTo("Invalid issuer");
        }

        @Test
        @DisplayName("Should reject garbage and empty input")
        void shouldRejectGarbage() {
            assertThat(validator.validate("not-a-jwt").isValid()).isFalse();
            assertThat(validator.validate("").isValid()).isFalse();
            assertThat(validator.validate(null).isValid()).isFalse();
        }
    }

    @Nested
    @DisplayName("Key provider")
    class KeyProvider {

        @Test
        @DisplayName("Should refuse a short secret unless generation is allowed")
        void shouldRefuseShortSecret() {
            JwtKeyProvider provider = new JwtKeyProvider();
            ReflectionTestUtils.setField(provider, "secret", "short");
            assertThrows(IllegalStateException.class, provider::init);

            ReflectionTestUtils.setField(provider, "allowGeneratedSecret", true);
            provider.init();
            assertThat(provider.getSecret()).hasSize(JwtKeyProvider.MIN_SECRET_BYTES * 2);
        }
    }
}
