package com.jreinhal.haven.service;

import com.jreinhal.haven.exception.HavenException;
import com.jreinhal.haven.model.Role;
import com.jreinhal.haven.model.User;
import com.jreinhal.haven.model.UserStatus;
import com.jreinhal.haven.model.UserView;
import com.jreinhal.haven.repository.RoleRepository;
import com.jreinhal.haven.repository.UserRepository;
import com.jreinhal.haven.repository.VillageRepository;
import com.jreinhal.haven.security.TokenClaims;
import com.jreinhal.haven.security.TokenIssuer;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Sign-in, self-registration and profile lookup.
 *
 * Sign-in failures use one generic message, except for accounts awaiting or refused
 * approval, whose owners get a status-specific answer.
 */
@Service
public class AuthenticationService {
    private static final Logger log = LoggerFactory.getLogger(AuthenticationService.class);
    static final String INVALID_CREDENTIALS = "Invalid credentials";
    static final String PENDING_MESSAGE = "Your account is pending approval. Please wait for an administrator to approve your registration.";
    static final String REJECTED_MESSAGE = "Your registration was rejected. Contact an administrator for more information.";
    static final String LOCKED_MESSAGE = "Too many failed sign-in attempts. Try again later.";
    static final String REGISTERED_MESSAGE = "Registration submitted. You will be able to sign in once an administrator approves your account.";
    private static final int MIN_PASSWORD_LENGTH = 8;
    private static final int MAX_FIELD_LENGTH = 200;
    // Compared against when the email is unknown so both paths cost one bcrypt check.
    private static final String DUMMY_HASH = "$2a$10$7EqJtq98hPqEX7fNZaFWoOhi5BWX4Z8lqU9xJ1lRb4xUyM1bXl7bW";

    private final UserRepository userRepository;
    private final RoleRepository roleRepository;
    private final VillageRepository villageRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenIssuer tokenIssuer;
    private final LoginAttemptService loginAttemptService;
    private final AuditService auditService;

    public AuthenticationService(UserRepository userRepository, RoleRepository roleRepository, VillageRepository villageRepository,
                                 PasswordEncoder passwordEncoder, TokenIssuer tokenIssuer,
                                 LoginAttemptService loginAttemptService, AuditService auditService) {
        this.userRepository = userRepository;
        this.roleRepository = roleRepository;
        this.villageRepository = villageRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenIssuer = tokenIssuer;
        this.loginAttemptService = loginAttemptService;
        this.auditService = auditService;
    }

    public SignInResult signIn(String email, String password, String clientIp) {
        if (email == null || email.isBlank() || password == null || password.isEmpty()) {
            throw HavenException.unauthenticated(INVALID_CREDENTIALS);
        }
        String lockoutKey = loginAttemptService.buildKey(email, clientIp);
        if (loginAttemptService.isLockedOut(lockoutKey)) {
            log.warn("Sign-in blocked by lockout from IP: {}", clientIp);
            auditService.logAuthFailure(email, "locked out", clientIp);
            throw HavenException.unauthenticated(LOCKED_MESSAGE);
        }
        Optional<User> found = userRepository.findByEmail(email);
        if (found.isEmpty()) {
            passwordEncoder.matches(password, DUMMY_HASH);
            loginAttemptService.recordFailure(lockoutKey);
            log.warn("Sign-in failed: unknown account from IP: {}", clientIp);
            auditService.logAuthFailure(email, "unknown account", clientIp);
            throw HavenException.unauthenticated(INVALID_CREDENTIALS);
        }
        User user = found.get();
        if (user.getStatus() == UserStatus.PENDING) {
            auditService.logAuthFailure(email, "pending approval", clientIp);
            throw HavenException.unauthenticated(PENDING_MESSAGE);
        }
        if (user.getStatus() != UserStatus.APPROVED) {
            auditService.logAuthFailure(email, "registration rejected", clientIp);
            throw HavenException.unauthenticated(REJECTED_MESSAGE);
        }
        if (user.getPasswordHash() == null || !passwordEncoder.matches(password, user.getPasswordHash())) {
            loginAttemptService.recordFailure(lockoutKey);
            log.warn("Sign-in failed: bad password for user {} from IP: {}", user.getId(), clientIp);
            auditService.logAuthFailure(email, "bad password", clientIp);
            throw HavenException.unauthenticated(INVALID_CREDENTIALS);
        }
        Role role = roleRepository.findById(user.getRoleId()).orElse(null);
        if (role == null) {
            log.error("User {} references missing role {}", user.getId(), user.getRoleId());
            throw HavenException.unauthenticated(INVALID_CREDENTIALS);
        }
        TokenIssuer.IssuedToken token = tokenIssuer.issue(user, role);
        loginAttemptService.recordSuccess(lockoutKey);
        user.setLastLoginAt(Instant.now());
        userRepository.save(user);
        auditService.logAuthSuccess(user.getId(), clientIp);
        log.info("User {} signed in (role={})", user.getId(), role.getName());
        return new SignInResult(token.token(), "Bearer", token.expiresAt(), UserView.of(user, role));
    }

    public SignUpResult signUp(SignUpPayload payload) {
        if (payload == null) {
            throw HavenException.invalidArgument("Registration payload is required");
        }
        String email = requireText(payload.email(), "Email");
        String password = requirePassword(payload.password());
        String firstName = requireText(payload.firstName(), "First name");
        String lastName = requireText(payload.lastName(), "Last name");
        String roleId = requireText(payload.roleId(), "roleId");
        if (userRepository.existsByEmail(email)) {
            throw HavenException.conflict("Email already registered");
        }
        Role role = roleRepository.findById(roleId)
                .orElseThrow(() -> HavenException.notFound("Role with ID " + roleId + " not found. Please use a valid roleId."));
        String villageId = payload.villageId() == null || payload.villageId().isBlank() ? null : payload.villageId().trim();
        if (villageId != null && !villageRepository.existsById(villageId)) {
            throw HavenException.notFound("Village not found");
        }
        User user = new User(email, passwordEncoder.encode(password), firstName, lastName, role.getId(), villageId, UserStatus.PENDING);
        User saved = userRepository.save(user);
        log.info("Registration submitted: user {} requesting role {}", saved.getId(), role.getName());
        return new SignUpResult(REGISTERED_MESSAGE, UserView.of(saved, role));
    }

    /**
     * Roles offered on the registration form, by name.
     */
    public List<RoleOption> rolesForSignUp() {
        return roleRepository.findAll().stream()
                .map(role -> new RoleOption(role.getId(), role.getName(), role.getDescription()))
                .sorted(Comparator.comparing(RoleOption::name, Comparator.nullsLast(String::compareTo)))
                .toList();
    }

    public UserView profile(TokenClaims claims) {
        User user = userRepository.findById(claims.subjectId())
                .orElseThrow(() -> HavenException.notFound("User not found"));
        return UserView.of(user, roleRepository.findById(user.getRoleId()).orElse(null));
    }

    static String requireText(String value, String field) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            throw HavenException.invalidArgument(field + " is required");
        }
        if (trimmed.length() > MAX_FIELD_LENGTH) {
            throw HavenException.invalidArgument(field + " is too long");
        }
        return trimmed;
    }

    static String requirePassword(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw HavenException.invalidArgument("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        return password;
    }

    public record SignUpPayload(String email, String password, String firstName, String lastName, String roleId, String villageId) {
    }

    public record SignInResult(String accessToken, String tokenType, Instant expiresAt, UserView user) {
    }

    public record SignUpResult(String message, UserView user) {
    }

    public record RoleOption(String id, String name, String description) {
    }
}
