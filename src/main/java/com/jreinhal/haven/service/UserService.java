package com.jreinhal.haven.service;

import com.jreinhal.haven.exception.HavenException;
import com.jreinhal.haven.model.AuditLog;
import com.jreinhal.haven.model.Role;
import com.jreinhal.haven.model.User;
import com.jreinhal.haven.model.UserStatus;
import com.jreinhal.haven.model.UserView;
import com.jreinhal.haven.repository.RoleRepository;
import com.jreinhal.haven.repository.UserRepository;
import com.jreinhal.haven.repository.VillageRepository;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * User administration, including the one-shot registration approval.
 */
@Service
public class UserService {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);
    private final UserRepository userRepository;
    private final RoleRepository roleRepository;
    private final VillageRepository villageRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditService auditService;

    public UserService(UserRepository userRepository, RoleRepository roleRepository, VillageRepository villageRepository,
                       PasswordEncoder passwordEncoder, AuditService auditService) {
        this.userRepository = userRepository;
        this.roleRepository = roleRepository;
        this.villageRepository = villageRepository;
        this.passwordEncoder = passwordEncoder;
        this.auditService = auditService;
    }

    public List<UserView> listUsers(UserStatus status) {
        List<User> users = status != null ? userRepository.findByStatus(status) : userRepository.findAll();
        Map<String, Role> roles = roleRepository.findAll().stream()
                .collect(Collectors.toMap(Role::getId, Function.identity(), (a, b) -> a));
        return users.stream()
                .sorted(Comparator.comparing(User::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .map(user -> UserView.of(user, roles.get(user.getRoleId())))
                .toList();
    }

    public UserView getUser(String id) {
        User user = requireUser(id);
        return UserView.of(user, roleRepository.findById(user.getRoleId()).orElse(null));
    }

    /**
     * Administrative creation. The account is approved immediately.
     */
    public UserView createUser(CreateUserPayload payload, String actorId) {
        if (payload == null) {
            throw HavenException.invalidArgument("User payload is required");
        }
        String email = AuthenticationService.requireText(payload.email(), "Email");
        String password = AuthenticationService.requirePassword(payload.password());
        String firstName = AuthenticationService.requireText(payload.firstName(), "First name");
        String lastName = AuthenticationService.requireText(payload.lastName(), "Last name");
        if (userRepository.existsByEmail(email)) {
            throw HavenException.conflict("Email already registered");
        }
        Role role = roleRepository.findById(AuthenticationService.requireText(payload.roleId(), "Role"))
                .orElseThrow(() -> HavenException.notFound("Role with ID " + payload.roleId() + " not found"));
        requireVillageIfPresent(payload.villageId());
        User user = new User(email, passwordEncoder.encode(password), firstName, lastName, role.getId(),
                blankToNull(payload.villageId()), UserStatus.APPROVED);
        User saved = userRepository.save(user);
        log.info("User {} created by {} with role {}", saved.getId(), actorId, role.getName());
        auditService.logAdminAction(AuditLog.Action.USER_CREATED, actorId, "User created: " + saved.getId());
        return UserView.of(saved, role);
    }

    public UserView updateRole(String userId, String roleId, String actorId) {
        User user = requireUser(userId);
        if (roleId == null || roleId.isBlank()) {
            throw HavenException.invalidArgument("roleId is required");
        }
        Role role = roleRepository.findById(roleId)
                .orElseThrow(() -> HavenException.notFound("Role with ID " + roleId + " not found"));
        String previous = user.getRoleId();
        user.setRoleId(role.getId());
        user.setUpdatedAt(Instant.now());
        User saved = userRepository.save(user);
        log.info("User {} moved from role {} to {} by {}", userId, previous, role.getId(), actorId);
        auditService.logAdminAction(AuditLog.Action.USER_ROLE_CHANGED, actorId,
                "User " + userId + " assigned role " + role.getName());
        return UserView.of(saved, role);
    }

    public UserView approve(String userId, String actorId) {
        return decide(userId, UserStatus.APPROVED, AuditLog.Action.USER_APPROVED, actorId);
    }

    public UserView reject(String userId, String actorId) {
        return decide(userId, UserStatus.REJECTED, AuditLog.Action.USER_REJECTED, actorId);
    }

    private UserView decide(String userId, UserStatus outcome, AuditLog.Action action, String actorId) {
        User user = requireUser(userId);
        if (user.getStatus() != UserStatus.PENDING) {
            throw HavenException.invalidState("User is not pending approval (current status: " + user.getStatus() + ")");
        }
        user.setStatus(outcome);
        user.setUpdatedAt(Instant.now());
        User saved = userRepository.save(user);
        log.info("Registration {} -> {} by {}", userId, outcome, actorId);
        auditService.logAdminAction(action, actorId, "Registration " + outcome.name().toLowerCase() + ": " + userId);
        return UserView.of(saved, roleRepository.findById(saved.getRoleId()).orElse(null));
    }

    public void deleteUser(String userId, String actorId) {
        User user = requireUser(userId);
        if (user.getId().equals(actorId)) {
            throw HavenException.invalidArgument("You cannot delete your own account");
        }
        userRepository.delete(user);
        log.info("User {} deleted by {}", userId, actorId);
        auditService.logAdminAction(AuditLog.Action.USER_DELETED, actorId, "User deleted: " + userId);
    }

    private User requireUser(String id) {
        if (id == null || id.isBlank()) {
            throw HavenException.notFound("User not found");
        }
        return userRepository.findById(id).orElseThrow(() -> HavenException.notFound("User not found"));
    }

    private void requireVillageIfPresent(String villageId) {
        if (villageId != null && !villageId.isBlank() && !villageRepository.existsById(villageId)) {
            throw HavenException.notFound("Village not found");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record CreateUserPayload(String email, String password, String firstName, String lastName,
                                    String roleId, String villageId) {
    }
}
