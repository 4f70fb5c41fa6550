package com.jreinhal.haven.service;

import com.jreinhal.haven.exception.HavenException;
import com.jreinhal.haven.model.AuditLog;
import com.jreinhal.haven.model.CaseTier;
import com.jreinhal.haven.model.Permission;
import com.jreinhal.haven.model.PermissionValidationMode;
import com.jreinhal.haven.model.Role;
import com.jreinhal.haven.repository.RoleRepository;
import com.jreinhal.haven.repository.UserRepository;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Role administration.
 *
 * Role edits do not touch credentials already issued; holders see the change on their
 * next sign-in.
 */
@Service
public class RoleService {
    private static final Logger log = LoggerFactory.getLogger(RoleService.class);
    private static final int MAX_NAME_LENGTH = 80;
    private static final int MAX_DESCRIPTION_LENGTH = 500;

    private final RoleRepository roleRepository;
    private final UserRepository userRepository;
    private final AuditService auditService;

    @Value("${app.rbac.permission-validation:STRICT}")
    private PermissionValidationMode validationMode = PermissionValidationMode.STRICT;

    public RoleService(RoleRepository roleRepository, UserRepository userRepository, AuditService auditService) {
        this.roleRepository = roleRepository;
        this.userRepository = userRepository;
        this.auditService = auditService;
    }

    public List<RoleSummary> listRoles() {
        return roleRepository.findAll().stream()
                .sorted(Comparator.comparing(Role::getName, Comparator.nullsLast(String::compareTo)))
                .map(role -> RoleSummary.of(role, userRepository.countByRoleId(role.getId())))
                .toList();
    }

    public RoleSummary getRole(String id) {
        Role role = requireRole(id);
        return RoleSummary.of(role, userRepository.countByRoleId(role.getId()));
    }

    public Role createRole(RolePayload payload, String actorId) {
        if (payload == null) {
            throw HavenException.invalidArgument("Role payload is required");
        }
        String name = requireName(payload.name());
        if (roleRepository.existsByName(name)) {
            throw HavenException.conflict("Role with name \"" + name + "\" already exists");
        }
        Role role = new Role(name, clamp(payload.description()), validatePermissions(payload.permissions()), payload.tier());
        Role saved = roleRepository.save(role);
        log.info("Role created: {} ({} permissions, tier={})", saved.getName(), saved.getPermissions().size(), saved.getTier());
        auditService.logAdminAction(AuditLog.Action.ROLE_CREATED, actorId, "Role created: " + saved.getName());
        return saved;
    }

    /**
     * Partial update. A supplied permission list replaces the stored set entirely.
     */
    public Role updateRole(String id, RolePayload payload, String actorId) {
        Role role = requireRole(id);
        if (payload == null) {
            return role;
        }
        if (payload.name() != null) {
            String name = requireName(payload.name());
            if (!name.equals(role.getName())) {
                roleRepository.findByName(name)
                        .filter(other -> !other.getId().equals(role.getId()))
                        .ifPresent(other -> {
                            throw HavenException.conflict("Role with name \"" + name + "\" already exists");
                        });
                role.setName(name);
            }
        }
        if (payload.description() != null) {
            role.setDescription(clamp(payload.description()));
        }
        if (payload.permissions() != null) {
            role.setPermissions(validatePermissions(payload.permissions()));
        }
        if (payload.tier() != null) {
            role.setTier(payload.tier());
        }
        role.setUpdatedAt(Instant.now());
        Role saved = roleRepository.save(role);
        auditService.logAdminAction(AuditLog.Action.ROLE_UPDATED, actorId, "Role updated: " + saved.getName());
        return saved;
    }

    public void deleteRole(String id, String actorId) {
        Role role = requireRole(id);
        long holders = userRepository.countByRoleId(role.getId());
        if (holders > 0) {
            throw HavenException.conflict("Cannot delete role \"" + role.getName() + "\". " + holders + " user(s) are assigned to this role.");
        }
        roleRepository.delete(role);
        log.info("Role deleted: {}", role.getName());
        auditService.logAdminAction(AuditLog.Action.ROLE_DELETED, actorId, "Role deleted: " + role.getName());
    }

    public List<String> availablePermissions() {
        return Permission.catalog();
    }

    Set<String> validatePermissions(Collection<String> requested) {
        Set<String> permissions = new LinkedHashSet<>();
        if (requested == null) {
            return permissions;
        }
        for (String raw : requested) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String permission = raw.trim();
            if (!Permission.isKnown(permission)) {
                if (validationMode == PermissionValidationMode.STRICT) {
                    throw HavenException.invalidArgument("Unknown permission: " + permission);
                }
                log.warn("Storing permission outside the catalog: {}", permission);
            }
            permissions.add(permission);
        }
        return permissions;
    }

    private Role requireRole(String id) {
        if (id == null || id.isBlank()) {
            throw HavenException.notFound("Role not found");
        }
        return roleRepository.findById(id).orElseThrow(() -> HavenException.notFound("Role not found"));
    }

    private static String requireName(String raw) {
        String name = raw == null ? "" : raw.trim();
        if (name.isEmpty()) {
            throw HavenException.invalidArgument("Role name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw HavenException.invalidArgument("Role name is too long");
        }
        return name;
    }

    private static String clamp(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.length() > MAX_DESCRIPTION_LENGTH ? trimmed.substring(0, MAX_DESCRIPTION_LENGTH) : trimmed;
    }

    public record RolePayload(String name, String description, List<String> permissions, CaseTier tier) {
    }

    public record RoleSummary(String id, String name, String description, Set<String> permissions, CaseTier tier,
                              long userCount, Instant createdAt, Instant updatedAt) {
        static RoleSummary of(Role role, long userCount) {
            return new RoleSummary(role.getId(), role.getName(), role.getDescription(), role.getPermissions(),
                    role.getTier(), userCount, role.getCreatedAt(), role.getUpdatedAt());
        }
    }
}
