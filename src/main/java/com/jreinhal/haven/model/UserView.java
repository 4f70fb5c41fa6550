package com.jreinhal.haven.model;

import java.time.Instant;

/**
 * Redacted user projection returned by the API. Never carries the password hash.
 */
public record UserView(
        String id,
        String email,
        String firstName,
        String lastName,
        String roleId,
        String roleName,
        CaseTier tier,
        String villageId,
        UserStatus status,
        Instant createdAt,
        Instant lastLoginAt) {

    public static UserView of(User user, Role role) {
        return new UserView(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getRoleId(),
                role != null ? role.getName() : null,
                role != null ? role.getTier() : null,
                user.getVillageId(),
                user.getStatus(),
                user.getCreatedAt(),
                user.getLastLoginAt());
    }
}
