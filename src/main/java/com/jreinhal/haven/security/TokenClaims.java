package com.jreinhal.haven.security;

import com.jreinhal.haven.model.CaseTier;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Claims carried by a signed session credential.
 *
 * A snapshot of the subject's role at issuance. Role edits made afterwards are not
 * visible here until the subject signs in again.
 */
public record TokenClaims(
        String subjectId,
        String email,
        String roleName,
        Set<String> permissions,
        CaseTier tier,
        Instant issuedAt,
        Instant expiresAt) {

    public TokenClaims {
        permissions = permissions == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(new TreeSet<>(permissions)));
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }

    public boolean isOwnReportsOnly() {
        return tier == null || tier.isOwnReportsOnly();
    }

    public boolean isIdentityRevealing() {
        return tier != null && tier.isIdentityRevealing();
    }
}
