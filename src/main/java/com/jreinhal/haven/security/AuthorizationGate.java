package com.jreinhal.haven.security;

import com.jreinhal.haven.exception.HavenException;
import com.jreinhal.haven.model.Permission;
import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Per-request permission decision over token claims.
 *
 * AND semantics: every required permission must be present in the claim set.
 * No I/O; the role store is never consulted, so decisions are as fresh as the token.
 */
@Component
public class AuthorizationGate {

    public Decision decide(Set<String> requiredPermissions, TokenClaims claims) {
        if (requiredPermissions == null || requiredPermissions.isEmpty()) {
            return Decision.allow();
        }
        if (claims == null || claims.permissions().isEmpty()) {
            return Decision.deny("No permissions found");
        }
        Set<String> missing = new TreeSet<>(requiredPermissions);
        missing.removeAll(claims.permissions());
        if (!missing.isEmpty()) {
            return Decision.deny("Missing required permissions: " + String.join(", ", missing));
        }
        return Decision.allow();
    }

    /**
     * Throwing variant for checks whose required set is only known at call time.
     */
    public void require(TokenClaims claims, Permission... required) {
        Set<String> names = Arrays.stream(required).map(Enum::name).collect(Collectors.toSet());
        Decision decision = decide(names, claims);
        if (!decision.allowed()) {
            throw HavenException.permissionDenied(decision.reason());
        }
    }

    public static Set<String> names(Collection<Permission> permissions) {
        return permissions.stream().map(Enum::name).collect(Collectors.toSet());
    }

    public record Decision(boolean allowed, String reason) {
        public static Decision allow() {
            return new Decision(true, null);
        }

        public static Decision deny(String reason) {
            return new Decision(false, reason);
        }
    }
}
