package com.jreinhal.haven.filter;

import com.jreinhal.haven.exception.HavenException;
import com.jreinhal.haven.security.TokenClaims;

/**
 * Thread-local holder for the verified claims of the current request.
 */
public class SecurityContext {

    private static final ThreadLocal<TokenClaims> currentClaims = new ThreadLocal<>();

    public static void setCurrentClaims(TokenClaims claims) {
        currentClaims.set(claims);
    }

    /**
     * @return the claims, or null when the request carries no valid credential
     */
    public static TokenClaims getCurrentClaims() {
        return currentClaims.get();
    }

    /**
     * Claims of the current request, failing with UNAUTHENTICATED when absent.
     */
    public static TokenClaims requireClaims() {
        TokenClaims claims = currentClaims.get();
        if (claims == null) {
            throw HavenException.unauthenticated("Authentication required");
        }
        return claims;
    }

    public static boolean isAuthenticated() {
        return currentClaims.get() != null;
    }

    /**
     * Current subject id for logging.
     */
    public static String getCurrentUserId() {
        TokenClaims claims = currentClaims.get();
        return claims != null ? claims.subjectId() : "ANONYMOUS";
    }

    public static void clear() {
        currentClaims.remove();
    }
}
