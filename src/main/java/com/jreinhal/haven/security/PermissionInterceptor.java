package com.jreinhal.haven.security;

import com.jreinhal.haven.exception.HavenException;
import com.jreinhal.haven.filter.SecurityContext;
import com.jreinhal.haven.filter.SecurityFilter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Enforces {@link PublicEndpoint} and {@link RequirePermissions} on controller handlers.
 *
 * Order of checks: public marker, then credential presence, then the permission gate.
 */
@Component
public class PermissionInterceptor implements HandlerInterceptor {
    private static final Logger log = LoggerFactory.getLogger(PermissionInterceptor.class);
    private final AuthorizationGate gate;

    public PermissionInterceptor(AuthorizationGate gate) {
        this.gate = gate;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        if (isPublic(handlerMethod)) {
            return true;
        }
        TokenClaims claims = SecurityContext.getCurrentClaims();
        if (claims == null) {
            Object reason = request.getAttribute(SecurityFilter.AUTH_ERROR_ATTRIBUTE);
            log.warn("Unauthenticated request to {} {}{}", request.getMethod(), request.getRequestURI(),
                    reason != null ? " (" + reason + ")" : "");
            throw HavenException.unauthenticated(reason != null ? "Invalid or expired token" : "Authentication required");
        }
        Set<String> required = requiredPermissions(handlerMethod);
        AuthorizationGate.Decision decision = gate.decide(required, claims);
        if (!decision.allowed()) {
            log.warn("Permission denied for {} on {} {}: {}", claims.subjectId(), request.getMethod(),
                    request.getRequestURI(), decision.reason());
            throw HavenException.permissionDenied(decision.reason());
        }
        return true;
    }

    private static boolean isPublic(HandlerMethod handlerMethod) {
        return AnnotatedElementUtils.hasAnnotation(handlerMethod.getMethod(), PublicEndpoint.class)
                || AnnotatedElementUtils.hasAnnotation(handlerMethod.getBeanType(), PublicEndpoint.class);
    }

    static Set<String> requiredPermissions(HandlerMethod handlerMethod) {
        RequirePermissions annotation = AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getMethod(), RequirePermissions.class);
        if (annotation == null) {
            annotation = AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), RequirePermissions.class);
        }
        if (annotation == null) {
            return Set.of();
        }
        return Arrays.stream(annotation.value()).map(Enum::name).collect(Collectors.toSet());
    }
}
