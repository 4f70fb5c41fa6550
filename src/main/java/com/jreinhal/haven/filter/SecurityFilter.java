package com.jreinhal.haven.filter;

import com.jreinhal.haven.security.JwtValidator;
import com.jreinhal.haven.security.TokenClaims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the bearer credential of each request into {@link SecurityContext}.
 *
 * Requests without a valid token continue anonymously; {@code PermissionInterceptor}
 * decides whether the target handler accepts that.
 */
@Component
@Order(value = 2)
public class SecurityFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(SecurityFilter.class);
    public static final String AUTH_ERROR_ATTRIBUTE = "haven.authError";
    private static final String BEARER_PREFIX = "Bearer ";
    private final JwtValidator jwtValidator;

    public SecurityFilter(JwtValidator jwtValidator) {
        this.jwtValidator = jwtValidator;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            chain.doFilter(request, response);
            return;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        JwtValidator.ValidationResult result = this.jwtValidator.validate(token);
        if (!result.isValid()) {
            log.warn("Rejected bearer token for path: {} from IP: {} ({})", request.getRequestURI(), request.getRemoteAddr(), result.getError());
            request.setAttribute(AUTH_ERROR_ATTRIBUTE, result.getError());
            chain.doFilter(request, response);
            return;
        }
        TokenClaims claims = result.getClaims();
        SecurityContext.setCurrentClaims(claims);
        this.setSpringSecurityContext(claims);
        try {
            chain.doFilter(request, response);
        } finally {
            SecurityContext.clear();
            SecurityContextHolder.clearContext();
        }
    }

    private void setSpringSecurityContext(TokenClaims claims) {
        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(claims.subjectId(), null, buildAuthorities(claims));
        auth.setDetails(claims);
        SecurityContextHolder.getContext().setAuthentication(auth);
    }

    private static Collection<GrantedAuthority> buildAuthorities(TokenClaims claims) {
        ArrayList<GrantedAuthority> authorities = new ArrayList<>();
        if (claims.tier() != null) {
            authorities.add(new SimpleGrantedAuthority("TIER_" + claims.tier().name()));
        }
        for (String permission : claims.permissions()) {
            authorities.add(new SimpleGrantedAuthority("PERM_" + permission));
        }
        return authorities;
    }
}
