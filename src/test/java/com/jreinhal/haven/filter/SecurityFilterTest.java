package com.jreinhal.haven.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.haven.security.JwtValidator;
import com.jreinhal.haven.security.TokenClaims;
import com.jreinhal.haven.support.TestClaims;
import jakarta.servlet.FilterChain;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

class SecurityFilterTest {

    private JwtValidator jwtValidator;
    private SecurityFilter filter;

    @BeforeEach
    void setUp() {
        jwtValidator = mock(JwtValidator.class);
        filter = new SecurityFilter(jwtValidator);
    }

    @AfterEach
    void tearDown() {
        SecurityContext.clear();
        SecurityContextHolder.clearContext();
    }

    @Test
    void validTokenPopulatesBothContextsForTheRequestOnly() throws Exception {
        TokenClaims claims = TestClaims.mother("mother-1");
        when(jwtValidator.validate("good")).thenReturn(JwtValidator.ValidationResult.success(claims));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/reports");
        request.addHeader("Authorization", "Bearer good");
        AtomicReference<TokenClaims> seen = new AtomicReference<>();
        List<String> authorities = new ArrayList<>();
        FilterChain chain = (req, res) -> {
            seen.set(SecurityContext.getCurrentClaims());
            Authentication auth = SecurityContextHolder.getContext().getAuthentication();
            auth.getAuthorities().stream().map(GrantedAuthority::getAuthority).forEach(authorities::add);
        };

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(seen.get()).isEqualTo(claims);
        assertThat(authorities).contains("TIER_REPORTER", "PERM_REPORT_CREATE", "PERM_REPORT_READ");
        assertThat(SecurityContext.getCurrentClaims()).isNull();
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    void invalidTokenContinuesAnonymouslyAndFlagsTheRequest() throws Exception {
        when(jwtValidator.validate("bad")).thenReturn(JwtValidator.ValidationResult.failure("Token has expired"));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/reports");
        request.addHeader("Authorization", "Bearer bad");
        AtomicReference<Boolean> authenticated = new AtomicReference<>();

        filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> authenticated.set(SecurityContext.isAuthenticated()));

        assertThat(authenticated.get()).isFalse();
        assertThat(request.getAttribute(SecurityFilter.AUTH_ERROR_ATTRIBUTE)).isEqualTo("Token has expired");
    }

    @Test
    void requestWithoutBearerHeaderSkipsValidation() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/villages");
        request.addHeader("Authorization", "Basic abc");

        filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> { });

        verify(jwtValidator, never()).validate(anyString());
        assertThat(request.getAttribute(SecurityFilter.AUTH_ERROR_ATTRIBUTE)).isNull();
    }
}
