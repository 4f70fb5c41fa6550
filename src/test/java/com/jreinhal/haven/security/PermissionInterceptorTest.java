package com.jreinhal.haven.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.jreinhal.haven.exception.ErrorKind;
import com.jreinhal.haven.exception.HavenException;
import com.jreinhal.haven.filter.SecurityContext;
import com.jreinhal.haven.filter.SecurityFilter;
import com.jreinhal.haven.model.Permission;
import com.jreinhal.haven.support.TestClaims;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.method.HandlerMethod;

class PermissionInterceptorTest {

    private final PermissionInterceptor interceptor = new PermissionInterceptor(new AuthorizationGate());
    private final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/reports");
    private final MockHttpServletResponse response = new MockHttpServletResponse();

    @RequirePermissions(Permission.REPORT_READ)
    static class ReportsFixture {
        public void list() {
        }

        @RequirePermissions({Permission.CASE_CLOSE})
        public void close() {
        }

        @PublicEndpoint
        public void health() {
        }

        public void inherited() {
        }
    }

    static class OpenFixture {
        public void profile() {
        }
    }

    private static HandlerMethod handler(Class<?> type, String method) throws NoSuchMethodException {
        Object bean = type == ReportsFixture.class ? new ReportsFixture() : new OpenFixture();
        return new HandlerMethod(bean, type.getMethod(method));
    }

    @AfterEach
    void clear() {
        SecurityContext.clear();
    }

    @Test
    @DisplayName("Should let public handlers through without a credential")
    void publicHandlerNeedsNoCredential() throws Exception {
        assertThat(interceptor.preHandle(request, response, handler(ReportsFixture.class, "health"))).isTrue();
    }

    @Test
    @DisplayName("Should reject anonymous callers with UNAUTHENTICATED")
    void anonymousIsUnauthenticated() {
        assertThatThrownBy(() -> interceptor.preHandle(request, response, handler(ReportsFixture.class, "list")))
                .isInstanceOf(HavenException.class)
                .hasMessage("Authentication required")
                .satisfies(e -> assertThat(((HavenException) e).getKind()).isEqualTo(ErrorKind.UNAUTHENTICATED));
    }

    @Test
    @DisplayName("Should report a rejected token distinctly")
    void rejectedTokenIsUnauthenticated() {
        request.setAttribute(SecurityFilter.AUTH_ERROR_ATTRIBUTE, "Token has expired");
        assertThatThrownBy(() -> interceptor.preHandle(request, response, handler(OpenFixture.class, "profile")))
                .isInstanceOf(HavenException.class)
                .hasMessage("Invalid or expired token");
    }

    @Test
    @DisplayName("Method annotation replaces the class annotation")
    void methodAnnotationOverridesClass() throws Exception {
        assertThat(PermissionInterceptor.requiredPermissions(handler(ReportsFixture.class, "close"))).containsExactly("CASE_CLOSE");
        assertThat(PermissionInterceptor.requiredPermissions(handler(ReportsFixture.class, "inherited"))).containsExactly("REPORT_READ");
        assertThat(PermissionInterceptor.requiredPermissions(handler(OpenFixture.class, "profile"))).isEmpty();
    }

    @Test
    @DisplayName("Should deny a caller missing the required permission")
    void deniesMissingPermission() {
        SecurityContext.setCurrentClaims(TestClaims.psychologist("psy-1"));
        assertThatThrownBy(() -> interceptor.preHandle(request, response, handler(ReportsFixture.class, "close")))
                .isInstanceOf(HavenException.class)
                .hasMessage("Missing required permissions: CASE_CLOSE")
                .satisfies(e -> assertThat(((HavenException) e).getKind()).isEqualTo(ErrorKind.PERMISSION_DENIED));
    }

    @Test
    @DisplayName("Should allow an authenticated caller on a handler with no requirement")
    void authenticatedWithoutRequirement() throws Exception {
        SecurityContext.setCurrentClaims(TestClaims.mother("mother-1"));
        assertThat(interceptor.preHandle(request, response, handler(OpenFixture.class, "profile"))).isTrue();
        assertThat(interceptor.preHandle(request, response, handler(ReportsFixture.class, "list"))).isTrue();
    }

    @Test
    void ignoresNonControllerHandlers() throws Exception {
        assertThat(interceptor.preHandle(request, response, new Object())).isTrue();
    }
}
