package com.jreinhal.haven.controller;

import com.jreinhal.haven.filter.SecurityContext;
import com.jreinhal.haven.model.UserView;
import com.jreinhal.haven.security.PublicEndpoint;
import com.jreinhal.haven.service.AuthenticationService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value = {"/api/auth"})
@Tag(name = "Authentication")
public class AuthController {

    private final AuthenticationService authenticationService;

    public AuthController(AuthenticationService authenticationService) {
        this.authenticationService = authenticationService;
    }

    public record SignInRequest(String email, String password) {
    }

    @PublicEndpoint
    @PostMapping(value = {"/sign-in"})
    public AuthenticationService.SignInResult signIn(@RequestBody(required = false) SignInRequest request,
                                                     HttpServletRequest httpRequest) {
        String email = request != null ? request.email() : null;
        String password = request != null ? request.password() : null;
        return authenticationService.signIn(email, password, httpRequest.getRemoteAddr());
    }

    @PublicEndpoint
    @PostMapping(value = {"/sign-up"})
    public ResponseEntity<AuthenticationService.SignUpResult> signUp(@RequestBody AuthenticationService.SignUpPayload payload) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authenticationService.signUp(payload));
    }

    @PublicEndpoint
    @GetMapping(value = {"/roles"})
    public List<AuthenticationService.RoleOption> roles() {
        return authenticationService.rolesForSignUp();
    }

    @GetMapping(value = {"/profile"})
    public UserView profile() {
        return authenticationService.profile(SecurityContext.requireClaims());
    }
}
