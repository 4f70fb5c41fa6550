package com.jreinhal.haven.controller;

import com.jreinhal.haven.filter.SecurityContext;
import com.jreinhal.haven.model.Permission;
import com.jreinhal.haven.model.UserStatus;
import com.jreinhal.haven.model.UserView;
import com.jreinhal.haven.security.RequirePermissions;
import com.jreinhal.haven.service.UserService;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value = {"/api/users"})
@Tag(name = "Users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    public record RoleChange(String roleId) {
    }

    @GetMapping
    @RequirePermissions(Permission.USER_READ)
    public List<UserView> list(@RequestParam(value = "status", required = false) UserStatus status) {
        return userService.listUsers(status);
    }

    @GetMapping(value = {"/{id}"})
    @RequirePermissions(Permission.USER_READ)
    public UserView get(@PathVariable String id) {
        return userService.getUser(id);
    }

    @PostMapping
    @RequirePermissions(Permission.USER_CREATE)
    public ResponseEntity<UserView> create(@RequestBody UserService.CreateUserPayload payload) {
        UserView created = userService.createUser(payload, SecurityContext.getCurrentUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PatchMapping(value = {"/{id}/role"})
    @RequirePermissions(Permission.USER_UPDATE)
    public UserView updateRole(@PathVariable String id, @RequestBody RoleChange body) {
        return userService.updateRole(id, body != null ? body.roleId() : null, SecurityContext.getCurrentUserId());
    }

    @PatchMapping(value = {"/{id}/approve"})
    @RequirePermissions(Permission.USER_MANAGE)
    public UserView approve(@PathVariable String id) {
        return userService.approve(id, SecurityContext.getCurrentUserId());
    }

    @PatchMapping(value = {"/{id}/reject"})
    @RequirePermissions(Permission.USER_MANAGE)
    public UserView reject(@PathVariable String id) {
        return userService.reject(id, SecurityContext.getCurrentUserId());
    }

    @DeleteMapping(value = {"/{id}"})
    @RequirePermissions(Permission.USER_DELETE)
    public ResponseEntity<Void> delete(@PathVariable String id) {
        userService.deleteUser(id, SecurityContext.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }
}
