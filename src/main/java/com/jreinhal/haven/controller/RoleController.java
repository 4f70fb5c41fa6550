package com.jreinhal.haven.controller;

import com.jreinhal.haven.filter.SecurityContext;
import com.jreinhal.haven.model.Permission;
import com.jreinhal.haven.model.Role;
import com.jreinhal.haven.security.RequirePermissions;
import com.jreinhal.haven.service.RoleService;
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
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value = {"/api/roles"})
@Tag(name = "Roles")
public class RoleController {

    private final RoleService roleService;

    public RoleController(RoleService roleService) {
        this.roleService = roleService;
    }

    @GetMapping
    @RequirePermissions(Permission.ROLE_READ)
    public List<RoleService.RoleSummary> list() {
        return roleService.listRoles();
    }

    @GetMapping(value = {"/permissions"})
    @RequirePermissions(Permission.ROLE_READ)
    public List<String> availablePermissions() {
        return roleService.availablePermissions();
    }

    @GetMapping(value = {"/{id}"})
    @RequirePermissions(Permission.ROLE_READ)
    public RoleService.RoleSummary get(@PathVariable String id) {
        return roleService.getRole(id);
    }

    @PostMapping
    @RequirePermissions(Permission.ROLE_CREATE)
    public ResponseEntity<Role> create(@RequestBody RoleService.RolePayload payload) {
        Role role = roleService.createRole(payload, SecurityContext.getCurrentUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(role);
    }

    @PatchMapping(value = {"/{id}"})
    @RequirePermissions(Permission.ROLE_UPDATE)
    public Role update(@PathVariable String id, @RequestBody RoleService.RolePayload payload) {
        return roleService.updateRole(id, payload, SecurityContext.getCurrentUserId());
    }

    @DeleteMapping(value = {"/{id}"})
    @RequirePermissions(Permission.ROLE_DELETE)
    public ResponseEntity<Void> delete(@PathVariable String id) {
        roleService.deleteRole(id, SecurityContext.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }
}
