package com.jreinhal.haven.controller;

import com.jreinhal.haven.model.Permission;
import com.jreinhal.haven.model.Village;
import com.jreinhal.haven.security.PublicEndpoint;
import com.jreinhal.haven.security.RequirePermissions;
import com.jreinhal.haven.service.VillageService;
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
@RequestMapping(value = {"/api/villages"})
@Tag(name = "Villages")
public class VillageController {

    private final VillageService villageService;

    public VillageController(VillageService villageService) {
        this.villageService = villageService;
    }

    // Sign-up needs the list before the caller has a credential.
    @PublicEndpoint
    @GetMapping
    public List<Village> list() {
        return villageService.listVillages();
    }

    @PublicEndpoint
    @GetMapping(value = {"/{id}"})
    public Village get(@PathVariable String id) {
        return villageService.getVillage(id);
    }

    @PostMapping
    @RequirePermissions(Permission.VILLAGE_CREATE)
    public ResponseEntity<Village> create(@RequestBody VillageService.VillagePayload payload) {
        return ResponseEntity.status(HttpStatus.CREATED).body(villageService.createVillage(payload));
    }

    @PatchMapping(value = {"/{id}"})
    @RequirePermissions(Permission.VILLAGE_UPDATE)
    public Village update(@PathVariable String id, @RequestBody VillageService.VillagePayload payload) {
        return villageService.updateVillage(id, payload);
    }

    @DeleteMapping(value = {"/{id}"})
    @RequirePermissions(Permission.VILLAGE_DELETE)
    public ResponseEntity<Void> delete(@PathVariable String id) {
        villageService.deleteVillage(id);
        return ResponseEntity.noContent().build();
    }
}
