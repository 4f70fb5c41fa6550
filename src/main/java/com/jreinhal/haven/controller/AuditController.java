package com.jreinhal.haven.controller;

import com.jreinhal.haven.model.AuditLog;
import com.jreinhal.haven.model.Permission;
import com.jreinhal.haven.security.RequirePermissions;
import com.jreinhal.haven.service.AuditService;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value = {"/api/audit"})
@Tag(name = "Audit")
public class AuditController {
    static final int MAX_LIMIT = 500;

    private final AuditService auditService;

    public AuditController(AuditService auditService) {
        this.auditService = auditService;
    }

    @GetMapping
    @RequirePermissions(Permission.AUDIT_READ)
    public Map<String, Object> recentEntries(@RequestParam(value = "limit", defaultValue = "100") int limit,
                                             @RequestParam(value = "reportId", required = false) String reportId) {
        if (limit > MAX_LIMIT) {
            limit = MAX_LIMIT;
        }
        if (limit < 1) {
            limit = 1;
        }
        List<AuditLog> entries = this.auditService.getRecentEntries(limit, reportId);
        HashMap<String, Object> response = new HashMap<>();
        response.put("count", entries.size());
        response.put("entries", entries);
        return response;
    }
}
