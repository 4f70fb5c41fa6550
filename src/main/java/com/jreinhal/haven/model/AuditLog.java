package com.jreinhal.haven.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Append-only audit trail entry. Written by mutating operations, never updated.
 */
@Document(collection = "audit_log")
public class AuditLog {
    @Id
    private String id;
    @Indexed
    private Instant timestamp;
    @Indexed
    private Action action;
    @Indexed
    private String userId;
    @Indexed
    private String reportId;
    private String details;
    private String sourceIp;
    private Map<String, Object> metadata = new HashMap<>();

    public AuditLog() {
        this.timestamp = Instant.now();
    }

    public static AuditLog create(Action action, String userId, String details) {
        AuditLog entry = new AuditLog();
        entry.action = action;
        entry.userId = userId;
        entry.details = details;
        return entry;
    }

    public AuditLog withReport(String reportId) {
        this.reportId = reportId;
        return this;
    }

    public AuditLog withSourceIp(String sourceIp) {
        this.sourceIp = sourceIp;
        return this;
    }

    public AuditLog withMetadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, value);
        }
        return this;
    }

    public String getId() {
        return this.id;
    }

    public Instant getTimestamp() {
        return this.timestamp;
    }

    public Action getAction() {
        return this.action;
    }

    public String getUserId() {
        return this.userId;
    }

    public String getReportId() {
        return this.reportId;
    }

    public String getDetails() {
        return this.details;
    }

    public String getSourceIp() {
        return this.sourceIp;
    }

    public Map<String, Object> getMetadata() {
        return this.metadata;
    }

    public enum Action {
        REPORT_CREATED,
        REPORT_UPDATED,
        REPORT_ASSIGNED,
        REPORT_CLASSIFIED,
        REPORT_ARCHIVED,
        REPORT_DELETED,
        DOCUMENT_UPLOADED,
        DOCUMENT_DELETED,
        ROLE_CREATED,
        ROLE_UPDATED,
        ROLE_DELETED,
        USER_CREATED,
        USER_APPROVED,
        USER_REJECTED,
        USER_ROLE_CHANGED,
        USER_DELETED,
        AUTH_SUCCESS,
        AUTH_FAILURE;
    }
}
