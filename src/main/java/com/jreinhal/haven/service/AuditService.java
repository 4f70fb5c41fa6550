package com.jreinhal.haven.service;

import com.jreinhal.haven.filter.CorrelationIdFilter;
import com.jreinhal.haven.model.AuditLog;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

/**
 * Writes the append-only audit trail.
 *
 * Writes are best-effort unless {@code app.audit.fail-closed} is set, in which case a
 * failed write aborts the calling operation.
 */
@Service
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);
    static final String COLLECTION = "audit_log";
    private final MongoTemplate mongoTemplate;
    @Value("${app.audit.fail-closed:false}")
    private boolean failClosed;

    public AuditService(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void log(AuditLog entry) {
        entry.withMetadata("correlationId", CorrelationIdFilter.currentCorrelationId());
        if (entry.getSourceIp() == null) {
            entry.withSourceIp(CorrelationIdFilter.currentClientIp());
        }
        try {
            this.mongoTemplate.save(entry, COLLECTION);
            log.debug("Audit entry logged: {} - {} - {}", entry.getAction(), entry.getUserId(), entry.getReportId());
        } catch (Exception e) {
            log.error("CRITICAL: Failed to persist audit entry: {} - {}", entry.getAction(), e.getMessage());
            if (this.failClosed) {
                throw new AuditFailureException("Audit logging failed - operation halted. Action: " + entry.getAction(), e);
            }
        }
    }

    public void logCaseAction(AuditLog.Action action, String userId, String reportId, String details) {
        this.log(AuditLog.create(action, userId, details).withReport(reportId));
    }

    public void logAdminAction(AuditLog.Action action, String userId, String details) {
        this.log(AuditLog.create(action, userId, details));
    }

    public void logAuthSuccess(String userId, String sourceIp) {
        this.log(AuditLog.create(AuditLog.Action.AUTH_SUCCESS, userId, "User signed in").withSourceIp(sourceIp));
    }

    public void logAuthFailure(String attemptedEmail, String reason, String sourceIp) {
        this.log(AuditLog.create(AuditLog.Action.AUTH_FAILURE, null, "Sign-in refused: " + reason)
                .withSourceIp(sourceIp)
                .withMetadata("attemptedEmail", attemptedEmail));
    }

    /**
     * Newest entries first, optionally restricted to one report.
     */
    public List<AuditLog> getRecentEntries(int limit, String reportId) {
        Query query = reportId != null && !reportId.isBlank()
                ? new Query(Criteria.where("reportId").is(reportId))
                : new Query();
        query.with(Sort.by(Sort.Direction.DESC, "timestamp")).limit(limit);
        return this.mongoTemplate.find(query, AuditLog.class, COLLECTION);
    }

    public static class AuditFailureException extends RuntimeException {
        public AuditFailureException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
