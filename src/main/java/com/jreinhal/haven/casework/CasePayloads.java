package com.jreinhal.haven.casework;

import com.jreinhal.haven.model.AuditLog;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Request and response bodies of the case workflow.
 */
public final class CasePayloads {

    private CasePayloads() {
    }

    public record CreateCase(IncidentType incidentType, Urgency urgency, Boolean isAnonymous, String villageId,
                             String childName, String abuserName, String description) {
    }

    /**
     * General edit. Null fields are left unchanged. Status and anonymity are not editable here.
     */
    public record UpdateCase(IncidentType incidentType, Urgency urgency, String villageId, String childName,
                             String abuserName, String description, String notes) {
    }

    public record Assign(String analystId) {
    }

    public record Classify(CaseStatus classification, String reason) {
    }

    public record Close(ClosureDecision closureDecision, String closureNotes) {
    }

    public record AnalyzeText(String description) {
    }

    public record CasePage(List<CaseView> data, long total, int limit, int offset) {
    }

    public record CaseStatistics(long total, Map<CaseStatus, Long> byStatus, Map<IncidentType, Long> byType,
                                 Map<Urgency, Long> byUrgency) {
    }

    /**
     * Procedure progress of one report. Every step counts toward the percentage; the delay
     * target depends on urgency.
     */
    public record CaseProgress(String reportId, CaseStatus status, Urgency urgency, Instant createdAt, Instant closedAt,
                               int percentage, int completedSteps, int totalSteps, long daysSinceCreation,
                               int expectedDays, boolean delayed, List<ProcedureStep> steps, List<TimelineEntry> timeline) {
    }

    public record ProcedureStep(DocumentType type, String step, boolean required, boolean completed,
                                Instant completedAt, String uploadedBy) {
    }

    public record TimelineEntry(AuditLog.Action action, String details, Instant timestamp, String userId) {
    }
}
