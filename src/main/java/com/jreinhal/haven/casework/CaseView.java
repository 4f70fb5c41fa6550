package com.jreinhal.haven.casework;

import java.time.Instant;
import java.util.List;

/**
 * Read model of a report. The raw reporter id is never exposed; {@code reporter} is either
 * the real identity or {@link PersonSummary#ANONYMOUS}.
 */
public record CaseView(
        String id,
        IncidentType incidentType,
        Urgency urgency,
        boolean anonymous,
        String villageId,
        String childName,
        String abuserName,
        String description,
        List<Attachment> attachments,
        CaseStatus status,
        PersonSummary reporter,
        PersonSummary analyst,
        boolean archived,
        ClosureDecision closureDecision,
        String closureNotes,
        String classificationReason,
        String notes,
        Instant closedAt,
        Instant createdAt,
        Instant updatedAt) {

    static CaseView of(CaseRecord record, PersonSummary reporter, PersonSummary analyst) {
        return new CaseView(
                record.getId(),
                record.getIncidentType(),
                record.getUrgency(),
                record.isAnonymous(),
                record.getVillageId(),
                record.getChildName(),
                record.getAbuserName(),
                record.getDescription(),
                List.copyOf(record.getAttachments()),
                record.getStatus(),
                reporter,
                analyst,
                record.isArchived(),
                record.getClosureDecision(),
                record.getClosureNotes(),
                record.getClassificationReason(),
                record.getNotes(),
                record.getClosedAt(),
                record.getCreatedAt(),
                record.getUpdatedAt());
    }
}
