package com.jreinhal.haven.casework;

import java.time.Instant;

/**
 * List filters. Null fields are ignored. {@code analystId} may be {@value #CALLER}, meaning
 * the reports assigned to the caller.
 */
public record CaseQuery(
        String villageId,
        String analystId,
        CaseStatus status,
        IncidentType incidentType,
        Urgency urgency,
        Boolean archived,
        Instant dateFrom,
        Instant dateTo,
        Integer limit,
        Integer offset) {

    public static final String CALLER = "me";
}
