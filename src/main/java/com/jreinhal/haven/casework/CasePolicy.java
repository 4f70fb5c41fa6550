package com.jreinhal.haven.casework;

import com.jreinhal.haven.model.Role;
import com.jreinhal.haven.security.TokenClaims;
import org.springframework.stereotype.Component;

/**
 * Ownership and visibility rules of the case workflow, decided from the caller's tier claim.
 */
@Component
public class CasePolicy {

    public boolean isReporter(TokenClaims actor, CaseRecord record) {
        return actor != null && record.getReporterId() != null && record.getReporterId().equals(actor.subjectId());
    }

    /**
     * Reporter-tier callers only see their own reports.
     */
    public boolean canRead(TokenClaims actor, CaseRecord record) {
        return actor != null && (!actor.isOwnReportsOnly() || isReporter(actor, record));
    }

    public boolean canUpdate(TokenClaims actor, CaseRecord record) {
        return canRead(actor, record);
    }

    /**
     * Whether the true reporter identity may appear in a read result.
     */
    public boolean revealsReporter(TokenClaims actor, CaseRecord record) {
        return !record.isAnonymous() || isReporter(actor, record) || (actor != null && actor.isIdentityRevealing());
    }

    public boolean isAssignable(Role role) {
        return role != null && role.getTier() != null && role.getTier().isAssignable();
    }
}
