package com.jreinhal.haven.model;

/**
 * Structural classification of a role inside the case workflow.
 *
 * Permission checks answer "may this identity call the operation"; the tier answers
 * ownership and visibility questions (own-report scoping, anonymous reporter disclosure,
 * assignability, urgent alert recipients).
 */
public enum CaseTier {
    /** Field staff filing reports. Sees and edits only their own reports. */
    REPORTER(true, false, false),
    /** Case handlers that can be assigned to a report. */
    ANALYST(false, true, false),
    /** Broad read access, no identity disclosure, not assignable. */
    REVIEWER(false, false, false),
    /** Management. Assignable, sees anonymous reporters, receives urgent alerts. */
    OVERSIGHT(false, true, true);

    private final boolean ownReportsOnly;
    private final boolean assignable;
    private final boolean identityRevealing;

    CaseTier(boolean ownReportsOnly, boolean assignable, boolean identityRevealing) {
        this.ownReportsOnly = ownReportsOnly;
        this.assignable = assignable;
        this.identityRevealing = identityRevealing;
    }

    public boolean isOwnReportsOnly() {
        return this.ownReportsOnly;
    }

    public boolean isAssignable() {
        return this.assignable;
    }

    public boolean isIdentityRevealing() {
        return this.identityRevealing;
    }

    public boolean receivesUrgentAlerts() {
        return this == OVERSIGHT;
    }
}
