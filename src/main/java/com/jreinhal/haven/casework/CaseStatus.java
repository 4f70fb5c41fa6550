package com.jreinhal.haven.casework;

public enum CaseStatus {
    PENDING,
    IN_PROGRESS,
    FALSE_ALARM,
    CLOSED;

    public boolean isAssignable() {
        return this == PENDING || this == IN_PROGRESS;
    }

    public boolean isClassification() {
        return this == FALSE_ALARM || this == CLOSED;
    }
}
