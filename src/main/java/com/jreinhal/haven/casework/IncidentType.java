package com.jreinhal.haven.casework;

public enum IncidentType {
    HEALTH,
    BEHAVIOR,
    VIOLENCE,
    SEXUAL_ABUSE,
    NEGLECT,
    CONFLICT,
    OTHER
}
