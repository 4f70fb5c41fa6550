package com.jreinhal.haven.casework;

/**
 * Outcome recorded when a case is formally closed and archived.
 */
public enum ClosureDecision {
    /** Child taken into care. */
    PRISE_EN_CHARGE,
    SANCTION,
    /** Continued monitoring. */
    SUIVI
}
