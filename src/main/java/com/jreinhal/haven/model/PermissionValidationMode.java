package com.jreinhal.haven.model;

/**
 * How role writes treat permission strings that are not in {@link Permission}.
 */
public enum PermissionValidationMode {
    /** Unknown strings are rejected. */
    STRICT,
    /** Unknown strings are stored as-is and logged. */
    LENIENT
}
