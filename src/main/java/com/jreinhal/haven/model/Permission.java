package com.jreinhal.haven.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Closed vocabulary of capability strings that roles may grant.
 *
 * Roles persist permissions by {@link #name()}; tokens carry the same strings.
 */
public enum Permission {
    REPORT_CREATE,
    REPORT_READ,
    REPORT_UPDATE,
    REPORT_DELETE,
    REPORT_CLASSIFY,
    REPORT_ASSIGN,
    CASE_CLOSE,

    DOC_UPLOAD_FICHE_INITIAL,
    DOC_UPLOAD_DPE,
    DOC_UPLOAD_EVALUATION,
    DOC_UPLOAD_PLAN_ACTION,
    DOC_UPLOAD_SUIVI,
    DOC_UPLOAD_RAPPORT_FINAL,
    DOC_UPLOAD_CLOTURE,
    DOC_READ,
    DOC_DELETE,

    USER_READ,
    USER_CREATE,
    USER_UPDATE,
    USER_DELETE,
    USER_MANAGE,

    ROLE_CREATE,
    ROLE_READ,
    ROLE_UPDATE,
    ROLE_DELETE,

    VILLAGE_CREATE,
    VILLAGE_READ,
    VILLAGE_UPDATE,
    VILLAGE_DELETE,

    AUDIT_READ,
    STATS_VIEW;

    public static Optional<Permission> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Permission permission : values()) {
            if (permission.name().equals(value)) {
                return Optional.of(permission);
            }
        }
        return Optional.empty();
    }

    public static boolean isKnown(String value) {
        return fromValue(value).isPresent();
    }

    public static List<String> catalog() {
        return Arrays.stream(values()).map(Enum::name).toList();
    }
}
