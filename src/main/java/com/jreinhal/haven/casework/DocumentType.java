package com.jreinhal.haven.casework;

import com.jreinhal.haven.model.Permission;
import java.util.Locale;

/**
 * Procedure-step documents attached to a report, in procedure order. Each kind has its own
 * upload permission. Optional steps do not block the procedure.
 */
public enum DocumentType {
    FICHE_INITIAL(Permission.DOC_UPLOAD_FICHE_INITIAL, "Signalement initial", true),
    RAPPORT_DPE(Permission.DOC_UPLOAD_DPE, "Rapport DPE", true),
    EVALUATION(Permission.DOC_UPLOAD_EVALUATION, "Évaluation complète", true),
    PLAN_ACTION(Permission.DOC_UPLOAD_PLAN_ACTION, "Plan d'action", true),
    SUIVI(Permission.DOC_UPLOAD_SUIVI, "Rapport de suivi", false),
    RAPPORT_FINAL(Permission.DOC_UPLOAD_RAPPORT_FINAL, "Rapport final", true),
    /** "Avis de clôture". Required before a case can be archived. */
    CLOTURE(Permission.DOC_UPLOAD_CLOTURE, "Avis de clôture", false);

    private final Permission uploadPermission;
    private final String stepName;
    private final boolean required;

    DocumentType(Permission uploadPermission, String stepName, boolean required) {
        this.uploadPermission = uploadPermission;
        this.stepName = stepName;
        this.required = required;
    }

    public Permission getUploadPermission() {
        return this.uploadPermission;
    }

    public String getStepName() {
        return this.stepName;
    }

    public boolean isRequired() {
        return this.required;
    }

    /**
     * Resolve a path segment such as {@code rapport-dpe} or {@code CLOTURE}.
     */
    public static DocumentType fromSlug(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("Document type is required");
        }
        String normalized = slug.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (DocumentType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown document type: " + slug);
    }
}
