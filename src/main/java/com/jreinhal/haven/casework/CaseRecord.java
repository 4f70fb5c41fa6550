package com.jreinhal.haven.casework;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Incident report tracked through the case workflow.
 *
 * <p>{@code archived} is terminal: once set, the record is never written again.
 * {@link #version} turns concurrent stale writes into optimistic-lock failures.</p>
 */
@Document(collection = "reports")
public class CaseRecord {

    @Id
    private String id;

    @Version
    private Long version;

    private IncidentType incidentType;

    @Indexed
    private Urgency urgency;

    private boolean anonymous;

    @Indexed
    private String villageId;

    private String childName;

    private String abuserName;

    private String description;

    private List<Attachment> attachments = new ArrayList<>();

    @Indexed
    private CaseStatus status = CaseStatus.PENDING;

    @Indexed
    private String reporterId;

    @Indexed
    private String analystId;

    private boolean archived;

    private ClosureDecision closureDecision;

    private String closureNotes;

    private String classificationReason;

    private String notes;

    private Instant closedAt;

    @Indexed
    private Instant createdAt;

    private Instant updatedAt;

    public CaseRecord() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    public IncidentType getIncidentType() {
        return incidentType;
    }

    public void setIncidentType(IncidentType incidentType) {
        this.incidentType = incidentType;
    }

    public Urgency getUrgency() {
        return urgency;
    }

    public void setUrgency(Urgency urgency) {
        this.urgency = urgency;
    }

    public boolean isAnonymous() {
        return anonymous;
    }

    public void setAnonymous(boolean anonymous) {
        this.anonymous = anonymous;
    }

    public String getVillageId() {
        return villageId;
    }

    public void setVillageId(String villageId) {
        this.villageId = villageId;
    }

    public String getChildName() {
        return childName;
    }

    public void setChildName(String childName) {
        this.childName = childName;
    }

    public String getAbuserName() {
        return abuserName;
    }

    public void setAbuserName(String abuserName) {
        this.abuserName = abuserName;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<Attachment> getAttachments() {
        return attachments == null ? Collections.emptyList() : Collections.unmodifiableList(attachments);
    }

    public void setAttachments(List<Attachment> attachments) {
        this.attachments = attachments == null ? new ArrayList<>() : new ArrayList<>(attachments);
    }

    /**
     * Attachments only ever accumulate.
     */
    public void appendAttachments(List<Attachment> added) {
        if (added == null || added.isEmpty()) {
            return;
        }
        if (this.attachments == null) {
            this.attachments = new ArrayList<>();
        }
        this.attachments.addAll(added);
    }

    public CaseStatus getStatus() {
        return status;
    }

    public void setStatus(CaseStatus status) {
        this.status = status;
    }

    public String getReporterId() {
        return reporterId;
    }

    public void setReporterId(String reporterId) {
        this.reporterId = reporterId;
    }

    public String getAnalystId() {
        return analystId;
    }

    public void setAnalystId(String analystId) {
        this.analystId = analystId;
    }

    public boolean isArchived() {
        return archived;
    }

    public void setArchived(boolean archived) {
        this.archived = archived;
    }

    public ClosureDecision getClosureDecision() {
        return closureDecision;
    }

    public void setClosureDecision(ClosureDecision closureDecision) {
        this.closureDecision = closureDecision;
    }

    public String getClosureNotes() {
        return closureNotes;
    }

    public void setClosureNotes(String closureNotes) {
        this.closureNotes = closureNotes;
    }

    public String getClassificationReason() {
        return classificationReason;
    }

    public void setClassificationReason(String classificationReason) {
        this.classificationReason = classificationReason;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    public void setClosedAt(Instant closedAt) {
        this.closedAt = closedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
