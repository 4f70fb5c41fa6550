package com.jreinhal.haven.casework;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Procedure-step document filed against a report.
 */
@Document(collection = "case_documents")
@CompoundIndex(name = "report_type_idx", def = "{'reportId': 1, 'type': 1}")
public class CaseDocument {
    @Id
    private String id;
    private DocumentType type;
    private String fileUrl;
    private String filename;
    private String uploadedBy;
    private String reportId;
    private Instant createdAt;

    public CaseDocument() {
    }

    public CaseDocument(DocumentType type, String fileUrl, String filename, String uploadedBy, String reportId) {
        this.type = type;
        this.fileUrl = fileUrl;
        this.filename = filename;
        this.uploadedBy = uploadedBy;
        this.reportId = reportId;
        this.createdAt = Instant.now();
    }

    public String getId() {
        return this.id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public DocumentType getType() {
        return this.type;
    }

    public String getFileUrl() {
        return this.fileUrl;
    }

    public String getFilename() {
        return this.filename;
    }

    public String getUploadedBy() {
        return this.uploadedBy;
    }

    public String getReportId() {
        return this.reportId;
    }

    public Instant getCreatedAt() {
        return this.createdAt;
    }
}
