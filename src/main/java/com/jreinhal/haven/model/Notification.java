package com.jreinhal.haven.model;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "notifications")
public class Notification {
    @Id
    private String id;
    @Indexed
    private String recipientId;
    private Category category;
    private String title;
    private String message;
    private String reportId;
    private boolean read;
    private Instant createdAt;

    public Notification() {
    }

    public Notification(String recipientId, Category category, String title, String message, String reportId) {
        this.recipientId = recipientId;
        this.category = category;
        this.title = title;
        this.message = message;
        this.reportId = reportId;
        this.read = false;
        this.createdAt = Instant.now();
    }

    public String getId() {
        return this.id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getRecipientId() {
        return this.recipientId;
    }

    public Category getCategory() {
        return this.category;
    }

    public String getTitle() {
        return this.title;
    }

    public String getMessage() {
        return this.message;
    }

    public String getReportId() {
        return this.reportId;
    }

    public boolean isRead() {
        return this.read;
    }

    public void setRead(boolean read) {
        this.read = read;
    }

    public Instant getCreatedAt() {
        return this.createdAt;
    }

    public enum Category {
        REPORT_ASSIGNED,
        REPORT_UPDATED,
        DOCUMENT_UPLOADED,
        REPORT_CLASSIFIED,
        URGENT_REPORT;
    }
}
