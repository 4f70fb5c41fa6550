package com.jreinhal.haven.casework;

import com.jreinhal.haven.exception.HavenException;
import com.jreinhal.haven.model.AuditLog;
import com.jreinhal.haven.repository.CaseDocumentRepository;
import com.jreinhal.haven.security.TokenClaims;
import com.jreinhal.haven.service.AuditService;
import com.jreinhal.haven.storage.FileStorageService;
import com.jreinhal.haven.storage.IncomingFile;
import com.jreinhal.haven.storage.StoredFile;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Procedure-step documents of a report. Uploading a {@link DocumentType#CLOTURE} document
 * is what unlocks {@link CaseService#close}.
 */
@Service
public class CaseDocumentService {
    private static final Logger log = LoggerFactory.getLogger(CaseDocumentService.class);
    static final String ARCHIVED_UPLOAD_ERROR = "Cannot add documents to archived report. Case is closed and sealed.";

    private final CaseService caseService;
    private final CaseDocumentRepository documentRepository;
    private final CasePolicy casePolicy;
    private final FileStorageService fileStorageService;
    private final AuditService auditService;
    private final CaseEventSink eventSink;

    public CaseDocumentService(CaseService caseService, CaseDocumentRepository documentRepository, CasePolicy casePolicy,
                               FileStorageService fileStorageService, AuditService auditService, CaseEventSink eventSink) {
        this.caseService = caseService;
        this.documentRepository = documentRepository;
        this.casePolicy = casePolicy;
        this.fileStorageService = fileStorageService;
        this.auditService = auditService;
        this.eventSink = eventSink;
    }

    /**
     * The archive seal is checked first, then ownership, then the upload itself.
     */
    public CaseDocument upload(String reportId, DocumentType type, IncomingFile file, TokenClaims actor) {
        CaseRecord record = caseService.requireCase(reportId);
        if (record.isArchived()) {
            throw HavenException.archivedImmutable(ARCHIVED_UPLOAD_ERROR);
        }
        if (!casePolicy.canUpdate(actor, record)) {
            throw HavenException.permissionDenied("You can only add documents to your own reports");
        }
        if (type == null) {
            throw HavenException.invalidArgument("Document type is required");
        }
        if (file == null || file.size() == 0) {
            throw HavenException.invalidArgument("No file uploaded");
        }
        fileStorageService.checkPolicy(file.contentType(), file.size());
        StoredFile stored = fileStorageService.store(file);
        CaseDocument document;
        try {
            document = documentRepository.save(
                    new CaseDocument(type, stored.url(), stored.filename(), actor.subjectId(), record.getId()));
        } catch (RuntimeException e) {
            fileStorageService.discard(stored);
            throw e;
        }
        log.info("Document {} ({}) uploaded to report {} by {}", document.getId(), type, record.getId(), actor.subjectId());
        auditService.logCaseAction(AuditLog.Action.DOCUMENT_UPLOADED, actor.subjectId(), record.getId(),
                "Document " + type + " uploaded: " + stored.filename());
        String analystId = record.getAnalystId();
        if (analystId != null && !analystId.equals(actor.subjectId())) {
            try {
                eventSink.documentAttached(record, type, analystId);
            } catch (RuntimeException e) {
                log.warn("Document notification for report {} failed: {}", record.getId(), e.getMessage());
            }
        }
        return document;
    }

    public List<CaseDocument> listByReport(String reportId, TokenClaims actor) {
        CaseRecord record = caseService.requireCase(reportId);
        if (!casePolicy.canRead(actor, record)) {
            throw HavenException.permissionDenied("You can only view documents of your own reports");
        }
        return documentRepository.findByReportIdOrderByCreatedAtDesc(record.getId());
    }

    public CaseDocument get(String documentId, TokenClaims actor) {
        CaseDocument document = requireDocument(documentId);
        CaseRecord record = caseService.requireCase(document.getReportId());
        if (!casePolicy.canRead(actor, record)) {
            throw HavenException.permissionDenied("You can only view documents of your own reports");
        }
        return document;
    }

    /**
     * Removes the document record. Documents of an archived report are part of the sealed
     * case file and cannot be removed.
     */
    public void delete(String documentId, TokenClaims actor) {
        CaseDocument document = requireDocument(documentId);
        CaseRecord record = caseService.requireCase(document.getReportId());
        if (record.isArchived()) {
            throw HavenException.archivedImmutable("Cannot delete documents of archived report. Case is closed and sealed.");
        }
        auditService.logCaseAction(AuditLog.Action.DOCUMENT_DELETED, actor.subjectId(), record.getId(),
                "Document " + document.getType() + " deleted: " + document.getFilename());
        documentRepository.delete(document);
    }

    private CaseDocument requireDocument(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw HavenException.notFound("Document not found");
        }
        return documentRepository.findById(documentId).orElseThrow(() -> HavenException.notFound("Document not found"));
    }
}
