package com.jreinhal.haven.casework;

import com.jreinhal.haven.anonymizer.VoiceAnonymizationException;
import com.jreinhal.haven.anonymizer.VoiceAnonymizerClient;
import com.jreinhal.haven.exception.HavenException;
import com.jreinhal.haven.model.AuditLog;
import com.jreinhal.haven.model.CaseTier;
import com.jreinhal.haven.model.Role;
import com.jreinhal.haven.model.User;
import com.jreinhal.haven.model.UserStatus;
import com.jreinhal.haven.repository.CaseDocumentRepository;
import com.jreinhal.haven.repository.CaseRecordRepository;
import com.jreinhal.haven.repository.RoleRepository;
import com.jreinhal.haven.repository.UserRepository;
import com.jreinhal.haven.repository.VillageRepository;
import com.jreinhal.haven.security.TokenClaims;
import com.jreinhal.haven.service.AuditService;
import com.jreinhal.haven.storage.FileStorageService;
import com.jreinhal.haven.storage.IncomingFile;
import com.jreinhal.haven.storage.StoredFile;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

/**
 * Report lifecycle: create, assign, update, classify, close (archive) and delete.
 *
 * <p>Status moves {@code PENDING -> IN_PROGRESS -> FALSE_ALARM | CLOSED}. Closing archives
 * the report, after which every mutation fails with ARCHIVED_IMMUTABLE before any other
 * check. Audit entries follow the state change, except for delete where the entry is
 * written first.</p>
 */
@Service
public class CaseService {
    private static final Logger log = LoggerFactory.getLogger(CaseService.class);
    static final String COLLECTION = "reports";
    static final String ARCHIVED_ERROR = "Cannot modify archived report. Case is closed and sealed.";
    static final String ANONYMIZATION_ERROR = "Voice anonymization failed for anonymous report. Ensure the voice anonymizer service is running.";
    static final String MISSING_CLOSURE_DOCUMENT = "Cannot close case without \"Avis de cloture\" document. "
            + "Upload the closure document via POST /api/documents/reports/{id}/cloture first.";
    private static final int MAX_TEXT_LENGTH = 5000;
    private static final int MAX_NAME_LENGTH = 200;
    private static final int TIMELINE_LIMIT = 200;

    private final CaseRecordRepository caseRecordRepository;
    private final CaseDocumentRepository documentRepository;
    private final UserRepository userRepository;
    private final RoleRepository roleRepository;
    private final VillageRepository villageRepository;
    private final MongoTemplate mongoTemplate;
    private final CasePolicy casePolicy;
    private final FileStorageService fileStorageService;
    private final VoiceAnonymizerClient voiceAnonymizer;
    private final AuditService auditService;
    private final CaseEventSink eventSink;

    private Clock clock = Clock.systemUTC();

    @Value("${app.casework.list-default-limit:50}")
    private int defaultLimit = 50;

    @Value("${app.casework.list-max-limit:100}")
    private int maxLimit = 100;

    public CaseService(CaseRecordRepository caseRecordRepository, CaseDocumentRepository documentRepository,
                       UserRepository userRepository, RoleRepository roleRepository, VillageRepository villageRepository,
                       MongoTemplate mongoTemplate, CasePolicy casePolicy, FileStorageService fileStorageService,
                       VoiceAnonymizerClient voiceAnonymizer, AuditService auditService, CaseEventSink eventSink) {
        this.caseRecordRepository = caseRecordRepository;
        this.documentRepository = documentRepository;
        this.userRepository = userRepository;
        this.roleRepository = roleRepository;
        this.villageRepository = villageRepository;
        this.mongoTemplate = mongoTemplate;
        this.casePolicy = casePolicy;
        this.fileStorageService = fileStorageService;
        this.voiceAnonymizer = voiceAnonymizer;
        this.auditService = auditService;
        this.eventSink = eventSink;
    }

    public CaseView create(CasePayloads.CreateCase payload, List<IncomingFile> files, TokenClaims actor) {
        if (payload == null) {
            throw HavenException.invalidArgument("Report payload is required");
        }
        if (payload.incidentType() == null) {
            throw HavenException.invalidArgument("incidentType is required");
        }
        if (payload.urgency() == null) {
            throw HavenException.invalidArgument("urgency is required");
        }
        String villageId = requireText(payload.villageId(), "villageId", MAX_NAME_LENGTH);
        String childName = requireText(payload.childName(), "childName", MAX_NAME_LENGTH);
        String description = requireText(payload.description(), "description", MAX_TEXT_LENGTH);
        if (!villageRepository.existsById(villageId)) {
            throw HavenException.notFound("Village not found");
        }
        User reporter = userRepository.findById(actor.subjectId())
                .orElseThrow(() -> HavenException.notFound("Reporter not found"));
        boolean anonymous = Boolean.TRUE.equals(payload.isAnonymous());

        List<Attachment> attachments = storeAttachments(files, anonymous);

        Instant now = Instant.now();
        CaseRecord record = new CaseRecord();
        record.setIncidentType(payload.incidentType());
        record.setUrgency(payload.urgency());
        record.setAnonymous(anonymous);
        record.setVillageId(villageId);
        record.setChildName(childName);
        record.setAbuserName(optionalText(payload.abuserName(), MAX_NAME_LENGTH));
        record.setDescription(description);
        record.setAttachments(attachments);
        record.setStatus(CaseStatus.PENDING);
        record.setReporterId(reporter.getId());
        record.setArchived(false);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        CaseRecord saved = caseRecordRepository.save(record);
        log.info("Report {} created (urgency={}, anonymous={}, attachments={})", saved.getId(), saved.getUrgency(),
                anonymous, attachments.size());
        auditService.logCaseAction(AuditLog.Action.REPORT_CREATED, actor.subjectId(), saved.getId(),
                "Report created with urgency " + saved.getUrgency());

        if (saved.getUrgency().isUrgent()) {
            List<String> recipients = oversightRecipients();
            publish("urgentCaseReported", () -> eventSink.urgentCaseReported(saved, recipients));
        }
        return toView(saved, actor, reporter, null);
    }

    public CasePayloads.CasePage list(CaseQuery query, TokenClaims actor) {
        CaseQuery filters = query != null ? query : new CaseQuery(null, null, null, null, null, null, null, null, null, null);
        int limit = filters.limit() == null || filters.limit() <= 0 ? defaultLimit : Math.min(filters.limit(), maxLimit);
        int offset = filters.offset() == null || filters.offset() < 0 ? 0 : filters.offset();

        List<Criteria> criteria = new ArrayList<>();
        if (actor.isOwnReportsOnly()) {
            criteria.add(Criteria.where("reporterId").is(actor.subjectId()));
        }
        if (filters.villageId() != null && !filters.villageId().isBlank()) {
            criteria.add(Criteria.where("villageId").is(filters.villageId()));
        }
        if (filters.analystId() != null && !filters.analystId().isBlank()) {
            String analystId = CaseQuery.CALLER.equals(filters.analystId()) ? actor.subjectId() : filters.analystId();
            criteria.add(Criteria.where("analystId").is(analystId));
        }
        if (filters.status() != null) {
            criteria.add(Criteria.where("status").is(filters.status()));
        }
        if (filters.incidentType() != null) {
            criteria.add(Criteria.where("incidentType").is(filters.incidentType()));
        }
        if (filters.urgency() != null) {
            criteria.add(Criteria.where("urgency").is(filters.urgency()));
        }
        if (filters.archived() != null) {
            criteria.add(Criteria.where("archived").is(filters.archived()));
        }
        if (filters.dateFrom() != null || filters.dateTo() != null) {
            Criteria created = Criteria.where("createdAt");
            if (filters.dateFrom() != null) {
                created = created.gte(filters.dateFrom());
            }
            if (filters.dateTo() != null) {
                created = created.lte(filters.dateTo());
            }
            criteria.add(created);
        }
        Query mongoQuery = criteria.isEmpty() ? new Query() : new Query(new Criteria().andOperator(criteria.toArray(new Criteria[0])));
        long total = mongoTemplate.count(mongoQuery, CaseRecord.class, COLLECTION);
        mongoQuery.with(Sort.by(Sort.Direction.DESC, "createdAt")).skip(offset).limit(limit);
        List<CaseRecord> records = mongoTemplate.find(mongoQuery, CaseRecord.class, COLLECTION);

        Set<String> personIds = new HashSet<>();
        for (CaseRecord record : records) {
            if (record.getReporterId() != null) {
                personIds.add(record.getReporterId());
            }
            if (record.getAnalystId() != null) {
                personIds.add(record.getAnalystId());
            }
        }
        Map<String, User> people = new HashMap<>();
        if (!personIds.isEmpty()) {
            userRepository.findAllById(personIds).forEach(user -> people.put(user.getId(), user));
        }
        List<CaseView> views = records.stream()
                .map(record -> toView(record, actor, people.get(record.getReporterId()),
                        record.getAnalystId() != null ? people.get(record.getAnalystId()) : null))
                .toList();
        return new CasePayloads.CasePage(views, total, limit, offset);
    }

    public CaseView get(String id, TokenClaims actor) {
        CaseRecord record = requireCase(id);
        if (!casePolicy.canRead(actor, record)) {
            throw HavenException.permissionDenied("You can only view your own reports");
        }
        return toView(record, actor);
    }

    /**
     * Which procedure documents are on file, how far along the report is, and whether it has
     * been open longer than its urgency allows. The timeline hides the reporter of an
     * anonymous report from callers who may not see it.
     */
    public CasePayloads.CaseProgress progress(String id, TokenClaims actor) {
        CaseRecord record = requireCase(id);
        if (!casePolicy.canRead(actor, record)) {
            throw HavenException.permissionDenied("You can only view your own reports");
        }
        Map<DocumentType, CaseDocument> firstByType = new EnumMap<>(DocumentType.class);
        for (CaseDocument document : documentRepository.findByReportIdOrderByCreatedAtAsc(record.getId())) {
            if (document.getType() != null) {
                firstByType.putIfAbsent(document.getType(), document);
            }
        }
        List<CasePayloads.ProcedureStep> steps = new ArrayList<>();
        for (DocumentType type : DocumentType.values()) {
            CaseDocument done = firstByType.get(type);
            steps.add(new CasePayloads.ProcedureStep(type, type.getStepName(), type.isRequired(), done != null,
                    done != null ? done.getCreatedAt() : null, done != null ? done.getUploadedBy() : null));
        }
        int total = steps.size();
        int completed = firstByType.size();
        int percentage = Math.round(completed * 100f / total);

        Instant end = record.getClosedAt() != null ? record.getClosedAt() : clock.instant();
        long days = record.getCreatedAt() == null ? 0 : Math.max(0, Duration.between(record.getCreatedAt(), end).toDays());
        int expectedDays = record.getUrgency() != null ? record.getUrgency().getExpectedHandlingDays()
                : Urgency.LOW.getExpectedHandlingDays();

        boolean revealReporter = casePolicy.revealsReporter(actor, record);
        List<AuditLog> entries = new ArrayList<>(auditService.getRecentEntries(TIMELINE_LIMIT, record.getId()));
        Collections.reverse(entries);
        List<CasePayloads.TimelineEntry> timeline = entries.stream()
                .map(entry -> new CasePayloads.TimelineEntry(entry.getAction(), entry.getDetails(), entry.getTimestamp(),
                        !revealReporter && entry.getUserId() != null && entry.getUserId().equals(record.getReporterId())
                                ? null : entry.getUserId()))
                .toList();
        return new CasePayloads.CaseProgress(record.getId(), record.getStatus(), record.getUrgency(), record.getCreatedAt(),
                record.getClosedAt(), percentage, completed, total, days, expectedDays, days > expectedDays, steps, timeline);
    }

    public CaseView update(String id, CasePayloads.UpdateCase payload, List<IncomingFile> files, TokenClaims actor) {
        CaseRecord record = requireCase(id);
        requireNotArchived(record);
        if (!casePolicy.canUpdate(actor, record)) {
            throw HavenException.permissionDenied("You can only update your own reports");
        }
        if (payload != null) {
            if (payload.villageId() != null) {
                String villageId = requireText(payload.villageId(), "villageId", MAX_NAME_LENGTH);
                if (!villageRepository.existsById(villageId)) {
                    throw HavenException.notFound("Village not found");
                }
                record.setVillageId(villageId);
            }
            if (payload.incidentType() != null) {
                record.setIncidentType(payload.incidentType());
            }
            if (payload.urgency() != null) {
                record.setUrgency(payload.urgency());
            }
            if (payload.childName() != null) {
                record.setChildName(requireText(payload.childName(), "childName", MAX_NAME_LENGTH));
            }
            if (payload.abuserName() != null) {
                record.setAbuserName(optionalText(payload.abuserName(), MAX_NAME_LENGTH));
            }
            if (payload.description() != null) {
                record.setDescription(requireText(payload.description(), "description", MAX_TEXT_LENGTH));
            }
            if (payload.notes() != null) {
                record.setNotes(optionalText(payload.notes(), MAX_TEXT_LENGTH));
            }
        }
        record.appendAttachments(storeAttachments(files, record.isAnonymous()));
        record.setUpdatedAt(Instant.now());
        CaseRecord saved = caseRecordRepository.save(record);
        auditService.logCaseAction(AuditLog.Action.REPORT_UPDATED, actor.subjectId(), saved.getId(), "Report updated");
        String analystId = saved.getAnalystId();
        if (analystId != null && !analystId.equals(actor.subjectId())) {
            publish("caseUpdated", () -> eventSink.caseUpdated(saved, analystId));
        }
        return toView(saved, actor);
    }

    public CaseView assign(String id, CasePayloads.Assign payload, TokenClaims actor) {
        CaseRecord record = requireCase(id);
        requireNotArchived(record);
        if (!record.getStatus().isAssignable()) {
            throw HavenException.failedPrecondition("Only pending or in-progress reports can be assigned (current status: "
                    + record.getStatus() + ")");
        }
        String analystId = payload == null ? null : payload.analystId();
        if (analystId == null || analystId.isBlank()) {
            throw HavenException.invalidArgument("analystId is required");
        }
        User analyst = userRepository.findById(analystId)
                .orElseThrow(() -> HavenException.notFound("Analyst not found"));
        Role role = analyst.getRoleId() != null ? roleRepository.findById(analyst.getRoleId()).orElse(null) : null;
        if (!casePolicy.isAssignable(role)) {
            throw HavenException.invalidArgument("User must hold an analyst or oversight role to be assigned");
        }
        if (analyst.getStatus() != UserStatus.APPROVED) {
            throw HavenException.invalidArgument("User account is not approved");
        }
        record.setAnalystId(analyst.getId());
        record.setStatus(CaseStatus.IN_PROGRESS);
        record.setUpdatedAt(Instant.now());
        CaseRecord saved = caseRecordRepository.save(record);
        log.info("Report {} assigned to {} by {}", saved.getId(), analyst.getId(), actor.subjectId());
        auditService.logCaseAction(AuditLog.Action.REPORT_ASSIGNED, actor.subjectId(), saved.getId(),
                "Report assigned to " + analyst.getId());
        publish("caseAssigned", () -> eventSink.caseAssigned(saved, analyst.getId()));
        return toView(saved, actor);
    }

    /**
     * Soft close. Sets {@code closedAt} but leaves the report open to edits.
     */
    public CaseView classify(String id, CasePayloads.Classify payload, TokenClaims actor) {
        CaseRecord record = requireCase(id);
        requireNotArchived(record);
        CaseStatus classification = payload == null ? null : payload.classification();
        if (classification == null || !classification.isClassification()) {
            throw HavenException.invalidArgument("classification must be FALSE_ALARM or CLOSED");
        }
        String reason = requireText(payload.reason(), "reason", MAX_TEXT_LENGTH);
        Instant now = Instant.now();
        record.setStatus(classification);
        record.setClassificationReason(reason);
        record.setClosedAt(now);
        record.setUpdatedAt(now);
        CaseRecord saved = caseRecordRepository.save(record);
        auditService.logCaseAction(AuditLog.Action.REPORT_CLASSIFIED, actor.subjectId(), saved.getId(),
                "Report classified as " + classification + ": " + reason);
        String reporterId = saved.getReporterId();
        if (reporterId != null && !reporterId.equals(actor.subjectId())) {
            publish("caseClassified", () -> eventSink.caseClassified(saved, reporterId));
        }
        return toView(saved, actor);
    }

    /**
     * Formal, irreversible closure. Requires a closure document on file.
     */
    public CaseView close(String id, CasePayloads.Close payload, TokenClaims actor) {
        CaseRecord record = requireCase(id);
        requireNotArchived(record);
        if (payload == null || payload.closureDecision() == null) {
            throw HavenException.invalidArgument("closureDecision is required");
        }
        if (!documentRepository.existsByReportIdAndType(record.getId(), DocumentType.CLOTURE)) {
            throw HavenException.failedPrecondition(MISSING_CLOSURE_DOCUMENT);
        }
        Instant now = Instant.now();
        record.setStatus(CaseStatus.CLOSED);
        record.setArchived(true);
        record.setClosedAt(now);
        record.setClosureDecision(payload.closureDecision());
        record.setClosureNotes(optionalText(payload.closureNotes(), MAX_TEXT_LENGTH));
        record.setUpdatedAt(now);
        CaseRecord saved = caseRecordRepository.save(record);
        log.info("Report {} closed and archived by {} (decision={})", saved.getId(), actor.subjectId(), saved.getClosureDecision());
        auditService.logCaseAction(AuditLog.Action.REPORT_ARCHIVED, actor.subjectId(), saved.getId(),
                "Report closed and archived: " + saved.getClosureDecision());
        return toView(saved, actor);
    }

    public void delete(String id, TokenClaims actor) {
        CaseRecord record = requireCase(id);
        if (record.isArchived()) {
            throw HavenException.archivedImmutable("Cannot delete archived report. Contact SuperAdmin for data retention policies.");
        }
        auditService.logCaseAction(AuditLog.Action.REPORT_DELETED, actor.subjectId(), record.getId(),
                "Report deleted (status " + record.getStatus() + ")");
        caseRecordRepository.delete(record);
        documentRepository.deleteByReportId(record.getId());
        log.info("Report {} deleted by {}", record.getId(), actor.subjectId());
    }

    public CasePayloads.CaseStatistics statistics() {
        Map<CaseStatus, Long> byStatus = new EnumMap<>(CaseStatus.class);
        for (CaseStatus status : CaseStatus.values()) {
            byStatus.put(status, caseRecordRepository.countByStatus(status));
        }
        Map<IncidentType, Long> byType = new EnumMap<>(IncidentType.class);
        for (IncidentType type : IncidentType.values()) {
            byType.put(type, caseRecordRepository.countByIncidentType(type));
        }
        Map<Urgency, Long> byUrgency = new EnumMap<>(Urgency.class);
        for (Urgency urgency : Urgency.values()) {
            byUrgency.put(urgency, caseRecordRepository.countByUrgency(urgency));
        }
        return new CasePayloads.CaseStatistics(caseRecordRepository.count(), byStatus, byType, byUrgency);
    }

    CaseRecord requireCase(String id) {
        if (id == null || id.isBlank()) {
            throw HavenException.notFound("Report not found");
        }
        return caseRecordRepository.findById(id).orElseThrow(() -> HavenException.notFound("Report not found"));
    }

    static void requireNotArchived(CaseRecord record) {
        if (record.isArchived()) {
            throw HavenException.archivedImmutable(ARCHIVED_ERROR);
        }
    }

    /**
     * Check every file against the upload policy, anonymize the audio of an anonymous
     * submission, then store all files. Nothing stays on disk if any step fails.
     */
    private List<Attachment> storeAttachments(List<IncomingFile> files, boolean anonymous) {
        if (files == null || files.isEmpty()) {
            return new ArrayList<>();
        }
        fileStorageService.checkAll(files);
        List<IncomingFile> prepared = new ArrayList<>(files.size());
        for (IncomingFile file : files) {
            if (anonymous && file.isAudio()) {
                try {
                    byte[] anonymized = voiceAnonymizer.anonymize(file.data(), file.originalFilename(), file.contentType());
                    prepared.add(new IncomingFile(file.fieldName(), VoiceAnonymizerClient.OUTPUT_FILENAME,
                            VoiceAnonymizerClient.OUTPUT_CONTENT_TYPE, anonymized));
                } catch (VoiceAnonymizationException e) {
                    throw new VoiceAnonymizationException(ANONYMIZATION_ERROR, e);
                }
            } else {
                prepared.add(file);
            }
        }
        List<StoredFile> written = new ArrayList<>(prepared.size());
        try {
            for (IncomingFile file : prepared) {
                written.add(fileStorageService.store(file));
            }
        } catch (RuntimeException e) {
            written.forEach(fileStorageService::discard);
            throw e;
        }
        List<Attachment> attachments = new ArrayList<>(written.size());
        for (StoredFile stored : written) {
            attachments.add(new Attachment(stored.url(), stored.type(), stored.filename()));
        }
        return attachments;
    }

    private List<String> oversightRecipients() {
        List<String> roleIds = roleRepository.findByTier(CaseTier.OVERSIGHT).stream().map(Role::getId).toList();
        if (roleIds.isEmpty()) {
            return List.of();
        }
        return userRepository.findByRoleIdInAndStatus(roleIds, UserStatus.APPROVED).stream()
                .map(User::getId)
                .distinct()
                .toList();
    }

    private void publish(String event, Runnable delivery) {
        try {
            delivery.run();
        } catch (RuntimeException e) {
            log.warn("Case event {} could not be delivered: {}", event, e.getMessage());
        }
    }

    private CaseView toView(CaseRecord record, TokenClaims actor) {
        Set<String> ids = new HashSet<>();
        if (record.getReporterId() != null) {
            ids.add(record.getReporterId());
        }
        if (record.getAnalystId() != null) {
            ids.add(record.getAnalystId());
        }
        Map<String, User> people = ids.isEmpty() ? Map.of()
                : userRepository.findAllById(ids).stream().collect(Collectors.toMap(User::getId, Function.identity(), (a, b) -> a));
        return toView(record, actor, people.get(record.getReporterId()),
                record.getAnalystId() != null ? people.get(record.getAnalystId()) : null);
    }

    private CaseView toView(CaseRecord record, TokenClaims actor, User reporter, User analyst) {
        PersonSummary reporterSummary = casePolicy.revealsReporter(actor, record)
                ? PersonSummary.of(reporter)
                : PersonSummary.ANONYMOUS;
        return CaseView.of(record, reporterSummary, PersonSummary.of(analyst));
    }

    private static String requireText(String value, String field, int maxLength) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            throw HavenException.invalidArgument(field + " is required");
        }
        if (trimmed.length() > maxLength) {
            throw HavenException.invalidArgument(field + " is too long");
        }
        return trimmed;
    }

    private static String optionalText(String value, int maxLength) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }
}
