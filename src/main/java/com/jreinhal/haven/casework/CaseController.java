package com.jreinhal.haven.casework;

import com.jreinhal.haven.filter.SecurityContext;
import com.jreinhal.haven.model.Permission;
import com.jreinhal.haven.security.RequirePermissions;
import com.jreinhal.haven.security.TokenClaims;
import com.jreinhal.haven.storage.FileStorageService;
import com.jreinhal.haven.storage.IncomingFile;
import com.jreinhal.haven.triage.KeywordTriageAnalyzer;
import com.jreinhal.haven.triage.TriageResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Instant;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping(value = {"/api/reports"})
@Tag(name = "Reports")
public class CaseController {
    static final String FILES_FIELD = "files";

    private final CaseService caseService;
    private final FileStorageService fileStorageService;
    private final KeywordTriageAnalyzer triageAnalyzer;

    public CaseController(CaseService caseService, FileStorageService fileStorageService, KeywordTriageAnalyzer triageAnalyzer) {
        this.caseService = caseService;
        this.fileStorageService = fileStorageService;
        this.triageAnalyzer = triageAnalyzer;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @RequirePermissions(Permission.REPORT_CREATE)
    @Operation(summary = "Create a report with optional attachments. Audio of anonymous reports is anonymized before storage.")
    public ResponseEntity<CreatedCase> create(@RequestPart("report") CasePayloads.CreateCase payload,
                                              @RequestPart(value = FILES_FIELD, required = false) List<MultipartFile> files) {
        TokenClaims actor = SecurityContext.requireClaims();
        List<IncomingFile> accepted = fileStorageService.buffer(FILES_FIELD, files);
        CaseView view = caseService.create(payload, accepted, actor);
        TriageResult triage = triageAnalyzer.analyze(payload.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(new CreatedCase(view, triage));
    }

    @PostMapping(value = {"/analyze-urgency"})
    @RequirePermissions(Permission.REPORT_CREATE)
    public TriageResult analyzeUrgency(@RequestBody(required = false) CasePayloads.AnalyzeText body) {
        return triageAnalyzer.analyze(body == null ? null : body.description());
    }

    @GetMapping
    @RequirePermissions(Permission.REPORT_READ)
    public CasePayloads.CasePage list(@RequestParam(required = false) String villageId,
                                      @RequestParam(required = false) String analystId,
                                      @RequestParam(required = false) CaseStatus status,
                                      @RequestParam(required = false) IncidentType incidentType,
                                      @RequestParam(required = false) Urgency urgency,
                                      @RequestParam(required = false) Boolean archived,
                                      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant dateFrom,
                                      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant dateTo,
                                      @RequestParam(required = false) Integer limit,
                                      @RequestParam(required = false) Integer offset) {
        CaseQuery query = new CaseQuery(villageId, analystId, status, incidentType, urgency, archived, dateFrom, dateTo, limit, offset);
        return caseService.list(query, SecurityContext.requireClaims());
    }

    @GetMapping(value = {"/statistics"})
    @RequirePermissions(Permission.STATS_VIEW)
    public CasePayloads.CaseStatistics statistics() {
        return caseService.statistics();
    }

    @GetMapping(value = {"/{id}"})
    @RequirePermissions(Permission.REPORT_READ)
    public CaseView get(@PathVariable String id) {
        return caseService.get(id, SecurityContext.requireClaims());
    }

    @GetMapping(value = {"/{id}/progress"})
    @RequirePermissions(Permission.REPORT_READ)
    @Operation(summary = "Procedure steps on file, completion percentage and delay against the urgency target")
    public CasePayloads.CaseProgress progress(@PathVariable String id) {
        return caseService.progress(id, SecurityContext.requireClaims());
    }

    @PatchMapping(value = {"/{id}"}, consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @RequirePermissions(Permission.REPORT_UPDATE)
    public CaseView updateWithFiles(@PathVariable String id,
                                    @RequestPart(value = "report", required = false) CasePayloads.UpdateCase payload,
                                    @RequestPart(value = FILES_FIELD, required = false) List<MultipartFile> files) {
        TokenClaims actor = SecurityContext.requireClaims();
        return caseService.update(id, payload, fileStorageService.buffer(FILES_FIELD, files), actor);
    }

    @PatchMapping(value = {"/{id}"}, consumes = MediaType.APPLICATION_JSON_VALUE)
    @RequirePermissions(Permission.REPORT_UPDATE)
    public CaseView update(@PathVariable String id, @RequestBody CasePayloads.UpdateCase payload) {
        return caseService.update(id, payload, List.of(), SecurityContext.requireClaims());
    }

    @PatchMapping(value = {"/{id}/assign"})
    @RequirePermissions(Permission.REPORT_ASSIGN)
    public CaseView assign(@PathVariable String id, @RequestBody CasePayloads.Assign payload) {
        return caseService.assign(id, payload, SecurityContext.requireClaims());
    }

    @PatchMapping(value = {"/{id}/classify"})
    @RequirePermissions(Permission.REPORT_CLASSIFY)
    public CaseView classify(@PathVariable String id, @RequestBody CasePayloads.Classify payload) {
        return caseService.classify(id, payload, SecurityContext.requireClaims());
    }

    @PatchMapping(value = {"/{id}/close"})
    @RequirePermissions(Permission.CASE_CLOSE)
    @Operation(summary = "Close and archive a report. Requires an uploaded closure document; irreversible.")
    public CaseView close(@PathVariable String id, @RequestBody CasePayloads.Close payload) {
        return caseService.close(id, payload, SecurityContext.requireClaims());
    }

    @DeleteMapping(value = {"/{id}"})
    @RequirePermissions(Permission.REPORT_DELETE)
    public ResponseEntity<Void> delete(@PathVariable String id) {
        caseService.delete(id, SecurityContext.requireClaims());
        return ResponseEntity.noContent().build();
    }

    public record CreatedCase(CaseView report, TriageResult triage) {
    }
}
