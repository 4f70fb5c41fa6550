package com.jreinhal.haven.casework;

import com.jreinhal.haven.filter.SecurityContext;
import com.jreinhal.haven.model.Permission;
import com.jreinhal.haven.security.AuthorizationGate;
import com.jreinhal.haven.security.RequirePermissions;
import com.jreinhal.haven.security.TokenClaims;
import com.jreinhal.haven.storage.FileStorageService;
import com.jreinhal.haven.storage.IncomingFile;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping(value = {"/api/documents"})
@Tag(name = "Documents")
public class CaseDocumentController {
    static final String FILE_FIELD = "file";

    private final CaseDocumentService documentService;
    private final FileStorageService fileStorageService;
    private final AuthorizationGate gate;

    public CaseDocumentController(CaseDocumentService documentService, FileStorageService fileStorageService, AuthorizationGate gate) {
        this.documentService = documentService;
        this.fileStorageService = fileStorageService;
        this.gate = gate;
    }

    /**
     * One route for every procedure step. The required permission depends on the step, so
     * it is checked here rather than by annotation.
     */
    @PostMapping(value = {"/reports/{reportId}/{type}"}, consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a procedure-step document (fiche-initial, dpe, evaluation, plan-action, suivi, rapport-final, cloture)")
    public ResponseEntity<CaseDocument> upload(@PathVariable String reportId, @PathVariable String type,
                                               @RequestPart(value = FILE_FIELD, required = false) MultipartFile file) {
        TokenClaims actor = SecurityContext.requireClaims();
        DocumentType documentType = resolveType(type);
        gate.require(actor, documentType.getUploadPermission());
        List<IncomingFile> accepted = fileStorageService.buffer(FILE_FIELD, file == null ? List.of() : List.of(file));
        CaseDocument document = documentService.upload(reportId, documentType, accepted.isEmpty() ? null : accepted.get(0), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(document);
    }

    @GetMapping(value = {"/reports/{reportId}"})
    @RequirePermissions(Permission.DOC_READ)
    public List<CaseDocument> listByReport(@PathVariable String reportId) {
        return documentService.listByReport(reportId, SecurityContext.requireClaims());
    }

    @GetMapping(value = {"/{id}"})
    @RequirePermissions(Permission.DOC_READ)
    public CaseDocument get(@PathVariable String id) {
        return documentService.get(id, SecurityContext.requireClaims());
    }

    @DeleteMapping(value = {"/{id}"})
    @RequirePermissions(Permission.DOC_DELETE)
    public ResponseEntity<Void> delete(@PathVariable String id) {
        documentService.delete(id, SecurityContext.requireClaims());
        return ResponseEntity.noContent().build();
    }

    // "dpe" is the route name of RAPPORT_DPE
    static DocumentType resolveType(String slug) {
        if ("dpe".equalsIgnoreCase(slug)) {
            return DocumentType.RAPPORT_DPE;
        }
        return DocumentType.fromSlug(slug);
    }
}
