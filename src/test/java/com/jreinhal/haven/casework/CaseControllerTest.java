package com.jreinhal.haven.casework;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jreinhal.haven.exception.GlobalExceptionHandler;
import com.jreinhal.haven.exception.HavenException;
import com.jreinhal.haven.filter.SecurityContext;
import com.jreinhal.haven.model.CaseTier;
import com.jreinhal.haven.security.AuthorizationGate;
import com.jreinhal.haven.security.PermissionInterceptor;
import com.jreinhal.haven.security.TokenClaims;
import com.jreinhal.haven.storage.FileStorageService;
import com.jreinhal.haven.support.TestClaims;
import com.jreinhal.haven.triage.KeywordTriageAnalyzer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class CaseControllerTest {

    private CaseService caseService;
    private FileStorageService fileStorageService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        caseService = mock(CaseService.class);
        fileStorageService = mock(FileStorageService.class);
        CaseController controller = new CaseController(caseService, fileStorageService, new KeywordTriageAnalyzer());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .addInterceptors(new PermissionInterceptor(new AuthorizationGate()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @AfterEach
    void clear() {
        SecurityContext.clear();
    }

    private static CaseView view(String id, CaseStatus status) {
        CaseRecord record = new CaseRecord();
        record.setId(id);
        record.setIncidentType(IncidentType.VIOLENCE);
        record.setUrgency(Urgency.CRITICAL);
        record.setStatus(status);
        record.setAnonymous(true);
        return CaseView.of(record, PersonSummary.ANONYMOUS, null);
    }

    private static void signedInAs(TokenClaims claims) {
        SecurityContext.setCurrentClaims(claims);
    }

    @Test
    @DisplayName("Should answer 401 without a credential")
    void unauthenticated() throws Exception {
        mockMvc.perform(get("/api/reports/r1"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHENTICATED"));
        verify(caseService, never()).get(any(), any());
    }

    @Test
    @DisplayName("Should answer 403 naming the missing permission")
    void missingPermission() throws Exception {
        signedInAs(TestClaims.mother("m1"));

        mockMvc.perform(get("/api/reports/statistics"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Missing required permissions: STATS_VIEW"));
    }

    @Test
    @DisplayName("Should create a report from a multipart submission and return advisory triage")
    void createsReport() throws Exception {
        TokenClaims mother = TestClaims.mother("m1");
        signedInAs(mother);
        when(fileStorageService.buffer(eq("files"), any())).thenReturn(List.of());
        when(caseService.create(any(), anyList(), eq(mother))).thenReturn(view("r1", CaseStatus.PENDING));
        String json = "{\"incidentType\":\"VIOLENCE\",\"urgency\":\"CRITIQUE\",\"isAnonymous\":true,\"villageId\":\"v1\","
                + "\"childName\":\"Yassine\",\"description\":\"L'enfant a peur et a été battu\"}";
        MockMultipartFile report = new MockMultipartFile("report", "", MediaType.APPLICATION_JSON_VALUE,
                json.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/reports").file(report))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.report.id").value("r1"))
                .andExpect(jsonPath("$.report.reporter.id").value("anonymous"))
                .andExpect(jsonPath("$.triage.matchedWords[0]").value("peur"))
                .andExpect(jsonPath("$.triage.matchedWords[1]").value("battu"));
        verify(caseService).create(argThat(p -> p.urgency() == Urgency.CRITICAL && Boolean.TRUE.equals(p.isAnonymous())),
                anyList(), eq(mother));
    }

    @Test
    void analyzesUrgencyWithoutStoring() throws Exception {
        signedInAs(TestClaims.mother("m1"));

        mockMvc.perform(post("/api/reports/analyze-urgency")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"Il y avait du sang\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matchedWords[0]").value("sang"));
        verify(caseService, never()).create(any(), any(), any());
    }

    @Test
    void listPassesFilters() throws Exception {
        TokenClaims director = TestClaims.director("d1");
        signedInAs(director);
        when(caseService.list(any(), eq(director)))
                .thenReturn(new CasePayloads.CasePage(List.of(view("r1", CaseStatus.PENDING)), 1, 10, 0));

        mockMvc.perform(get("/api/reports").param("status", "PENDING").param("limit", "10")
                        .param("dateFrom", "2026-01-01T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.data[0].id").value("r1"));
        verify(caseService).list(argThat(q -> q.status() == CaseStatus.PENDING && q.limit() == 10
                && q.dateFrom() != null && q.villageId() == null), eq(director));
    }

    @Test
    @DisplayName("Should surface a missing closure document as 412")
    void closeWithoutDocument() throws Exception {
        TokenClaims director = TestClaims.director("d1");
        signedInAs(director);
        when(caseService.close(eq("r1"), any(), eq(director)))
                .thenThrow(HavenException.failedPrecondition(CaseService.MISSING_CLOSURE_DOCUMENT));

        mockMvc.perform(patch("/api/reports/r1/close")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"closureDecision\":\"SUIVI\"}"))
                .andExpect(status().isPreconditionFailed())
                .andExpect(jsonPath("$.error").value("FAILED_PRECONDITION"));
    }

    @Test
    void archivedReportAnswers423() throws Exception {
        TokenClaims psychologist = TestClaims.psychologist("a1");
        signedInAs(psychologist);
        when(caseService.update(eq("r1"), any(), anyList(), eq(psychologist)))
                .thenThrow(HavenException.archivedImmutable(CaseService.ARCHIVED_ERROR));

        mockMvc.perform(patch("/api/reports/r1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"urgency\":\"HAUTE\"}"))
                .andExpect(status().isLocked())
                .andExpect(jsonPath("$.message").value(CaseService.ARCHIVED_ERROR));
    }

    @Test
    @DisplayName("Should answer 423 for an archived report even when the attached file is out of policy")
    void archivedReportWinsOverUploadPolicy(@TempDir Path uploads) throws Exception {
        FileStorageService realStorage = new FileStorageService();
        ReflectionTestUtils.setField(realStorage, "uploadDir", uploads.toString());
        ReflectionTestUtils.setField(realStorage, "maxFileSizeBytes", 1024L);
        ReflectionTestUtils.setField(realStorage, "publicBaseUrl", "/uploads");
        realStorage.init();
        MockMvc withRealStorage = MockMvcBuilders
                .standaloneSetup(new CaseController(caseService, realStorage, new KeywordTriageAnalyzer()))
                .addInterceptors(new PermissionInterceptor(new AuthorizationGate()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        TokenClaims director = TestClaims.director("d1");
        signedInAs(director);
        when(caseService.update(eq("r1"), any(), anyList(), eq(director)))
                .thenThrow(HavenException.archivedImmutable(CaseService.ARCHIVED_ERROR));
        MockMultipartFile script = new MockMultipartFile("files", "run.sh", "application/x-sh", new byte[] {1});

        withRealStorage.perform(multipart(HttpMethod.PATCH, "/api/reports/r1").file(script))
                .andExpect(status().isLocked())
                .andExpect(jsonPath("$.error").value("ARCHIVED_IMMUTABLE"));
        verify(caseService).update(eq("r1"), any(), argThat(files -> files.size() == 1), eq(director));
    }

    @Test
    void listResolvesAssignedToCaller() throws Exception {
        TokenClaims psychologist = TestClaims.psychologist("a1");
        signedInAs(psychologist);
        when(caseService.list(any(), eq(psychologist))).thenReturn(new CasePayloads.CasePage(List.of(), 0, 50, 0));

        mockMvc.perform(get("/api/reports").param("analystId", CaseQuery.CALLER))
                .andExpect(status().isOk());
        verify(caseService).list(argThat(q -> CaseQuery.CALLER.equals(q.analystId())), eq(psychologist));
    }

    @Test
    void progressNeedsReportRead() throws Exception {
        TokenClaims director = TestClaims.director("d1");
        signedInAs(director);
        when(caseService.progress("r1", director)).thenReturn(new CasePayloads.CaseProgress("r1", CaseStatus.IN_PROGRESS,
                Urgency.HIGH, null, null, 29, 2, 7, 9, 7, true, List.of(), List.of()));

        mockMvc.perform(get("/api/reports/r1/progress"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.percentage").value(29))
                .andExpect(jsonPath("$.delayed").value(true));

        signedInAs(TestClaims.of("x", CaseTier.REVIEWER, "STATS_VIEW"));
        mockMvc.perform(get("/api/reports/r1/progress")).andExpect(status().isForbidden());
    }

    @Test
    void deleteRequiresReportDelete() throws Exception {
        signedInAs(TestClaims.director("d1"));
        mockMvc.perform(delete("/api/reports/r1")).andExpect(status().isForbidden());

        TokenClaims admin = TestClaims.of("admin", CaseTier.OVERSIGHT, "REPORT_DELETE");
        signedInAs(admin);
        mockMvc.perform(delete("/api/reports/r1")).andExpect(status().isNoContent());
        verify(caseService).delete("r1", admin);
    }
}
