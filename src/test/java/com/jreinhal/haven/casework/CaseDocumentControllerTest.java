package com.jreinhal.haven.casework;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jreinhal.haven.exception.GlobalExceptionHandler;
import com.jreinhal.haven.filter.SecurityContext;
import com.jreinhal.haven.security.AuthorizationGate;
import com.jreinhal.haven.security.PermissionInterceptor;
import com.jreinhal.haven.security.TokenClaims;
import com.jreinhal.haven.storage.FileStorageService;
import com.jreinhal.haven.storage.IncomingFile;
import com.jreinhal.haven.support.TestClaims;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class CaseDocumentControllerTest {

    private CaseDocumentService documentService;
    private FileStorageService fileStorageService;
    private MockMvc mockMvc;
    private final MockMultipartFile pdf = new MockMultipartFile("file", "dpe.pdf", "application/pdf", new byte[] {1});
    private final IncomingFile incoming = new IncomingFile("file", "dpe.pdf", "application/pdf", new byte[] {1});

    @BeforeEach
    void setUp() {
        documentService = mock(CaseDocumentService.class);
        fileStorageService = mock(FileStorageService.class);
        AuthorizationGate gate = new AuthorizationGate();
        mockMvc = MockMvcBuilders.standaloneSetup(new CaseDocumentController(documentService, fileStorageService, gate))
                .addInterceptors(new PermissionInterceptor(gate))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        when(fileStorageService.buffer(eq("file"), any())).thenReturn(List.of(incoming));
    }

    @AfterEach
    void clear() {
        SecurityContext.clear();
    }

    @Test
    void psychologistUploadsDpeReport() throws Exception {
        TokenClaims psychologist = TestClaims.psychologist("a1");
        SecurityContext.setCurrentClaims(psychologist);
        CaseDocument document = new CaseDocument(DocumentType.RAPPORT_DPE, "/uploads/file-1.pdf", "file-1.pdf", "a1", "r1");
        document.setId("doc-1");
        when(documentService.upload("r1", DocumentType.RAPPORT_DPE, incoming, psychologist)).thenReturn(document);

        mockMvc.perform(multipart("/api/documents/reports/r1/dpe").file(pdf))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("doc-1"))
                .andExpect(jsonPath("$.type").value("RAPPORT_DPE"));
    }

    @Test
    void uploadPermissionDependsOnDocumentType() throws Exception {
        SecurityContext.setCurrentClaims(TestClaims.psychologist("a1"));

        mockMvc.perform(multipart("/api/documents/reports/r1/cloture").file(pdf))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Missing required permissions: DOC_UPLOAD_CLOTURE"));
        verify(documentService, never()).upload(any(), any(), any(), any());
    }

    @Test
    void unknownDocumentTypeIsBadRequest() throws Exception {
        SecurityContext.setCurrentClaims(TestClaims.director("d1"));

        mockMvc.perform(multipart("/api/documents/reports/r1/memo").file(pdf))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown document type: memo"));
    }

    @Test
    void resolvesSlugsAndAlias() {
        assertThat(CaseDocumentController.resolveType("dpe")).isEqualTo(DocumentType.RAPPORT_DPE);
        assertThat(CaseDocumentController.resolveType("plan-action")).isEqualTo(DocumentType.PLAN_ACTION);
        assertThat(CaseDocumentController.resolveType("rapport-final")).isEqualTo(DocumentType.RAPPORT_FINAL);
        assertThat(CaseDocumentController.resolveType("fiche-initial")).isEqualTo(DocumentType.FICHE_INITIAL);
    }
}
