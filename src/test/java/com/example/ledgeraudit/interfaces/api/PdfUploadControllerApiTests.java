package com.example.ledgeraudit.interfaces.api;

import com.example.ledgeraudit.application.port.DocumentSubmission;
import com.example.ledgeraudit.application.service.BatchPipelineService;
import com.example.ledgeraudit.application.service.PdfIngestionService;
import com.example.ledgeraudit.config.LedgerProperties;
import com.example.ledgeraudit.domain.exception.PdfFileRequiredException;
import com.example.ledgeraudit.domain.model.SourceDocument;
import com.example.ledgeraudit.infrastructure.exception.PdfProcessingException;
import com.example.ledgeraudit.infrastructure.text.InMemoryPageTextSource;
import com.example.ledgeraudit.interfaces.api.dto.BatchRequestMapper;
import com.example.ledgeraudit.interfaces.api.error.GlobalExceptionHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = PdfUploadController.class)
@Import(GlobalExceptionHandler.class)
class PdfUploadControllerApiTests {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PdfIngestionService ingestionService;

    @MockBean
    private BatchPipelineService pipelineService;

    @TestConfiguration
    static class MapperConfiguration {
        @Bean
        BatchRequestMapper batchRequestMapper(ObjectMapper objectMapper) {
            return new BatchRequestMapper(objectMapper, LedgerProperties.defaults());
        }
    }

    /**
     * Verifies that the form fields become the document descriptor and the fiscal year follows the period.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void formFieldsBecomeTheDocumentDescriptor() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "register.pdf", "application/pdf", "data".getBytes());
        BDDMockito.given(ingestionService.toSubmission(BDDMockito.any(MultipartFile.class), BDDMockito.any(SourceDocument.class)))
                .willAnswer(invocation -> new DocumentSubmission(invocation.getArgument(1), new InMemoryPageTextSource(List.of())));

        mockMvc.perform(multipart("/api/extract").file(file)
                        .param("documentId", "reg-2025-08")
                        .param("periodStart", "2025-08-01")
                        .param("periodEnd", "2025-08-31"))
                .andExpect(status().isOk());

        ArgumentCaptor<SourceDocument> document = ArgumentCaptor.forClass(SourceDocument.class);
        verify(ingestionService).toSubmission(BDDMockito.any(MultipartFile.class), document.capture());
        assertThat(document.getValue().documentId()).isEqualTo("reg-2025-08");
        assertThat(document.getValue().fiscalYear()).isEqualTo(2025);
        assertThat(document.getValue().period().start()).isEqualTo(LocalDate.of(2025, 8, 1));
    }

    /**
     * Verifies that domain errors translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void domainExceptionMappedToBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "sample.pdf", "application/pdf", "data".getBytes());
        BDDMockito.given(ingestionService.toSubmission(BDDMockito.any(MultipartFile.class), BDDMockito.any(SourceDocument.class)))
                .willThrow(new PdfFileRequiredException());

        mockMvc.perform(multipart("/api/extract").file(file).param("documentId", "reg-1").param("fiscalYear", "2025"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"));
    }

    /**
     * Verifies that infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "sample.pdf", "application/pdf", "data".getBytes());
        BDDMockito.given(ingestionService.toSubmission(BDDMockito.any(MultipartFile.class), BDDMockito.any(SourceDocument.class)))
                .willThrow(new PdfProcessingException("Unable", new RuntimeException("boom")));

        mockMvc.perform(multipart("/api/extract").file(file).param("documentId", "reg-1").param("fiscalYear", "2025"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    @Test
    void documentWithoutFiscalYearOrPeriodRejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "sample.pdf", "application/pdf", "data".getBytes());

        mockMvc.perform(multipart("/api/extract").file(file).param("documentId", "reg-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"));

        verify(pipelineService, never()).run(anyList(), anyList());
    }

    @Test
    void missingFilePartMappedToMalformedRequest() throws Exception {
        mockMvc.perform(multipart("/api/extract").param("documentId", "reg-1").param("fiscalYear", "2025"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }
}
