package com.example.ledgeraudit.interfaces.api;

import com.example.ledgeraudit.application.exception.CsvExportValidationException;
import com.example.ledgeraudit.application.exception.ReferenceTablesMissingException;
import com.example.ledgeraudit.application.service.BatchPipelineService;
import com.example.ledgeraudit.application.service.LedgerCsvExportService;
import com.example.ledgeraudit.config.LedgerProperties;
import com.example.ledgeraudit.domain.exception.InvalidClaimException;
import com.example.ledgeraudit.domain.model.AggregationIndex;
import com.example.ledgeraudit.domain.model.AnomalyReport;
import com.example.ledgeraudit.domain.model.CanonicalLedger;
import com.example.ledgeraudit.domain.model.PipelineReport;
import com.example.ledgeraudit.domain.model.VerificationReport;
import com.example.ledgeraudit.infrastructure.exception.PdfProcessingException;
import com.example.ledgeraudit.interfaces.api.dto.BatchRequestMapper;
import com.example.ledgeraudit.interfaces.api.error.GlobalExceptionHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.util.List;
import java.util.TreeMap;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests for the batch endpoints and their error mapping.
 */
@WebMvcTest(controllers = PipelineController.class)
@Import(GlobalExceptionHandler.class)
class PipelineControllerApiTests {

    private static final String BATCH = """
            {
              "documents": [{
                "document_id": "reg-2025-07",
                "fiscal_year": 2025,
                "lines": [
                  {"page": 0, "text": "0201234567", "x": 40, "y": 100},
                  {"page": 0, "text": "ACME INC", "x": 210, "y": 100},
                  {"page": 0, "text": "1,234.56", "x": 500, "y": 100}
                ]
              }],
              "claims": [{
                "claim_id": "c-1",
                "asserted_value": 1234.56,
                "unit": "USD",
                "source_kind": "BUCKET",
                "rule": "PAYEE",
                "key": "ACME INC"
              }]
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BatchPipelineService pipelineService;

    @MockBean
    private LedgerCsvExportService csvExportService;

    @TestConfiguration
    static class MapperConfiguration {
        @Bean
        BatchRequestMapper batchRequestMapper(ObjectMapper objectMapper) {
            return new BatchRequestMapper(objectMapper, LedgerProperties.defaults());
        }
    }

    /**
     * Verifies that a well-formed batch reaches the pipeline and its report is returned.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void runReturnsPipelineReport() throws Exception {
        BDDMockito.given(pipelineService.run(anyList(), anyList())).willReturn(emptyReport());

        mockMvc.perform(post("/api/pipeline/run").contentType(MediaType.APPLICATION_JSON).content(BATCH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.run_fingerprint").value("fp-1"))
                .andExpect(jsonPath("$.document_count").value(1));
    }

    @Test
    void batchWithoutDocumentsMappedToBadRequest() throws Exception {
        mockMvc.perform(post("/api/pipeline/run").contentType(MediaType.APPLICATION_JSON).content("{\"documents\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"))
                .andExpect(jsonPath("$.path").value("/api/pipeline/run"));

        verify(pipelineService, never()).run(anyList(), anyList());
    }

    @Test
    void unreadableBodyMappedToMalformedRequest() throws Exception {
        mockMvc.perform(post("/api/pipeline/run").contentType(MediaType.APPLICATION_JSON).content("{\"documents\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    /**
     * Verifies that domain errors translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void domainExceptionMappedToBadRequest() throws Exception {
        BDDMockito.given(pipelineService.run(anyList(), anyList()))
                .willThrow(new InvalidClaimException("c-1", "asserted value is required"));

        mockMvc.perform(post("/api/pipeline/run").contentType(MediaType.APPLICATION_JSON).content(BATCH))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"));
    }

    @Test
    void missingReferenceTablesMappedToServiceUnavailable() throws Exception {
        BDDMockito.given(pipelineService.run(anyList(), anyList()))
                .willThrow(new ReferenceTablesMissingException("classpath:reference/account-codes.csv"));

        mockMvc.perform(post("/api/pipeline/run").contentType(MediaType.APPLICATION_JSON).content(BATCH))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("REFERENCE_TABLES_MISSING"))
                .andExpect(jsonPath("$.details.location").value("classpath:reference/account-codes.csv"));
    }

    @Test
    void infrastructureFailureMappedToServerError() throws Exception {
        BDDMockito.given(pipelineService.run(anyList(), anyList()))
                .willThrow(new PdfProcessingException("Unable to read reg-2025-07.pdf", new IOException("Truncated stream")));

        mockMvc.perform(post("/api/pipeline/run").contentType(MediaType.APPLICATION_JSON).content(BATCH))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    /**
     * Verifies the CSV download headers.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void ledgerCsvIsServedAsAttachment() throws Exception {
        BDDMockito.given(pipelineService.run(anyList(), anyList())).willReturn(emptyReport());
        BDDMockito.given(csvExportService.export(BDDMockito.any())).willReturn("record_id,amount\n");

        mockMvc.perform(post("/api/pipeline/ledger.csv").contentType(MediaType.APPLICATION_JSON).content(BATCH))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"ledger.csv\""))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string("record_id,amount\n"));
    }

    /**
     * Verifies that CSV export validation errors translate to HTTP 422 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void csvExportValidationExceptionMappedTo422() throws Exception {
        BDDMockito.given(pipelineService.run(anyList(), anyList())).willReturn(emptyReport());
        BDDMockito.given(csvExportService.export(BDDMockito.any()))
                .willThrow(new CsvExportValidationException("The ledger has no records to export."));

        mockMvc.perform(post("/api/pipeline/ledger.csv").contentType(MediaType.APPLICATION_JSON).content(BATCH))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("CSV_EXPORT_VALIDATION_ERROR"));
    }

    private static PipelineReport emptyReport() {
        return new PipelineReport("fp-1", 1, 0, CanonicalLedger.of(List.of()),
                new AggregationIndex(List.of(), new TreeMap<>()), VerificationReport.of(List.of()), List.of(),
                new AnomalyReport(List.of(), List.of(), List.of(), List.of(), List.of(), null));
    }
}
