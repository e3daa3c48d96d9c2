package com.example.ledgeraudit.interfaces.api;

import com.example.ledgeraudit.application.service.BatchPipelineService;
import com.example.ledgeraudit.application.service.LedgerCsvExportService;
import com.example.ledgeraudit.domain.model.PipelineReport;
import com.example.ledgeraudit.interfaces.api.dto.BatchRequest;
import com.example.ledgeraudit.interfaces.api.dto.BatchRequestMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

/**
 * Interfaces-layer REST controller that runs extraction and claim verification over a batch of documents.
 */
@RestController
@RequestMapping("/api/pipeline")
public class PipelineController {

    private final BatchPipelineService pipelineService;
    private final LedgerCsvExportService csvExportService;
    private final BatchRequestMapper requestMapper;

    /**
     * Creates the controller with the required application services.
     *
     * @param pipelineService  batch pipeline
     * @param csvExportService service responsible for CSV generation
     * @param requestMapper    DTO to domain conversion
     */
    public PipelineController(BatchPipelineService pipelineService,
                              LedgerCsvExportService csvExportService,
                              BatchRequestMapper requestMapper) {
        this.pipelineService = pipelineService;
        this.csvExportService = csvExportService;
        this.requestMapper = requestMapper;
    }

    /**
     * Runs the pipeline and returns ledger, verification report and anomalies as JSON.
     *
     * @param request documents and claims
     * @return full pipeline report
     */
    @PostMapping(value = "/run", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PipelineReport> run(@RequestBody BatchRequest request) {
        PipelineReport report = pipelineService.run(requestMapper.toSubmissions(request), requestMapper.toClaims(request));
        return ResponseEntity.ok(report);
    }

    /**
     * Runs the pipeline and streams the canonical ledger as a CSV download.
     *
     * @param request documents and claims
     * @return CSV document as a {@link ResponseEntity}
     */
    @PostMapping("/ledger.csv")
    public ResponseEntity<byte[]> exportLedger(@RequestBody BatchRequest request) {
        PipelineReport report = pipelineService.run(requestMapper.toSubmissions(request), requestMapper.toClaims(request));
        String csv = csvExportService.export(report.ledger());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"ledger.csv\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }
}
