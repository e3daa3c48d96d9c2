package com.example.ledgeraudit.interfaces.api;

import com.example.ledgeraudit.application.port.DocumentSubmission;
import com.example.ledgeraudit.application.service.BatchPipelineService;
import com.example.ledgeraudit.application.service.PdfIngestionService;
import com.example.ledgeraudit.domain.model.PipelineReport;
import com.example.ledgeraudit.domain.model.SourceDocument;
import com.example.ledgeraudit.interfaces.api.dto.BatchRequestMapper;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDate;
import java.util.List;

/**
 * Interfaces-layer REST controller that processes a single uploaded register PDF through its text layer.
 */
@RestController
public class PdfUploadController {

    private final PdfIngestionService ingestionService;
    private final BatchPipelineService pipelineService;
    private final BatchRequestMapper requestMapper;

    public PdfUploadController(PdfIngestionService ingestionService,
                               BatchPipelineService pipelineService,
                               BatchRequestMapper requestMapper) {
        this.ingestionService = ingestionService;
        this.pipelineService = pipelineService;
        this.requestMapper = requestMapper;
    }

    /**
     * Extracts the ledger of one uploaded register.
     *
     * @param file         uploaded PDF
     * @param documentId   identifier used for provenance
     * @param fiscalYear   starting year of the fiscal year, optional when a period is given
     * @param documentType register or vendor summary (optional)
     * @param periodStart  stated period start (optional, ISO date)
     * @param periodEnd    stated period end (optional, ISO date)
     * @return JSON response containing the pipeline report for the single document
     */
    @PostMapping(value = "/api/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PipelineReport> extract(@RequestParam("file") MultipartFile file,
                                                  @RequestParam("documentId") String documentId,
                                                  @RequestParam(value = "fiscalYear", required = false) Integer fiscalYear,
                                                  @RequestParam(value = "documentType", required = false) String documentType,
                                                  @RequestParam(value = "periodStart", required = false)
                                                  @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodStart,
                                                  @RequestParam(value = "periodEnd", required = false)
                                                  @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodEnd) {
        SourceDocument document = requestMapper.toDocument(documentId, fiscalYear, documentType, periodStart, periodEnd);
        DocumentSubmission submission = ingestionService.toSubmission(file, document);
        return ResponseEntity.ok(pipelineService.run(List.of(submission), List.of()));
    }
}
