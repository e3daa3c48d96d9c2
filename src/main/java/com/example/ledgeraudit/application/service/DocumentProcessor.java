package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.application.port.PageTextSource;
import com.example.ledgeraudit.domain.model.CandidateRow;
import com.example.ledgeraudit.domain.model.DocumentExtraction;
import com.example.ledgeraudit.domain.model.ParseFailure;
import com.example.ledgeraudit.domain.model.RawLine;
import com.example.ledgeraudit.domain.model.ReferenceTables;
import com.example.ledgeraudit.domain.model.ReportingPeriod;
import com.example.ledgeraudit.domain.model.SourceDocument;
import com.example.ledgeraudit.domain.model.TransactionRecord;
import com.example.ledgeraudit.domain.model.ValidationRejection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Per-document stages: segment, parse, validate. Holds no state between calls, so documents may be
 * processed concurrently.
 */
@Service
public class DocumentProcessor {

    private static final Logger log = LoggerFactory.getLogger(DocumentProcessor.class);

    private final LayoutSegmenter segmenter;
    private final LineItemParser parser;
    private final RecordValidator validator;
    private final ReportingPeriodDetector periodDetector;

    public DocumentProcessor(LayoutSegmenter segmenter,
                             LineItemParser parser,
                             RecordValidator validator,
                             ReportingPeriodDetector periodDetector) {
        this.segmenter = segmenter;
        this.parser = parser;
        this.validator = validator;
        this.periodDetector = periodDetector;
    }

    /**
     * Reads the whole page text of a document. The stream is closed before returning.
     *
     * @throws com.example.ledgeraudit.infrastructure.exception.AcquisitionException when the source fails
     */
    public List<RawLine> acquire(PageTextSource source) {
        try (Stream<RawLine> lines = source.lines()) {
            return lines.toList();
        }
    }

    /**
     * Runs the per-document stages over already acquired lines.
     *
     * @param document descriptor; a missing period is detected from a banner or defaulted to the fiscal year
     * @param lines    page text
     * @param tables   reference tables
     * @return records, failures and rejections of the document
     */
    public DocumentExtraction process(SourceDocument document, List<RawLine> lines, ReferenceTables tables) {
        SourceDocument resolved = document;
        if (document.period() == null) {
            ReportingPeriod period = periodDetector.detect(lines)
                    .orElseGet(() -> ReportingPeriod.of(tables.fiscalYear(document.fiscalYear())));
            resolved = document.withPeriod(period);
        }

        List<CandidateRow> rows = segmenter.segment(resolved.documentId(), lines);
        List<RowParseResult> parsed = parser.parse(rows, resolved, tables);

        List<TransactionRecord> records = new ArrayList<>();
        List<ParseFailure> failures = new ArrayList<>();
        List<ValidationRejection> rejections = new ArrayList<>();
        int skipped = 0;
        for (RowParseResult result : parsed) {
            switch (result.kind()) {
                case PARSED -> {
                    ValidationOutcome outcome = validator.validate(result.item(), resolved, tables);
                    if (outcome.accepted()) {
                        records.add(outcome.record());
                    } else {
                        rejections.add(outcome.rejection());
                    }
                }
                case FAILED -> failures.add(result.failure());
                case SKIPPED -> skipped++;
            }
        }
        int degradedPages = (int) rows.stream()
                .filter(CandidateRow::degraded)
                .mapToInt(CandidateRow::pageIndex)
                .distinct()
                .count();
        log.info("Document {}: {} rows, {} records, {} unparsed, {} rejected, {} skipped, {} degraded pages",
                resolved.documentId(), rows.size(), records.size(), failures.size(), rejections.size(), skipped, degradedPages);
        return new DocumentExtraction(resolved, records, failures, rejections, rows.size(), skipped, degradedPages);
    }
}
