package com.example.ledgeraudit.domain.model;

import java.util.List;

/**
 * Output of the per-document stages (segment, parse, validate) for one source document.
 */
public record DocumentExtraction(
        SourceDocument document,
        List<TransactionRecord> records,
        List<ParseFailure> parseFailures,
        List<ValidationRejection> rejections,
        int rowCount,
        int skippedRowCount,
        int degradedPageCount
) {

    public DocumentExtraction {
        records = List.copyOf(records);
        parseFailures = List.copyOf(parseFailures);
        rejections = List.copyOf(rejections);
    }
}
