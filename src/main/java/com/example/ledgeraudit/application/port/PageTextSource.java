package com.example.ledgeraudit.application.port;

import com.example.ledgeraudit.domain.model.RawLine;

import java.util.stream.Stream;

/**
 * Producer of positioned page text for one document, supplied by an OCR engine or a PDF text-layer extractor.
 * Each call to {@link #lines()} re-reads the document from the start, so callers may retry freely.
 * Callers must close the returned stream.
 */
@FunctionalInterface
public interface PageTextSource {

    /**
     * @return finite stream of fragments ordered by page, then by emission order within the page
     * @throws com.example.ledgeraudit.infrastructure.exception.AcquisitionException when the text cannot be obtained
     */
    Stream<RawLine> lines();
}
