package com.example.ledgeraudit.infrastructure.text;

import com.example.ledgeraudit.application.port.PageTextSource;
import com.example.ledgeraudit.domain.model.RawLine;

import java.util.List;
import java.util.stream.Stream;

/**
 * Page text that was already materialized, e.g. OCR lines submitted inline with a batch request.
 */
public class InMemoryPageTextSource implements PageTextSource {

    private final List<RawLine> lines;

    public InMemoryPageTextSource(List<RawLine> lines) {
        this.lines = List.copyOf(lines);
    }

    @Override
    public Stream<RawLine> lines() {
        return lines.stream();
    }
}
