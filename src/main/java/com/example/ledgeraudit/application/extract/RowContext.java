package com.example.ledgeraudit.application.extract;

import com.example.ledgeraudit.domain.model.CandidateRow;
import com.example.ledgeraudit.domain.model.ReferenceTables;
import com.example.ledgeraudit.domain.model.SourceDocument;

import java.util.List;

/**
 * Everything an extractor may look at for one row.
 *
 * @param row                segmented row
 * @param tokens             cleaned tokens of the primary line
 * @param continuationTokens cleaned tokens of confirmed continuation lines
 * @param document           source document descriptor
 * @param referenceTables    reference data for code validation
 */
public record RowContext(
        CandidateRow row,
        List<Token> tokens,
        List<Token> continuationTokens,
        SourceDocument document,
        ReferenceTables referenceTables
) {

    public RowContext {
        tokens = List.copyOf(tokens);
        continuationTokens = List.copyOf(continuationTokens);
    }

    public boolean singleColumn() {
        return row.layout().isSingleColumn();
    }
}
