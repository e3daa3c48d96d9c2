package com.example.ledgeraudit.application.port;

import com.example.ledgeraudit.domain.model.SourceDocument;

/**
 * One batch input: document descriptor plus the source of its page text.
 */
public record DocumentSubmission(SourceDocument document, PageTextSource textSource) {

    public DocumentSubmission {
        if (document == null || textSource == null) {
            throw new IllegalArgumentException("document and text source are required");
        }
    }
}
