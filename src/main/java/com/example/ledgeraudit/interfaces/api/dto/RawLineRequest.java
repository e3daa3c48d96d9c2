package com.example.ledgeraudit.interfaces.api.dto;

/**
 * API-layer DTO for one positioned OCR fragment. A missing confidence means the text is certain.
 */
public record RawLineRequest(
        int page,
        Integer line,
        String text,
        float x,
        float y,
        Float width,
        Float height,
        Double confidence
) {
}
