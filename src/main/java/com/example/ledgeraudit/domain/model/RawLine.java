package com.example.ledgeraudit.domain.model;

/**
 * Positioned text fragment produced by a page text source (OCR word box or PDF text-layer run).
 * Ephemeral: created and consumed within one document pass.
 *
 * @param pageIndex  zero-based page index
 * @param lineIndex  emission order within the page
 * @param text       recognized text
 * @param box        bounding box of the fragment
 * @param confidence recognition confidence in {@code [0, 1]}
 */
public record RawLine(
        int pageIndex,
        int lineIndex,
        String text,
        BoundingBox box,
        double confidence
) {

    public RawLine {
        text = text == null ? "" : text;
        box = box == null ? new BoundingBox(0f, 0f, 0f, 0f) : box;
        if (Double.isNaN(confidence)) {
            confidence = 0d;
        }
        confidence = Math.max(0d, Math.min(1d, confidence));
    }

    public float x() {
        return box.x();
    }

    public float y() {
        return box.y();
    }
}
