package com.example.ledgeraudit.domain.model;

/**
 * Axis-aligned box of a text fragment in page coordinates (points or pixels, top-left origin).
 */
public record BoundingBox(
        float x,
        float y,
        float width,
        float height
) {

    public BoundingBox {
        width = Math.max(width, 0f);
        height = Math.max(height, 0f);
    }

    public float endX() {
        return x + width;
    }

    public float centerX() {
        return x + (width / 2f);
    }
}
