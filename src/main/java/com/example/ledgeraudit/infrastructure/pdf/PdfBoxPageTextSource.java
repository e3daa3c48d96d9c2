package com.example.ledgeraudit.infrastructure.pdf;

import com.example.ledgeraudit.application.port.PageTextSource;
import com.example.ledgeraudit.domain.model.BoundingBox;
import com.example.ledgeraudit.domain.model.RawLine;
import com.example.ledgeraudit.infrastructure.exception.AcquisitionException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Page text source backed by the text layer of a born-digital register PDF. Each text run PDFBox emits
 * becomes one fragment with its bounding box; text-layer confidence is always 1.
 */
public class PdfBoxPageTextSource implements PageTextSource {

    private final String documentId;
    private final byte[] pdfBytes;

    public PdfBoxPageTextSource(String documentId, byte[] pdfBytes) {
        this.documentId = documentId;
        this.pdfBytes = pdfBytes.clone();
    }

    @Override
    public Stream<RawLine> lines() {
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            PositionedRunStripper stripper = new PositionedRunStripper();
            stripper.setSortByPosition(true);
            stripper.setSuppressDuplicateOverlappingText(false);
            stripper.writeText(document, new StringWriter());
            return stripper.getLines().stream();
        } catch (IOException ex) {
            throw new AcquisitionException(documentId, "PDF text layer could not be read", ex);
        }
    }

    /**
     * Captures every text run with its position instead of flattening the page to plain text.
     */
    private static final class PositionedRunStripper extends PDFTextStripper {
        private final List<RawLine> lines = new ArrayList<>();
        private int lastPage = -1;
        private int lineIndex;

        PositionedRunStripper() throws IOException {
            super();
        }

        List<RawLine> getLines() {
            return List.copyOf(lines);
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            if (!textPositions.isEmpty() && !text.isBlank()) {
                int pageIndex = getCurrentPageNo() - 1;
                if (pageIndex != lastPage) {
                    lastPage = pageIndex;
                    lineIndex = 0;
                }
                float x = textPositions.stream()
                        .map(TextPosition::getXDirAdj)
                        .min(Float::compareTo)
                        .orElse(0f);
                TextPosition lastGlyph = textPositions.get(textPositions.size() - 1);
                float endX = lastGlyph.getXDirAdj() + lastGlyph.getWidthDirAdj();
                float width = Math.max(endX - x, 0.5f);
                float top = textPositions.stream()
                        .map(position -> position.getYDirAdj() - position.getHeightDir())
                        .min(Float::compareTo)
                        .orElse(0f);
                float height = textPositions.stream()
                        .map(TextPosition::getHeightDir)
                        .max(Float::compareTo)
                        .orElse(0f);
                lines.add(new RawLine(pageIndex, lineIndex++, text, new BoundingBox(x, top, width, height), 1.0));
            }
            super.writeString(text, textPositions);
        }
    }
}
