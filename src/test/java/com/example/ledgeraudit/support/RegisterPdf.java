package com.example.ledgeraudit.support;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders small born-digital register PDFs with text placed at explicit positions.
 */
public final class RegisterPdf {

    private final List<List<Run>> pages = new ArrayList<>();

    private RegisterPdf() {
    }

    public static RegisterPdf create() {
        return new RegisterPdf();
    }

    public RegisterPdf page() {
        pages.add(new ArrayList<>());
        return this;
    }

    /**
     * Places text on the current page.
     *
     * @param x    distance from the left edge in points
     * @param y    distance from the top edge in points
     * @param text text to show
     */
    public RegisterPdf text(float x, float y, String text) {
        if (pages.isEmpty()) {
            page();
        }
        pages.get(pages.size() - 1).add(new Run(x, y, text));
        return this;
    }

    /**
     * @return PDF bytes
     * @throws IOException when PDFBox cannot create or save the document
     */
    public byte[] toBytes() throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (List<Run> runs : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                float height = page.getMediaBox().getHeight();
                try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                    for (Run run : runs) {
                        contentStream.beginText();
                        contentStream.setFont(font, 10);
                        contentStream.newLineAtOffset(run.x(), height - run.y());
                        contentStream.showText(run.text());
                        contentStream.endText();
                    }
                }
            }
            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }

    private record Run(float x, float y, String text) {
    }
}
