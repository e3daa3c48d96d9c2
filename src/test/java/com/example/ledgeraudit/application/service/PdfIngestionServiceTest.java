package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.application.port.DocumentSubmission;
import com.example.ledgeraudit.domain.exception.PdfFileRequiredException;
import com.example.ledgeraudit.domain.exception.UnsupportedPdfFormatException;
import com.example.ledgeraudit.domain.model.RawLine;
import com.example.ledgeraudit.domain.model.SourceDocument;
import com.example.ledgeraudit.support.RegisterPdf;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests covering upload validation of register PDFs.
 */
class PdfIngestionServiceTest {

    private static final SourceDocument DOCUMENT = SourceDocument.register("reg-2025-07", 2025, null);

    private final PdfIngestionService service = new PdfIngestionService();

    /**
     * Verifies that an uploaded PDF becomes a submission backed by its text layer.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void wrapsPdfUploadsAsSubmissions() throws Exception {
        byte[] pdfBytes = RegisterPdf.create()
                .text(40, 100, "Checks Dated 07/01/2025 through 07/31/2025")
                .toBytes();
        MockMultipartFile file = new MockMultipartFile("file", "register.pdf", "application/pdf", pdfBytes);

        DocumentSubmission submission = service.toSubmission(file, DOCUMENT);

        assertThat(submission.document()).isEqualTo(DOCUMENT);
        try (Stream<RawLine> lines = submission.textSource().lines()) {
            List<String> texts = lines.map(RawLine::text).toList();
            assertThat(String.join(" ", texts)).contains("Checks", "07/31/2025");
        }
    }

    /**
     * Ensures a PDF sent with a generic content type is still accepted by its extension.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void acceptsPdfExtensionWithoutPdfContentType() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "REGISTER.PDF", "application/octet-stream",
                RegisterPdf.create().text(40, 100, "0201234567").toBytes());

        assertThat(service.toSubmission(file, DOCUMENT).textSource()).isNotNull();
    }

    /**
     * Ensures non-PDF uploads are rejected.
     */
    @Test
    void rejectsNonPdfUploads() {
        MockMultipartFile file = new MockMultipartFile("file", "note.txt", "text/plain",
                "plain text".getBytes(StandardCharsets.UTF_8));

        assertThrows(UnsupportedPdfFormatException.class, () -> service.toSubmission(file, DOCUMENT));
    }

    /**
     * Ensures empty or missing uploads are rejected.
     */
    @Test
    void requiresAFile() {
        MockMultipartFile empty = new MockMultipartFile("file", new byte[0]);

        assertThrows(PdfFileRequiredException.class, () -> service.toSubmission(empty, DOCUMENT));
        assertThrows(PdfFileRequiredException.class, () -> service.toSubmission(null, DOCUMENT));
    }
}
