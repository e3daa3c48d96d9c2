package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.application.port.DocumentSubmission;
import com.example.ledgeraudit.domain.exception.PdfFileRequiredException;
import com.example.ledgeraudit.domain.exception.UnsupportedPdfFormatException;
import com.example.ledgeraudit.domain.model.SourceDocument;
import com.example.ledgeraudit.infrastructure.exception.PdfProcessingException;
import com.example.ledgeraudit.infrastructure.pdf.PdfBoxPageTextSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Locale;

/**
 * Application-layer service that turns an uploaded register PDF into a batch submission backed by the
 * PDF text layer.
 */
@Service
public class PdfIngestionService {

    private static final Logger log = LoggerFactory.getLogger(PdfIngestionService.class);

    /**
     * Validates the upload and wraps its bytes as a page text source.
     *
     * @param file     uploaded PDF
     * @param document descriptor of the register; a {@code null} period is detected from the heading later
     * @return submission ready for {@link BatchPipelineService#run}
     * @throws PdfFileRequiredException      when the file is null or empty
     * @throws UnsupportedPdfFormatException when the MIME type/name does not look like a PDF
     * @throws PdfProcessingException        when the upload cannot be read
     */
    public DocumentSubmission toSubmission(MultipartFile file, SourceDocument document) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }

        try {
            byte[] bytes = file.getBytes();
            log.info("Accepted {} ({} bytes) as document {}", resolveFileName(file), bytes.length, document.documentId());
            return new DocumentSubmission(document, new PdfBoxPageTextSource(document.documentId(), bytes));
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the uploaded PDF file.", e);
        }
    }

    /**
     * Checks whether the upload is a PDF using the MIME type first and the file extension second.
     *
     * @param file uploaded file
     * @return {@code true} when the file is likely a PDF
     */
    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.pdf";
        }
        return fileName;
    }
}
