package com.example.ledgeraudit.infrastructure.ocr;

import com.example.ledgeraudit.application.port.PageTextSource;
import com.example.ledgeraudit.domain.model.BoundingBox;
import com.example.ledgeraudit.domain.model.RawLine;
import com.example.ledgeraudit.infrastructure.exception.AcquisitionException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads word boxes written by an external OCR engine as JSON:
 * <pre>
 * {"pages": [{"page": 0, "words": [{"text": "ZUM", "left": 72, "top": 140, "width": 30, "height": 11, "conf": 93.5}]}]}
 * </pre>
 * Confidence may be given as a fraction or a percentage; the scale is fixed per file, percent as soon as any
 * word reports more than 1. Words without a confidence count as certain. Words with a non-positive confidence
 * are the engine's layout markers and are skipped. The file is re-read on every call.
 */
public class OcrJsonPageTextSource implements PageTextSource {

    private final String documentId;
    private final Path path;
    private final ObjectMapper objectMapper;

    public OcrJsonPageTextSource(String documentId, Path path, ObjectMapper objectMapper) {
        this.documentId = documentId;
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public Stream<RawLine> lines() {
        if (!Files.isReadable(path)) {
            throw new AcquisitionException(documentId, "OCR output not found at " + path, null);
        }
        JsonNode root;
        try (InputStream input = Files.newInputStream(path)) {
            root = objectMapper.readTree(input);
        } catch (IOException ex) {
            throw new AcquisitionException(documentId, "OCR output at " + path + " is unreadable", ex);
        }
        JsonNode pages = root == null ? null : root.path("pages");
        if (pages == null || !pages.isArray()) {
            throw new AcquisitionException(documentId, "OCR output at " + path + " has no pages array", null);
        }

        double scale = usesPercentConfidence(pages) ? 100.0 : 1.0;
        List<RawLine> lines = new ArrayList<>();
        int pagePosition = 0;
        for (JsonNode page : pages) {
            int pageIndex = page.path("page").asInt(pagePosition);
            int lineIndex = 0;
            for (JsonNode word : page.path("words")) {
                String text = word.path("text").asText("");
                JsonNode conf = word.path("conf");
                double confidence = conf.isNumber() ? conf.asDouble() / scale : 1.0;
                if (text.isBlank() || confidence <= 0) {
                    continue;
                }
                BoundingBox box = new BoundingBox(
                        (float) word.path("left").asDouble(),
                        (float) word.path("top").asDouble(),
                        (float) word.path("width").asDouble(),
                        (float) word.path("height").asDouble());
                lines.add(new RawLine(pageIndex, lineIndex++, text, box, confidence));
            }
            pagePosition++;
        }
        return lines.stream();
    }

    private static boolean usesPercentConfidence(JsonNode pages) {
        for (JsonNode page : pages) {
            for (JsonNode word : page.path("words")) {
                JsonNode conf = word.path("conf");
                if (conf.isNumber() && conf.asDouble() > 1.0) {
                    return true;
                }
            }
        }
        return false;
    }
}
