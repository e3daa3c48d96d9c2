package com.example.ledgeraudit.domain.model;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Raw lines judged to belong to one logical register row.
 *
 * @param documentId        source document identifier
 * @param pageIndex         zero-based page index
 * @param rowIndex          row order within the page
 * @param lines             fragments of the primary physical line, ordered left to right
 * @param continuationLines fragments of confirmed payee continuation lines
 * @param layout            column layout of the page the row was cut from
 * @param confidence        minimum confidence of all constituent fragments, degraded when the page had no columns
 * @param continuation      {@code true} when the payee field wraps across physical lines
 * @param degraded          {@code true} when the page fell back to single-column mode
 */
public record CandidateRow(
        String documentId,
        int pageIndex,
        int rowIndex,
        List<RawLine> lines,
        List<RawLine> continuationLines,
        ColumnLayout layout,
        double confidence,
        boolean continuation,
        boolean degraded
) {

    public CandidateRow {
        lines = lines == null ? List.of() : List.copyOf(lines);
        continuationLines = continuationLines == null ? List.of() : List.copyOf(continuationLines);
        layout = layout == null ? ColumnLayout.singleColumn() : layout;
    }

    /**
     * Builds a row and derives its aggregate confidence from the constituent fragments.
     */
    public static CandidateRow of(String documentId,
                                  int pageIndex,
                                  int rowIndex,
                                  List<RawLine> lines,
                                  List<RawLine> continuationLines,
                                  ColumnLayout layout,
                                  boolean degraded,
                                  double degradedFactor) {
        double minimum = Stream.concat(lines.stream(), continuationLines.stream())
                .mapToDouble(RawLine::confidence)
                .min()
                .orElse(0d);
        double confidence = degraded ? minimum * degradedFactor : minimum;
        return new CandidateRow(documentId, pageIndex, rowIndex, lines, continuationLines, layout,
                confidence, !continuationLines.isEmpty(), degraded);
    }

    public String primaryText() {
        return join(lines);
    }

    public String continuationText() {
        return join(continuationLines);
    }

    /**
     * @return raw row text including continuation lines, used for triage output
     */
    public String text() {
        String continued = continuationText();
        return continued.isEmpty() ? primaryText() : primaryText() + " / " + continued;
    }

    private static String join(List<RawLine> fragments) {
        return fragments.stream()
                .sorted(Comparator.comparing(RawLine::y).thenComparing(RawLine::x))
                .map(RawLine::text)
                .map(String::strip)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.joining(" "));
    }
}
