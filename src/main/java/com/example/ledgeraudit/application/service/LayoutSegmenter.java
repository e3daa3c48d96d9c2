package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.application.extract.RowClassifier;
import com.example.ledgeraudit.application.extract.TokenCleaner;
import com.example.ledgeraudit.config.LedgerProperties;
import com.example.ledgeraudit.domain.model.CandidateRow;
import com.example.ledgeraudit.domain.model.ColumnLayout;
import com.example.ledgeraudit.domain.model.RawLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Groups positioned fragments into candidate rows.
 * Fragments within the configured vertical gap form one physical line; column starts are re-estimated
 * on every page from the most common x-offsets. Payee-only lines are held until the next line shows
 * whether they continue the previous row.
 */
@Service
public class LayoutSegmenter {

    private static final Logger log = LoggerFactory.getLogger(LayoutSegmenter.class);

    private final LedgerProperties.Segmentation settings;
    private final RowClassifier classifier;

    public LayoutSegmenter(LedgerProperties properties) {
        this.settings = properties.segmentation();
        this.classifier = new RowClassifier(properties.parsing());
    }

    /**
     * Segments every page of a document.
     *
     * @param documentId source document identifier
     * @param lines      all fragments of the document
     * @return rows ordered by page, then top to bottom
     */
    public List<CandidateRow> segment(String documentId, List<RawLine> lines) {
        Map<Integer, List<RawLine>> pages = lines.stream()
                .collect(Collectors.groupingBy(RawLine::pageIndex, TreeMap::new, Collectors.toList()));
        List<CandidateRow> rows = new ArrayList<>();
        pages.forEach((pageIndex, fragments) -> rows.addAll(segmentPage(documentId, pageIndex, fragments)));
        return rows;
    }

    /**
     * Segments a single page.
     *
     * @param documentId source document identifier
     * @param pageIndex  zero-based page index
     * @param fragments  fragments of the page
     * @return rows top to bottom
     */
    public List<CandidateRow> segmentPage(String documentId, int pageIndex, List<RawLine> fragments) {
        List<List<RawLine>> physicalLines = groupPhysicalLines(fragments);
        ColumnLayout layout = inferColumns(physicalLines);
        boolean degraded = layout.isSingleColumn();
        if (degraded && !physicalLines.isEmpty()) {
            log.warn("No columns detected on page {} of {}; reading it in single-column mode", pageIndex, documentId);
        }

        PageRows rows = new PageRows(documentId, pageIndex, layout, degraded, settings.degradedConfidenceFactor());
        for (List<RawLine> physical : physicalLines) {
            String text = joinText(physical);
            if (TokenCleaner.isNoiseLine(text)) {
                continue;
            }
            if (classifier.isBoilerplate(text)) {
                rows.flushAll();
                rows.emit(physical, List.of());
                continue;
            }
            List<String> words = RowClassifier.words(text);
            if (!classifier.hasAnchor(words)) {
                rows.holdPending(physical);
                continue;
            }
            if (classifier.hasAmountOrDate(words)) {
                rows.confirmPendingAsContinuation();
            } else {
                rows.releasePendingAsStray();
            }
            rows.flushHeld();
            rows.hold(physical);
        }
        rows.flushAll();
        log.debug("Segmented page {} of {} into {} rows across {} columns", pageIndex, documentId,
                rows.emitted.size(), layout.columnCount());
        return rows.emitted;
    }

    List<List<RawLine>> groupPhysicalLines(List<RawLine> fragments) {
        List<RawLine> ordered = fragments.stream()
                .filter(fragment -> !fragment.text().isBlank())
                .sorted(Comparator.comparing(RawLine::y).thenComparing(RawLine::x).thenComparing(RawLine::lineIndex))
                .toList();
        List<List<RawLine>> lines = new ArrayList<>();
        List<RawLine> current = new ArrayList<>();
        float anchorY = 0f;
        for (RawLine fragment : ordered) {
            if (!current.isEmpty() && fragment.y() - anchorY > settings.rowGap()) {
                lines.add(sortByX(current));
                current = new ArrayList<>();
            }
            if (current.isEmpty()) {
                anchorY = fragment.y();
            }
            current.add(fragment);
        }
        if (!current.isEmpty()) {
            lines.add(sortByX(current));
        }
        return lines;
    }

    /**
     * Clusters the x-offsets where text segments start. A cluster becomes a column when enough distinct
     * lines contribute to it.
     */
    ColumnLayout inferColumns(List<List<RawLine>> physicalLines) {
        float binWidth = settings.columnBinWidth().floatValue();
        List<float[]> starts = new ArrayList<>();
        for (int lineIndex = 0; lineIndex < physicalLines.size(); lineIndex++) {
            RawLine previous = null;
            for (RawLine fragment : physicalLines.get(lineIndex)) {
                if (previous == null || fragment.x() - previous.box().endX() > binWidth) {
                    starts.add(new float[]{fragment.x(), lineIndex});
                }
                previous = fragment;
            }
        }
        if (starts.isEmpty()) {
            return ColumnLayout.singleColumn();
        }
        starts.sort(Comparator.comparingDouble(start -> start[0]));

        int required = Math.max(2, (int) Math.ceil(settings.minColumnSupport() * physicalLines.size()));
        List<Float> columns = new ArrayList<>();
        float clusterStart = starts.get(0)[0];
        float last = clusterStart;
        Set<Integer> support = new HashSet<>();
        for (float[] start : starts) {
            if (start[0] - last > binWidth) {
                if (support.size() >= required) {
                    columns.add(clusterStart);
                }
                clusterStart = start[0];
                support = new HashSet<>();
            }
            support.add((int) start[1]);
            last = start[0];
        }
        if (support.size() >= required) {
            columns.add(clusterStart);
        }
        return new ColumnLayout(columns);
    }

    private static List<RawLine> sortByX(List<RawLine> line) {
        return line.stream().sorted(Comparator.comparing(RawLine::x)).toList();
    }

    private static String joinText(List<RawLine> physical) {
        return physical.stream().map(RawLine::text).collect(Collectors.joining(" "));
    }

    /**
     * Row assembly state for one page: the last anchored line not yet emitted and the payee-only lines
     * waiting for confirmation.
     */
    private static final class PageRows {
        private final String documentId;
        private final int pageIndex;
        private final ColumnLayout layout;
        private final boolean degraded;
        private final double degradedFactor;
        private final List<CandidateRow> emitted = new ArrayList<>();
        private final List<List<RawLine>> pending = new ArrayList<>();
        private List<RawLine> held;
        private List<RawLine> heldContinuation = new ArrayList<>();

        private PageRows(String documentId, int pageIndex, ColumnLayout layout, boolean degraded, double degradedFactor) {
            this.documentId = documentId;
            this.pageIndex = pageIndex;
            this.layout = layout;
            this.degraded = degraded;
            this.degradedFactor = degradedFactor;
        }

        void holdPending(List<RawLine> physical) {
            pending.add(physical);
        }

        void hold(List<RawLine> physical) {
            held = physical;
            heldContinuation = new ArrayList<>();
        }

        void confirmPendingAsContinuation() {
            if (held == null) {
                releasePendingAsStray();
                return;
            }
            pending.forEach(heldContinuation::addAll);
            pending.clear();
        }

        void releasePendingAsStray() {
            flushHeld();
            for (List<RawLine> line : pending) {
                emit(line, List.of());
            }
            pending.clear();
        }

        void flushHeld() {
            if (held != null) {
                emit(held, heldContinuation);
                held = null;
                heldContinuation = new ArrayList<>();
            }
        }

        void flushAll() {
            releasePendingAsStray();
            flushHeld();
        }

        void emit(List<RawLine> lines, List<RawLine> continuation) {
            emitted.add(CandidateRow.of(documentId, pageIndex, emitted.size(), lines, continuation, layout,
                    degraded, degradedFactor));
        }
    }
}
