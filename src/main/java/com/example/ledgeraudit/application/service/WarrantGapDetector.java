package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.domain.model.TransactionRecord;
import com.example.ledgeraudit.domain.model.WarrantNumberGap;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reports missing warrant numbers inside a document's sequences. Warrants are issued in order, so a
 * small hole usually means a row was lost in extraction; large jumps are treated as a new run.
 */
@Service
public class WarrantGapDetector {

    static final int MIN_STEP = 2;
    static final int MAX_STEP = 20;

    private static final Pattern PREFIXED = Pattern.compile("^([A-Z]+)-?(\\d+)$");
    private static final Pattern NUMERIC = Pattern.compile("^(\\d{3})(\\d+)$");

    /**
     * @param records canonical records
     * @return gaps ordered by document, series and position
     */
    public List<WarrantNumberGap> detect(List<TransactionRecord> records) {
        Map<String, Map<String, TreeMap<Long, String>>> sequences = new TreeMap<>();
        for (TransactionRecord record : records) {
            String warrant = record.warrantOrCheckNumber();
            if (warrant == null) {
                continue;
            }
            SeriesNumber parsed = parse(warrant);
            if (parsed == null) {
                continue;
            }
            for (String documentId : record.allDocumentIds()) {
                sequences.computeIfAbsent(documentId, id -> new TreeMap<>())
                        .computeIfAbsent(parsed.series(), series -> new TreeMap<>())
                        .put(parsed.number(), warrant);
            }
        }

        List<WarrantNumberGap> gaps = new ArrayList<>();
        sequences.forEach((documentId, bySeries) -> bySeries.forEach((series, numbers) -> {
            Map.Entry<Long, String> previous = null;
            for (Map.Entry<Long, String> current : numbers.entrySet()) {
                if (previous != null) {
                    long step = current.getKey() - previous.getKey();
                    if (step >= MIN_STEP && step <= MAX_STEP) {
                        gaps.add(new WarrantNumberGap(documentId, series, previous.getValue(), current.getValue(), step - 1));
                    }
                }
                previous = current;
            }
        }));
        return gaps;
    }

    static SeriesNumber parse(String warrant) {
        Matcher prefixed = PREFIXED.matcher(warrant);
        if (prefixed.matches()) {
            return new SeriesNumber(prefixed.group(1), Long.parseLong(prefixed.group(2)));
        }
        Matcher numeric = NUMERIC.matcher(warrant);
        if (numeric.matches() && numeric.group(2).length() <= 15) {
            return new SeriesNumber(numeric.group(1), Long.parseLong(numeric.group(2)));
        }
        return null;
    }

    record SeriesNumber(String series, long number) {
    }
}
