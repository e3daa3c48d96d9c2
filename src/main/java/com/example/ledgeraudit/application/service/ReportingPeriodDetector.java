package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.application.extract.TokenShapes;
import com.example.ledgeraudit.domain.model.RawLine;
import com.example.ledgeraudit.domain.model.ReportingPeriod;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads the reporting period from a register banner such as
 * {@code Checks Dated 07/01/2025 through 07/31/2025}.
 */
@Service
public class ReportingPeriodDetector {

    private static final Pattern BANNER = Pattern.compile(
            "(?i)dated\\s+(\\S+)\\s+(?:through|thru|to|-)\\s+(\\S+)");

    /**
     * Scans the first page that carries a banner.
     *
     * @param lines document fragments
     * @return the stated period, empty when no banner is found or its dates do not parse
     */
    public Optional<ReportingPeriod> detect(List<RawLine> lines) {
        String text = lines.stream()
                .sorted(Comparator.comparingInt(RawLine::pageIndex)
                        .thenComparing(RawLine::y)
                        .thenComparing(RawLine::x))
                .map(RawLine::text)
                .collect(Collectors.joining(" "));
        Matcher matcher = BANNER.matcher(text);
        while (matcher.find()) {
            Optional<LocalDate> start = TokenShapes.date(matcher.group(1));
            Optional<LocalDate> end = TokenShapes.date(matcher.group(2));
            if (start.isPresent() && end.isPresent() && !end.get().isBefore(start.get())) {
                return Optional.of(new ReportingPeriod(start.get(), end.get()));
            }
        }
        return Optional.empty();
    }
}
