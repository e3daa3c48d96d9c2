package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.application.extract.AccountCodeExtractor;
import com.example.ledgeraudit.application.extract.AmountExtractor;
import com.example.ledgeraudit.application.extract.DateExtractor;
import com.example.ledgeraudit.application.extract.FieldExtraction;
import com.example.ledgeraudit.application.extract.PayeeExtractor;
import com.example.ledgeraudit.application.extract.RowClassifier;
import com.example.ledgeraudit.application.extract.RowContext;
import com.example.ledgeraudit.application.extract.Token;
import com.example.ledgeraudit.application.extract.TokenShapes;
import com.example.ledgeraudit.application.extract.VoidMarkerExtractor;
import com.example.ledgeraudit.application.extract.WarrantNumberExtractor;
import com.example.ledgeraudit.config.LedgerProperties;
import com.example.ledgeraudit.domain.model.CandidateRow;
import com.example.ledgeraudit.domain.model.DatePrecision;
import com.example.ledgeraudit.domain.model.ParseFailure;
import com.example.ledgeraudit.domain.model.ParseFlag;
import com.example.ledgeraudit.domain.model.ParsedLineItem;
import com.example.ledgeraudit.domain.model.ReferenceTables;
import com.example.ledgeraudit.domain.model.ReportingPeriod;
import com.example.ledgeraudit.domain.model.SourceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns candidate rows into line items by running an ordered set of field extractors:
 * amount, void marker, date, warrant number, account code, payee. Each extractor only sees the tokens
 * its predecessors left unclaimed. A row holding only an account code and an amount is a further
 * distribution line of the last warrant on the page and takes over its payee, date and number.
 */
@Service
public class LineItemParser {

    private static final Logger log = LoggerFactory.getLogger(LineItemParser.class);
    private static final Pattern SUBTOTAL_LABEL = Pattern.compile("(?i)(sub-?)?totals?:?|page");

    private final LedgerProperties.Parsing settings;
    private final float columnSlack;
    private final RowClassifier classifier;
    private final AmountExtractor amountExtractor = new AmountExtractor();
    private final VoidMarkerExtractor voidExtractor;
    private final DateExtractor dateExtractor = new DateExtractor();
    private final WarrantNumberExtractor warrantExtractor;
    private final AccountCodeExtractor accountCodeExtractor;
    private final PayeeExtractor payeeExtractor = new PayeeExtractor();

    public LineItemParser(LedgerProperties properties) {
        this.settings = properties.parsing();
        this.columnSlack = properties.segmentation().columnBinWidth().floatValue() / 2f;
        this.classifier = new RowClassifier(settings);
        this.voidExtractor = new VoidMarkerExtractor(settings.voidKeywords());
        this.warrantExtractor = new WarrantNumberExtractor(settings.warrantNumberRegex());
        this.accountCodeExtractor = new AccountCodeExtractor(settings.accountCodeRegex());
    }

    /**
     * Parses the rows of one document. Page-level state (running total, last seen date) resets on every page.
     *
     * @param rows      segmented rows in page order
     * @param document  source document, its period must already be resolved
     * @param tables    reference tables
     * @return one result per row, in row order
     */
    public List<RowParseResult> parse(List<CandidateRow> rows, SourceDocument document, ReferenceTables tables) {
        List<RowParseResult> results = new ArrayList<>(rows.size());
        PageState page = null;
        for (CandidateRow row : rows) {
            if (page == null || page.pageIndex != row.pageIndex()) {
                page = new PageState(row.pageIndex());
            }
            RowParseResult result = parseRow(row, document, tables, page);
            if (result.kind() == RowParseResult.Kind.PARSED) {
                ParsedLineItem item = result.item();
                page.runningTotalMinor += new BigDecimal(item.amountText()).movePointRight(2).longValueExact();
                page.parsedRows++;
                if (item.datePrecision() == DatePrecision.EXACT) {
                    page.lastDate = item.transactionDate();
                }
                if (item.warrantNumber() != null && !item.payeeName().isEmpty()) {
                    page.lastWarrantLine = item;
                }
            } else if (result.kind() == RowParseResult.Kind.SKIPPED) {
                log.debug("Skipped row {}/{} of {} ({}): {}", row.pageIndex(), row.rowIndex(), document.documentId(),
                        result.skipReason(), row.text());
            }
            results.add(result);
        }
        return results;
    }

    RowParseResult parseRow(CandidateRow row, SourceDocument document, ReferenceTables tables, PageState page) {
        String text = row.text();
        if (classifier.isBoilerplate(row.primaryText())) {
            return RowParseResult.skipped("boilerplate");
        }
        List<Token> tokens = Token.split(row.lines(), row.layout(), columnSlack);
        if (tokens.isEmpty()) {
            return RowParseResult.skipped("noise");
        }
        if (isSubtotal(tokens, page)) {
            return RowParseResult.skipped("subtotal");
        }

        RowContext context = new RowContext(row, tokens, Token.split(row.continuationLines(), row.layout(), columnSlack),
                document, tables);
        Set<Integer> consumed = new HashSet<>();
        Set<ParseFlag> flags = EnumSet.noneOf(ParseFlag.class);
        double confidence = row.confidence();

        FieldExtraction<TokenShapes.CurrencyToken> amount = amountExtractor.extract(context, consumed);
        if (amount.failed()) {
            ParseFailure.Reason reason = amount.failure();
            if (reason == ParseFailure.Reason.NO_AMOUNT && !classifier.hasAnchor(RowClassifier.words(text))) {
                reason = ParseFailure.Reason.STRAY_LINE;
            }
            return RowParseResult.failed(new ParseFailure(document.documentId(), row.pageIndex(), row.rowIndex(), reason, text));
        }
        confidence = absorb(amount, consumed, flags, confidence);

        FieldExtraction<Boolean> voidMarker = voidExtractor.extract(context, consumed);
        confidence = absorb(voidMarker, consumed, flags, confidence);
        boolean voided = amount.value().negative() || voidMarker.optional().orElse(false);

        FieldExtraction<LocalDate> date = dateExtractor.extract(context, consumed);
        confidence = absorb(date, consumed, flags, confidence);

        FieldExtraction<String> warrant = warrantExtractor.extract(context, consumed);
        confidence = absorb(warrant, consumed, flags, confidence);

        FieldExtraction<String> accountCode = accountCodeExtractor.extract(context, consumed);
        confidence = absorb(accountCode, consumed, flags, confidence);
        Optional<String> category = tables.categoryOf(accountCode.value());

        FieldExtraction<String> payee = payeeExtractor.extract(context, consumed);
        confidence = absorb(payee, consumed, flags, confidence);

        LocalDate transactionDate = date.value();
        DatePrecision precision = DatePrecision.EXACT;
        String payeeName = payee.optional().orElse("");
        String warrantNumber = warrant.value();
        ParsedLineItem header = page.lastWarrantLine;
        if (header != null && transactionDate == null && warrantNumber == null && payeeName.isEmpty()
                && accountCode.value() != null) {
            // further fund-object line of the warrant above
            transactionDate = header.transactionDate();
            precision = header.datePrecision();
            payeeName = header.payeeName();
            warrantNumber = header.warrantNumber();
            flags.add(ParseFlag.WARRANT_CONTINUED);
        } else if (transactionDate == null) {
            if (settings.carryForwardDates() && page.lastDate != null) {
                transactionDate = page.lastDate;
                precision = DatePrecision.INHERITED;
                flags.add(ParseFlag.DATE_INHERITED);
            } else {
                transactionDate = periodOf(document, tables).end();
                precision = DatePrecision.PERIOD_ONLY;
                flags.add(ParseFlag.DATE_DEFAULTED_TO_PERIOD);
            }
        }

        if (row.degraded()) {
            flags.add(ParseFlag.DEGRADED_LAYOUT);
        }
        String amountText = voided ? "-" + amount.value().plain() : amount.value().plain();
        return RowParseResult.parsed(new ParsedLineItem(
                document.documentId(),
                row.pageIndex(),
                row.rowIndex(),
                payeeName,
                amountText,
                voided,
                transactionDate,
                precision,
                warrantNumber,
                accountCode.value(),
                accountCode.value() != null && tables.knowsAccountCode(accountCode.value()),
                category.orElse(null),
                confidence,
                row.degraded(),
                flags,
                text));
    }

    /**
     * A row without payee words whose only numeric token equals the running total of the rows above it on
     * the page is a subtotal.
     */
    private boolean isSubtotal(List<Token> tokens, PageState page) {
        if (page.parsedRows == 0) {
            return false;
        }
        List<Token> numeric = tokens.stream().filter(token -> TokenShapes.hasDigit(token.text())).toList();
        if (numeric.size() != 1) {
            return false;
        }
        boolean wordy = tokens.stream()
                .filter(token -> !TokenShapes.hasDigit(token.text()))
                .anyMatch(token -> token.text().chars().anyMatch(Character::isLetter)
                        && !SUBTOTAL_LABEL.matcher(token.text()).matches());
        if (wordy) {
            return false;
        }
        return TokenShapes.currency(numeric.get(0).text())
                .map(TokenShapes.CurrencyToken::minorUnits)
                .filter(value -> value == page.runningTotalMinor)
                .isPresent();
    }

    private static double absorb(FieldExtraction<?> extraction, Set<Integer> consumed, Set<ParseFlag> flags, double confidence) {
        consumed.addAll(extraction.consumed());
        flags.addAll(extraction.flags());
        return Math.min(confidence, confidence * extraction.confidence());
    }

    private static ReportingPeriod periodOf(SourceDocument document, ReferenceTables tables) {
        return document.period() != null ? document.period() : ReportingPeriod.of(tables.fiscalYear(document.fiscalYear()));
    }

    static final class PageState {
        private final int pageIndex;
        private long runningTotalMinor;
        private int parsedRows;
        private LocalDate lastDate;
        private ParsedLineItem lastWarrantLine;

        PageState(int pageIndex) {
            this.pageIndex = pageIndex;
        }
    }
}
