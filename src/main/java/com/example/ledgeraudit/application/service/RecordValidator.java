package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.config.LedgerProperties;
import com.example.ledgeraudit.domain.model.FiscalYear;
import com.example.ledgeraudit.domain.model.ParseFlag;
import com.example.ledgeraudit.domain.model.ParsedLineItem;
import com.example.ledgeraudit.domain.model.PayeeName;
import com.example.ledgeraudit.domain.model.ProvenanceConfidence;
import com.example.ledgeraudit.domain.model.RecordIdentity;
import com.example.ledgeraudit.domain.model.ReferenceTables;
import com.example.ledgeraudit.domain.model.SourceDocument;
import com.example.ledgeraudit.domain.model.TransactionRecord;
import com.example.ledgeraudit.domain.model.ValidationRejection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Enforces the ledger invariants on parsed line items and canonicalizes the survivors:
 * cents as integers, normalized payee, provenance confidence and the content-derived record id.
 */
@Service
public class RecordValidator {

    private static final Logger log = LoggerFactory.getLogger(RecordValidator.class);

    private final LedgerProperties.Validation settings;

    public RecordValidator(LedgerProperties properties) {
        this.settings = properties.validation();
    }

    /**
     * Validates one parsed item.
     *
     * @param item     parser output
     * @param document document the item came from
     * @param tables   reference tables (fiscal calendar)
     * @return the canonical record, or a rejection carrying the reason and raw text
     */
    public ValidationOutcome validate(ParsedLineItem item, SourceDocument document, ReferenceTables tables) {
        Optional<Long> amountMinor = toMinorUnits(item.amountText());
        if (amountMinor.isEmpty()) {
            return reject(item, ValidationRejection.Reason.UNPARSEABLE_AMOUNT, "amount '" + item.amountText() + "' is not a two-decimal number");
        }

        FiscalYear fiscalYear = tables.fiscalYear(document.fiscalYear());
        LocalDate date = item.transactionDate();
        int tolerance = settings.fiscalYearToleranceDays();
        if (date == null
                || date.isBefore(fiscalYear.startDate().minusDays(tolerance))
                || date.isAfter(fiscalYear.endDate().plusDays(tolerance))) {
            return reject(item, ValidationRejection.Reason.DATE_OUTSIDE_FISCAL_YEAR,
                    date + " is outside " + fiscalYear.label());
        }

        String normalizedPayee = PayeeName.normalize(item.payeeName());
        if (normalizedPayee.isEmpty()) {
            return reject(item, ValidationRejection.Reason.EMPTY_PAYEE, "payee is empty after normalization");
        }

        long amount = amountMinor.get();
        String recordId = RecordIdentity.of(document.fiscalYear(), normalizedPayee, amount, date, item.warrantNumber(),
                item.accountCode());
        TransactionRecord record = new TransactionRecord(
                recordId,
                document.documentId(),
                List.of(),
                List.of(),
                document.fiscalYear(),
                date,
                item.datePrecision(),
                PayeeName.display(item.payeeName()),
                normalizedPayee,
                amount,
                item.voided() || amount < 0,
                item.warrantNumber(),
                item.accountCode(),
                item.accountCodeKnown(),
                item.accountCategory(),
                classify(item),
                List.copyOf(item.flags()),
                item.pageIndex(),
                item.rowIndex(),
                item.rawText());
        return ValidationOutcome.accepted(record);
    }

    /**
     * HIGH needs a confident row without ambiguity; a weak row, a degraded page or two ambiguities make it LOW.
     */
    ProvenanceConfidence classify(ParsedLineItem item) {
        long ambiguities = item.flags().stream().filter(ParseFlag::ambiguity).count();
        if (item.degraded() || item.confidence() < settings.lowConfidenceThreshold() || ambiguities >= 2) {
            return ProvenanceConfidence.LOW;
        }
        if (item.confidence() >= settings.highConfidenceThreshold() && ambiguities == 0) {
            return ProvenanceConfidence.HIGH;
        }
        return ProvenanceConfidence.MEDIUM;
    }

    private Optional<Long> toMinorUnits(String amountText) {
        if (amountText == null || amountText.isBlank()) {
            return Optional.empty();
        }
        try {
            BigDecimal value = new BigDecimal(amountText.strip());
            if (value.scale() > 2) {
                return Optional.empty();
            }
            return Optional.of(value.movePointRight(2).longValueExact());
        } catch (NumberFormatException | ArithmeticException ex) {
            log.debug("Amount '{}' rejected: {}", amountText, ex.getMessage());
            return Optional.empty();
        }
    }

    private ValidationOutcome reject(ParsedLineItem item, ValidationRejection.Reason reason, String detail) {
        log.debug("Rejected row {}/{} of {}: {}", item.pageIndex(), item.rowIndex(), item.documentId(), detail);
        return ValidationOutcome.rejected(new ValidationRejection(item.documentId(), item.pageIndex(), item.rowIndex(),
                reason, detail, item.rawText()));
    }
}
