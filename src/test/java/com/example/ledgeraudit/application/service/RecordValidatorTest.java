package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.config.LedgerProperties;
import com.example.ledgeraudit.domain.model.DatePrecision;
import com.example.ledgeraudit.domain.model.ParseFlag;
import com.example.ledgeraudit.domain.model.ParsedLineItem;
import com.example.ledgeraudit.domain.model.ProvenanceConfidence;
import com.example.ledgeraudit.domain.model.RecordIdentity;
import com.example.ledgeraudit.domain.model.SourceDocument;
import com.example.ledgeraudit.domain.model.TransactionRecord;
import com.example.ledgeraudit.domain.model.ValidationRejection;
import com.example.ledgeraudit.support.LedgerFixtures;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RecordValidatorTest {

    private static final SourceDocument DOCUMENT = SourceDocument.register("reg-2025-07", 2025, null);

    private final RecordValidator validator = new RecordValidator(LedgerProperties.defaults());

    @Test
    void canonicalizesAcceptedItems() {
        ValidationOutcome outcome = validate(item("Zum Services, Inc.", "1234.56", LocalDate.of(2025, 7, 15)));

        assertThat(outcome.accepted()).isTrue();
        TransactionRecord record = outcome.record();
        assertThat(record.amountMinor()).isEqualTo(123_456L);
        assertThat(record.normalizedPayee()).isEqualTo("ZUM SERVICES");
        assertThat(record.payeeName()).isEqualTo("Zum Services, Inc.");
        assertThat(record.fiscalYear()).isEqualTo(2025);
        assertThat(record.sourceDocumentId()).isEqualTo("reg-2025-07");
        assertThat(record.provenanceConfidence()).isEqualTo(ProvenanceConfidence.HIGH);
        assertThat(record.recordId()).isEqualTo(
                RecordIdentity.of(2025, "ZUM SERVICES", 123_456L, LocalDate.of(2025, 7, 15), "0201234567", "01-5803"));
    }

    @Test
    void voidedItemsKeepTheirNegativeAmount() {
        ValidationOutcome outcome = validate(item("ACME INC", "-500.00", LocalDate.of(2025, 7, 17)));

        assertThat(outcome.record().amountMinor()).isEqualTo(-50_000L);
        assertThat(outcome.record().voided()).isTrue();
    }

    @Test
    void rejectsAmountsThatAreNotTwoDecimalNumbers() {
        assertThat(validate(item("ACME INC", "12.345", LocalDate.of(2025, 7, 17))).rejection().reason())
                .isEqualTo(ValidationRejection.Reason.UNPARSEABLE_AMOUNT);
        assertThat(validate(item("ACME INC", "1O0.00", LocalDate.of(2025, 7, 17))).rejection().reason())
                .isEqualTo(ValidationRejection.Reason.UNPARSEABLE_AMOUNT);
    }

    @Test
    void rejectsDatesOutsideTheFiscalYear() {
        ValidationOutcome outcome = validate(item("ACME INC", "10.00", LocalDate.of(2025, 6, 30)));

        assertThat(outcome.accepted()).isFalse();
        assertThat(outcome.rejection().reason()).isEqualTo(ValidationRejection.Reason.DATE_OUTSIDE_FISCAL_YEAR);
        assertThat(outcome.rejection().rawText()).isEqualTo("ACME INC 10.00");
    }

    @Test
    void toleranceWidensTheFiscalYearWindow() {
        RecordValidator lenient = new RecordValidator(new LedgerProperties(null, null,
                new LedgerProperties.Validation(1, null, null), null, null, null, null, null, null, null));

        ValidationOutcome outcome = lenient.validate(item("ACME INC", "10.00", LocalDate.of(2025, 6, 30)),
                DOCUMENT, LedgerFixtures.referenceTables());

        assertThat(outcome.accepted()).isTrue();
    }

    @Test
    void rejectsPayeesWithoutAlphanumerics() {
        assertThat(validate(item("...", "10.00", LocalDate.of(2025, 7, 17))).rejection().reason())
                .isEqualTo(ValidationRejection.Reason.EMPTY_PAYEE);
    }

    /**
     * Provenance falls with row confidence, ambiguity flags and degraded layout.
     */
    @Test
    void classifiesProvenanceConfidence() {
        assertThat(validator.classify(item(0.95, false, Set.of()))).isEqualTo(ProvenanceConfidence.HIGH);
        assertThat(validator.classify(item(0.8, false, Set.of()))).isEqualTo(ProvenanceConfidence.MEDIUM);
        assertThat(validator.classify(item(0.95, false, Set.of(ParseFlag.CONTINUATION_MERGED))))
                .isEqualTo(ProvenanceConfidence.MEDIUM);
        assertThat(validator.classify(item(0.95, false, Set.of(ParseFlag.UNKNOWN_ACCOUNT_CODE))))
                .isEqualTo(ProvenanceConfidence.HIGH);
        assertThat(validator.classify(item(0.95, false,
                Set.of(ParseFlag.CONTINUATION_MERGED, ParseFlag.MULTIPLE_DATE_CANDIDATES))))
                .isEqualTo(ProvenanceConfidence.LOW);
        assertThat(validator.classify(item(0.5, false, Set.of()))).isEqualTo(ProvenanceConfidence.LOW);
        assertThat(validator.classify(item(1.0, true, Set.of(ParseFlag.DEGRADED_LAYOUT))))
                .isEqualTo(ProvenanceConfidence.LOW);
    }

    private ValidationOutcome validate(ParsedLineItem item) {
        return validator.validate(item, DOCUMENT, LedgerFixtures.referenceTables());
    }

    private static ParsedLineItem item(String payee, String amount, LocalDate date) {
        return new ParsedLineItem("reg-2025-07", 0, 3, payee, amount, amount.startsWith("-"), date,
                DatePrecision.EXACT, "0201234567", "01-5803", true, "Services & Operating", 1.0, false,
                Set.of(), payee + " " + amount);
    }

    private static ParsedLineItem item(double confidence, boolean degraded, Set<ParseFlag> flags) {
        return new ParsedLineItem("reg-2025-07", 0, 3, "ACME INC", "10.00", false, LocalDate.of(2025, 7, 17),
                DatePrecision.EXACT, null, "01-4300", true, "Books and Supplies", confidence, degraded,
                flags, "ACME INC 10.00");
    }
}
