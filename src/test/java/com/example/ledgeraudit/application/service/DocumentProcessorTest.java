package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.config.LedgerProperties;
import com.example.ledgeraudit.domain.model.CanonicalLedger;
import com.example.ledgeraudit.domain.model.DocumentExtraction;
import com.example.ledgeraudit.domain.model.RawLine;
import com.example.ledgeraudit.domain.model.ReportingPeriod;
import com.example.ledgeraudit.domain.model.SourceDocument;
import com.example.ledgeraudit.domain.model.TransactionRecord;
import com.example.ledgeraudit.domain.model.ValidationRejection;
import com.example.ledgeraudit.infrastructure.text.InMemoryPageTextSource;
import com.example.ledgeraudit.support.LedgerFixtures;
import com.example.ledgeraudit.support.RegisterPage;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.example.ledgeraudit.support.RegisterPage.WARRANT_X;
import static org.assertj.core.api.Assertions.assertThat;

class DocumentProcessorTest {

    private final LedgerProperties properties = LedgerProperties.defaults();
    private final DocumentProcessor processor = new DocumentProcessor(new LayoutSegmenter(properties),
            new LineItemParser(properties), new RecordValidator(properties), new ReportingPeriodDetector());

    @Test
    void resolvesThePeriodFromTheBanner() {
        List<RawLine> lines = processor.acquire(new InMemoryPageTextSource(RegisterPage.page(0)
                .line(WARRANT_X, "Checks Dated 07/01/2025 through 07/31/2025")
                .row("0201234567", "07/15/2025", "ZUM SERVICES INC", "01-5803", "1,234.56")
                .row("0201234568", null, "ACME INC", "01-4300", "765.44")
                .lines()));

        DocumentExtraction extraction = processor.process(SourceDocument.register("reg-2025-07", 2025, null), lines,
                LedgerFixtures.referenceTables());

        assertThat(extraction.document().period())
                .isEqualTo(new ReportingPeriod(LocalDate.of(2025, 7, 1), LocalDate.of(2025, 7, 31)));
        assertThat(extraction.records()).hasSize(2);
        assertThat(extraction.records().get(0).fiscalYear()).isEqualTo(2025);
        assertThat(extraction.records()).anySatisfy(record ->
                assertThat(record.transactionDate()).isEqualTo(LocalDate.of(2025, 7, 31)));
        assertThat(extraction.rowCount()).isEqualTo(3);
        assertThat(extraction.skippedRowCount()).isEqualTo(1);
        assertThat(extraction.degradedPageCount()).isZero();
    }

    @Test
    void defaultsThePeriodToTheFiscalYear() {
        List<RawLine> lines = RegisterPage.page(0)
                .row("0201234567", "07/15/2025", "ZUM SERVICES INC", "01-5803", "1,234.56")
                .row("0201234568", "07/16/2025", "ACME INC", "01-4300", "765.44")
                .lines();

        DocumentExtraction extraction = processor.process(SourceDocument.register("reg-2025-07", 2025, null), lines,
                LedgerFixtures.referenceTables());

        assertThat(extraction.document().period())
                .isEqualTo(new ReportingPeriod(LocalDate.of(2025, 7, 1), LocalDate.of(2026, 6, 30)));
    }

    /**
     * Rows dated outside the document's fiscal year are kept in the side channel, not the ledger.
     */
    @Test
    void keepsRejectedRowsForReview() {
        List<RawLine> lines = RegisterPage.page(0)
                .row("0201234567", "07/15/2025", "ZUM SERVICES INC", "01-5803", "1,234.56")
                .row("0201234568", "06/16/2025", "ACME INC", "01-4300", "765.44")
                .lines();

        DocumentExtraction extraction = processor.process(SourceDocument.register("reg-2025-07", 2025, null), lines,
                LedgerFixtures.referenceTables());

        assertThat(extraction.records()).hasSize(1);
        assertThat(extraction.rejections()).singleElement().satisfies(rejection ->
                assertThat(rejection.reason()).isEqualTo(ValidationRejection.Reason.DATE_OUTSIDE_FISCAL_YEAR));
    }

    /**
     * Two fund-object lines of one warrant with equal amounts are two payments and both reach the ledger.
     */
    @Test
    void keepsEqualDistributionLinesOfOneWarrant() {
        List<RawLine> lines = RegisterPage.page(0)
                .row("0201234567", "07/15/2025", "ZUM SERVICES INC", "01-5803", "500.00")
                .row(null, null, null, "21-6200", "500.00")
                .row("0201234568", "07/16/2025", "ACME INC", "01-4300", "765.44")
                .lines();

        DocumentExtraction extraction = processor.process(SourceDocument.register("reg-2025-07", 2025, null), lines,
                LedgerFixtures.referenceTables());
        ReconciliationResult reconciled = new ReconciliationEngine(properties).reconcile(extraction.records());
        CanonicalLedger ledger = CanonicalLedger.of(reconciled.records());

        assertThat(extraction.records()).hasSize(3);
        assertThat(reconciled.exactMerges()).isZero();
        assertThat(ledger.recordCount()).isEqualTo(3);
        assertThat(ledger.netTotalMinor()).isEqualTo(176_544L);
        assertThat(ledger.records())
                .filteredOn(record -> "0201234567".equals(record.warrantOrCheckNumber()))
                .extracting(TransactionRecord::accountCode)
                .containsExactlyInAnyOrder("01-5803", "21-6200");
    }
}
