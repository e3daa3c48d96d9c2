package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.config.LedgerProperties;
import com.example.ledgeraudit.domain.model.CandidateRow;
import com.example.ledgeraudit.domain.model.ColumnLayout;
import com.example.ledgeraudit.domain.model.RawLine;
import com.example.ledgeraudit.support.RegisterPage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.ledgeraudit.support.RegisterPage.AMOUNT_X;
import static com.example.ledgeraudit.support.RegisterPage.CODE_X;
import static com.example.ledgeraudit.support.RegisterPage.DATE_X;
import static com.example.ledgeraudit.support.RegisterPage.PAYEE_X;
import static com.example.ledgeraudit.support.RegisterPage.WARRANT_X;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for row grouping, column inference and payee continuation handling.
 */
class LayoutSegmenterTest {

    private final LayoutSegmenter segmenter = new LayoutSegmenter(LedgerProperties.defaults());

    /**
     * Columns are re-estimated from the x-offsets the page actually uses.
     */
    @Test
    void infersColumnStartsFromAlignedRows() {
        List<RawLine> lines = RegisterPage.page(0)
                .line(WARRANT_X, "Checks Dated 07/01/2025 through 07/31/2025")
                .row("0201234567", "07/15/2025", "ZUM SERVICES INC", "01-5803", "1,234.56")
                .row("0201234568", "07/16/2025", "ACME INC", "01-4300", "765.44")
                .row("0201234569", "07/17/2025", "OFFICE DEPOT", "01-4300", "12.00")
                .lines();

        ColumnLayout layout = segmenter.inferColumns(segmenter.groupPhysicalLines(lines));

        assertThat(layout.starts()).containsExactly(WARRANT_X, DATE_X, PAYEE_X, CODE_X, AMOUNT_X);
    }

    @Test
    void emitsOneRowPerAnchoredLineAndBoilerplateAlone() {
        List<RawLine> lines = RegisterPage.page(0)
                .line(WARRANT_X, "Checks Dated 07/01/2025 through 07/31/2025")
                .row("0201234567", "07/15/2025", "ZUM SERVICES INC", "01-5803", "1,234.56")
                .row("0201234568", "07/16/2025", "ACME INC", "01-4300", "765.44")
                .lines();

        List<CandidateRow> rows = segmenter.segment("reg-2025-07", lines);

        assertThat(rows).hasSize(3);
        assertThat(rows).extracting(CandidateRow::rowIndex).containsExactly(0, 1, 2);
        assertThat(rows.get(0).primaryText()).startsWith("Checks Dated");
        assertThat(rows.get(1).primaryText()).isEqualTo("0201234567 07/15/2025 ZUM SERVICES INC 01-5803 1,234.56");
        assertThat(rows).noneMatch(CandidateRow::degraded);
        assertThat(rows).allSatisfy(row -> assertThat(row.confidence()).isEqualTo(1.0));
    }

    /**
     * A payee-only line joins the row above once the next line proves to be a new record.
     */
    @Test
    void confirmsWrappedPayeeAsContinuation() {
        List<RawLine> lines = RegisterPage.page(0)
                .row("0201234567", "07/15/2025", "PACIFIC GAS AND", "01-5500", "2,000.00")
                .line(PAYEE_X, "ELECTRIC COMPANY")
                .row("0201234568", "07/16/2025", "ACME INC", "01-4300", "765.44")
                .lines();

        List<CandidateRow> rows = segmenter.segment("reg-2025-07", lines);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).continuation()).isTrue();
        assertThat(rows.get(0).continuationText()).isEqualTo("ELECTRIC COMPANY");
        assertThat(rows.get(1).continuation()).isFalse();
    }

    /**
     * Without a following record the held line is not merged; it is emitted on its own.
     */
    @Test
    void leavesUnconfirmedTrailingLineAsSeparateRow() {
        List<RawLine> lines = RegisterPage.page(0)
                .row("0201234567", "07/15/2025", "ZUM SERVICES INC", "01-5803", "1,234.56")
                .row("0201234568", "07/16/2025", "ACME INC", "01-4300", "765.44")
                .line(PAYEE_X, "SEE ATTACHED")
                .lines();

        List<CandidateRow> rows = segmenter.segment("reg-2025-07", lines);

        assertThat(rows).hasSize(3);
        assertThat(rows.get(1).continuation()).isFalse();
        assertThat(rows.get(2).primaryText()).isEqualTo("SEE ATTACHED");
    }

    @Test
    void skipsStripeNoiseLines() {
        List<RawLine> lines = RegisterPage.page(0)
                .row("0201234567", "07/15/2025", "ZUM SERVICES INC", "01-5803", "1,234.56")
                .line(WARRANT_X, "=== ::: ~~")
                .row("0201234568", "07/16/2025", "ACME INC", "01-4300", "765.44")
                .lines();

        assertThat(segmenter.segment("reg-2025-07", lines)).hasSize(2);
    }

    /**
     * Nothing lines up, so the page is read as one column and every row carries degraded confidence.
     */
    @Test
    void fallsBackToSingleColumnWhenNoColumnsAreFound() {
        List<RawLine> lines = RegisterPage.page(0)
                .line(40f, "ZUM SERVICES INC 1,234.56")
                .line(100f, "ACME INC 500.00")
                .line(160f, "OFFICE DEPOT 20.00")
                .lines();

        List<CandidateRow> rows = segmenter.segment("scan-01", lines);

        assertThat(rows).hasSize(3);
        assertThat(rows).allSatisfy(row -> {
            assertThat(row.degraded()).isTrue();
            assertThat(row.layout().isSingleColumn()).isTrue();
            assertThat(row.confidence()).isEqualTo(0.5);
        });
    }

    @Test
    void rowConfidenceIsTheMinimumOfItsFragments() {
        List<RawLine> lines = RegisterPage.page(0)
                .row("0201234567", "07/15/2025", "ZUM SERVICES INC", "01-5803", "1,234.56")
                .confidence(0.7)
                .row("0201234568", "07/16/2025", "ACME INC", "01-4300", "765.44")
                .lines();

        List<CandidateRow> rows = segmenter.segment("reg-2025-07", lines);

        assertThat(rows).extracting(CandidateRow::confidence).containsExactly(1.0, 0.7);
    }

    @Test
    void restartsRowNumberingOnEveryPage() {
        List<RawLine> lines = RegisterPage.concat(
                RegisterPage.page(1)
                        .row("0201234569", "07/17/2025", "OFFICE DEPOT", "01-4300", "12.00")
                        .row("0201234570", "07/18/2025", "ACME INC", "01-4300", "1.00"),
                RegisterPage.page(0)
                        .row("0201234567", "07/15/2025", "ZUM SERVICES INC", "01-5803", "1,234.56")
                        .row("0201234568", "07/16/2025", "ACME INC", "01-4300", "765.44"));

        List<CandidateRow> rows = segmenter.segment("reg-2025-07", lines);

        assertThat(rows).extracting(CandidateRow::pageIndex).containsExactly(0, 0, 1, 1);
        assertThat(rows).extracting(CandidateRow::rowIndex).containsExactly(0, 1, 0, 1);
    }
}
