package com.example.ledgeraudit.infrastructure.pdf;

import com.example.ledgeraudit.domain.model.RawLine;
import com.example.ledgeraudit.infrastructure.exception.AcquisitionException;
import com.example.ledgeraudit.support.RegisterPdf;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests reading positioned text runs from generated register PDFs.
 */
class PdfBoxPageTextSourceTest {

    /**
     * Verifies that runs keep their page and horizontal position.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void emitsPositionedFragmentsPerPage() throws Exception {
        byte[] pdf = RegisterPdf.create()
                .page()
                .text(40, 120, "0201234567")
                .text(500, 120, "1,234.56")
                .page()
                .text(40, 120, "0201234568")
                .toBytes();

        List<RawLine> lines = read(new PdfBoxPageTextSource("reg-2025-07", pdf));

        assertThat(lines).extracting(RawLine::text).containsExactly("0201234567", "1,234.56", "0201234568");
        assertThat(lines).extracting(RawLine::pageIndex).containsExactly(0, 0, 1);
        assertThat(lines.get(0).x()).isCloseTo(40f, within(1f));
        assertThat(lines.get(1).x()).isCloseTo(500f, within(1f));
        assertThat(lines.get(0).y()).isCloseTo(lines.get(1).y(), within(1f));
        assertThat(lines).allSatisfy(line -> {
            assertThat(line.confidence()).isEqualTo(1.0);
            assertThat(line.box().width()).isPositive();
        });
    }

    /**
     * Reading twice yields the same fragments.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void isRepeatable() throws Exception {
        PdfBoxPageTextSource source = new PdfBoxPageTextSource("reg-2025-07",
                RegisterPdf.create().text(40, 120, "ACME").toBytes());

        assertThat(read(source)).isEqualTo(read(source));
    }

    @Test
    void rejectsBytesThatAreNotAPdf() {
        PdfBoxPageTextSource source = new PdfBoxPageTextSource("reg-2025-07",
                "not a pdf".getBytes(StandardCharsets.UTF_8));

        AcquisitionException ex = assertThrows(AcquisitionException.class, source::lines);
        assertThat(ex.getMessage()).contains("reg-2025-07");
    }

    private static List<RawLine> read(PdfBoxPageTextSource source) {
        try (Stream<RawLine> lines = source.lines()) {
            return lines.toList();
        }
    }
}
