package com.example.ledgeraudit.application.extract;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class TokenShapesTest {

    @Test
    void currencyAcceptsSeparatorsAndNegativeForms() {
        assertThat(TokenShapes.currency("1,234.56")).hasValueSatisfying(token -> {
            assertThat(token.plain()).isEqualTo("1234.56");
            assertThat(token.negative()).isFalse();
            assertThat(token.minorUnits()).isEqualTo(123456L);
        });
        assertThat(TokenShapes.currency("$38,374,008.00")).hasValueSatisfying(token ->
                assertThat(token.minorUnits()).isEqualTo(3_837_400_800L));
        assertThat(TokenShapes.currency("(500.00)")).hasValueSatisfying(token -> assertThat(token.negative()).isTrue());
        assertThat(TokenShapes.currency("500.00-")).hasValueSatisfying(token -> assertThat(token.signed()).isEqualTo("-500.00"));
    }

    /**
     * Account codes, warrant numbers and malformed figures are not amounts.
     */
    @Test
    void currencyRejectsNonAmounts() {
        assertThat(TokenShapes.isCurrency("01-5803")).isFalse();
        assertThat(TokenShapes.isCurrency("0201234567")).isFalse();
        assertThat(TokenShapes.isCurrency("12,34.56")).isFalse();
        assertThat(TokenShapes.isCurrency("1234.5")).isFalse();
        assertThat(TokenShapes.isCurrency("(500.00")).isFalse();
    }

    @Test
    void dateAcceptsUsAndIsoForms() {
        assertThat(TokenShapes.date("07/15/2025")).contains(LocalDate.of(2025, 7, 15));
        assertThat(TokenShapes.date("7/1/25")).contains(LocalDate.of(2025, 7, 1));
        assertThat(TokenShapes.date("07-15-2025")).contains(LocalDate.of(2025, 7, 15));
        assertThat(TokenShapes.date("2025-07-15")).contains(LocalDate.of(2025, 7, 15));
    }

    @Test
    void dateRejectsImpossibleCalendarValues() {
        assertThat(TokenShapes.date("02/30/2025")).isEmpty();
        assertThat(TokenShapes.date("13/01/2025")).isEmpty();
        assertThat(TokenShapes.date("01-5803")).isEmpty();
        assertThat(TokenShapes.date("2025-02-30")).isEmpty();
    }
}
