package com.example.ledgeraudit.application.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenCleanerTest {

    /**
     * Scanner stripes leave glyphs in front of the first word of a cell.
     */
    @Test
    void cleanStripsLeadingStripeArtifacts() {
        assertThat(TokenCleaner.clean("=:ZUM")).isEqualTo("ZUM");
        assertThat(TokenCleaner.clean("1=ZUM")).isEqualTo("ZUM");
        assertThat(TokenCleaner.clean("{ACME}")).isEqualTo("ACME");
        assertThat(TokenCleaner.clean("|1,234.56")).isEqualTo("1,234.56");
    }

    @Test
    void cleanDropsNoiseButKeepsLoneDash() {
        assertThat(TokenCleaner.clean("~~~")).isEmpty();
        assertThat(TokenCleaner.clean("._,")).isEmpty();
        assertThat(TokenCleaner.clean("-")).isEqualTo("-");
    }

    @Test
    void noiseLineDetection() {
        assertThat(TokenCleaner.isNoiseLine("=== ::: - ~~")).isTrue();
        assertThat(TokenCleaner.isNoiseLine("   ")).isTrue();
        assertThat(TokenCleaner.isNoiseLine("== ZUM")).isFalse();
    }
}
