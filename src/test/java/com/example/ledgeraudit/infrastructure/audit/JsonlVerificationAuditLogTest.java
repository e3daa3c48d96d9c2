package com.example.ledgeraudit.infrastructure.audit;

import com.example.ledgeraudit.config.LedgerProperties;
import com.example.ledgeraudit.domain.model.ClaimResolutionGap;
import com.example.ledgeraudit.domain.model.ClaimUnit;
import com.example.ledgeraudit.domain.model.Verdict;
import com.example.ledgeraudit.domain.model.VerificationResult;
import com.example.ledgeraudit.infrastructure.json.DeterministicJsonWriter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonlVerificationAuditLogTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-09-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final VerificationResult verified = new VerificationResult("claim-1", Verdict.VERIFIED, ClaimUnit.USD,
            new BigDecimal("38374008"), new BigDecimal("38374008.00"), new BigDecimal("0.00"), BigDecimal.ONE,
            List.of("b", "a"), "PAYEE:ZUM SERVICES", null);
    private final VerificationResult unverifiable = new VerificationResult("claim-2", Verdict.UNVERIFIABLE, ClaimUnit.USD,
            BigDecimal.TEN, null, null, BigDecimal.ZERO, List.of(), "PAYEE:NOBODY", ClaimResolutionGap.BUCKET_NOT_FOUND);

    /**
     * A second run appends below the first; earlier lines stay untouched.
     */
    @Test
    void appendsOneLinePerResultAcrossRuns() throws Exception {
        Path path = tempDir.resolve("audit/verification.jsonl");
        JsonlVerificationAuditLog auditLog = auditLog(path, true);

        auditLog.append("run-1", List.of(verified, unverifiable));
        String afterFirstRun = Files.readString(path, StandardCharsets.UTF_8);
        auditLog.append("run-2", List.of(verified));

        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(3);
        assertThat(Files.readString(path, StandardCharsets.UTF_8)).startsWith(afterFirstRun);

        JsonNode first = new ObjectMapper().readTree(lines.get(0));
        assertThat(first.path("recorded_at").asText()).isEqualTo("2025-09-01T12:00:00Z");
        assertThat(first.path("run_fingerprint").asText()).isEqualTo("run-1");
        assertThat(first.path("result").path("claim_id").asText()).isEqualTo("claim-1");
        assertThat(lines.get(0)).contains("\"matched_value\":38374008.00", "\"evidence_record_ids\":[\"a\",\"b\"]");
        assertThat(lines.get(1)).contains("\"gap_reason\":\"BUCKET_NOT_FOUND\"");
        assertThat(lines.get(2)).contains("\"run_fingerprint\":\"run-2\"");
    }

    @Test
    void writesNothingWhenDisabled() {
        Path path = tempDir.resolve("disabled.jsonl");

        auditLog(path, false).append("run-1", List.of(verified));

        assertThat(path).doesNotExist();
    }

    private JsonlVerificationAuditLog auditLog(Path path, boolean enabled) {
        LedgerProperties properties = new LedgerProperties(null, null, null, null, null, null, null, null,
                new LedgerProperties.Audit(path.toString(), enabled), null);
        return new JsonlVerificationAuditLog(properties, new DeterministicJsonWriter(), CLOCK);
    }
}
