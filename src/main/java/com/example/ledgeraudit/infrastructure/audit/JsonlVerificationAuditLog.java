package com.example.ledgeraudit.infrastructure.audit;

import com.example.ledgeraudit.application.port.VerificationAuditLog;
import com.example.ledgeraudit.config.LedgerProperties;
import com.example.ledgeraudit.domain.model.VerificationResult;
import com.example.ledgeraudit.infrastructure.exception.AuditLogException;
import com.example.ledgeraudit.infrastructure.json.DeterministicJsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends one JSON line per verification result to a file. Existing lines are never rewritten.
 */
@Component
public class JsonlVerificationAuditLog implements VerificationAuditLog {

    private static final Logger log = LoggerFactory.getLogger(JsonlVerificationAuditLog.class);

    private final Path path;
    private final boolean enabled;
    private final DeterministicJsonWriter jsonWriter;
    private final Clock clock;

    public JsonlVerificationAuditLog(LedgerProperties properties, DeterministicJsonWriter jsonWriter, Clock clock) {
        this.path = Path.of(properties.audit().logPath());
        this.enabled = properties.audit().enabled();
        this.jsonWriter = jsonWriter;
        this.clock = clock;
    }

    @Override
    public synchronized void append(String runFingerprint, List<VerificationResult> results) {
        if (!enabled || results.isEmpty()) {
            return;
        }
        Instant recordedAt = clock.instant();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
                for (VerificationResult result : results) {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("recorded_at", recordedAt.toString());
                    entry.put("run_fingerprint", runFingerprint);
                    entry.put("result", result);
                    writer.write(jsonWriter.write(entry));
                    writer.write('\n');
                }
            }
        } catch (IOException ex) {
            throw new AuditLogException("Unable to append to the verification audit log at " + path, ex);
        }
        log.info("Appended {} verification results to {} (run {})", results.size(), path, runFingerprint);
    }
}
