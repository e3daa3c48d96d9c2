package com.example.ledgeraudit.infrastructure.reference;

import com.example.ledgeraudit.application.exception.ReferenceTablesMissingException;
import com.example.ledgeraudit.application.port.ReferenceTableSource;
import com.example.ledgeraudit.config.LedgerProperties;
import com.example.ledgeraudit.domain.model.ReferenceTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Loads the account-code table from a {@code code,description} CSV resource and combines it with the
 * configured object-code categories and fiscal calendar.
 */
@Component
public class ReferenceTableLoader implements ReferenceTableSource {

    private static final Logger log = LoggerFactory.getLogger(ReferenceTableLoader.class);

    private final ResourceLoader resourceLoader;
    private final LedgerProperties.Reference settings;

    public ReferenceTableLoader(ResourceLoader resourceLoader, LedgerProperties properties) {
        this.resourceLoader = resourceLoader;
        this.settings = properties.reference();
    }

    @Override
    public ReferenceTables load() {
        String location = settings.accountCodes();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ReferenceTablesMissingException(location);
        }
        Map<String, String> codes = new LinkedHashMap<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.strip();
                if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.toLowerCase(Locale.ROOT).startsWith("code,")) {
                    continue;
                }
                int comma = trimmed.indexOf(',');
                String code = comma >= 0 ? trimmed.substring(0, comma).strip() : trimmed;
                String description = comma >= 0 ? trimmed.substring(comma + 1).strip() : "";
                if (!code.isEmpty()) {
                    codes.put(code, unquote(description));
                }
            }
        } catch (IOException ex) {
            throw new ReferenceTablesMissingException(location, ex);
        }
        if (codes.isEmpty()) {
            throw new ReferenceTablesMissingException(location);
        }
        log.debug("Loaded {} account codes from {}", codes.size(), location);
        return new ReferenceTables(codes, settings.objectCategories(), settings.fiscalYearStartMonth());
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).replace("\"\"", "\"");
        }
        return value;
    }
}
