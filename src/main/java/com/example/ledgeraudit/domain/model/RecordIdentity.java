package com.example.ledgeraudit.domain.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.HexFormat;

/**
 * Content-derived record identifiers. Re-reading the same document yields the same ids, so repeated
 * acquisition never duplicates records.
 */
public final class RecordIdentity {

    private RecordIdentity() {
    }

    /**
     * @return lowercase hex SHA-256 of {@code fiscalYear|normalizedPayee|amountMinor|date|warrantNumber|accountCode}
     */
    public static String of(int fiscalYear,
                            String normalizedPayee,
                            long amountMinor,
                            LocalDate transactionDate,
                            String warrantNumber,
                            String accountCode) {
        String key = fiscalYear
                + "|" + (normalizedPayee == null ? "" : normalizedPayee)
                + "|" + amountMinor
                + "|" + (transactionDate == null ? "" : transactionDate.toString())
                + "|" + (warrantNumber == null ? "" : warrantNumber)
                + "|" + (accountCode == null ? "" : accountCode);
        return sha256(key);
    }

    /**
     * Identifier of the n-th repetition of identical content within one document, counted from 1.
     * Occurrence 0 is the content id itself.
     */
    public static String occurrence(String recordId, int occurrence) {
        if (occurrence == 0) {
            return recordId;
        }
        return sha256(recordId + "#" + occurrence);
    }

    public static String sha256(String value) {
        return sha256(value.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256(byte[] value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 digest unavailable", ex);
        }
    }
}
