package com.example.ledgeraudit.application.port;

import com.example.ledgeraudit.domain.model.ReferenceTables;

/**
 * Supplier of the read-only reference tables.
 */
public interface ReferenceTableSource {

    /**
     * @return loaded tables
     * @throws com.example.ledgeraudit.application.exception.ReferenceTablesMissingException when the tables are absent or empty
     */
    ReferenceTables load();
}
