package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.application.exception.CsvExportValidationException;
import com.example.ledgeraudit.domain.model.CanonicalLedger;
import com.example.ledgeraudit.domain.model.TransactionRecord;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Application-layer service that turns the canonical ledger into downloadable CSV content.
 */
@Service
public class LedgerCsvExportService {

	/**
	 * Runs validation and returns a CSV string containing every ledger record in record-id order.
	 *
	 * @param ledger canonical ledger of a finished batch
	 * @return CSV content ready to stream to the client
	 * @throws CsvExportValidationException when the ledger holds no records
	 */
    public String export(CanonicalLedger ledger) {
        if (ledger == null || ledger.records() == null || ledger.records().isEmpty()) {
            throw new CsvExportValidationException("No ledger records available for export.");
        }
        return buildCsv(ledger.records());
    }

	/**
	 * Builds the CSV output including the header row and sanitized values.
	 *
	 * @param records ledger records
	 * @return CSV document as a string
	 */
    private String buildCsv(List<TransactionRecord> records) {
        StringBuilder builder = new StringBuilder();
        builder.append("record_id,fiscal_year,transaction_date,date_precision,payee_name,normalized_payee,amount,voided,"
                + "warrant_or_check_number,account_code,account_category,provenance_confidence,source_document_id,"
                + "corroborating_document_ids,page_index,row_index\n");
        for (TransactionRecord record : records) {
            builder.append(record.recordId()).append(',')
                    .append(record.fiscalYear()).append(',')
                    .append(record.transactionDate()).append(',')
                    .append(record.datePrecision()).append(',')
                    .append(escape(record.payeeName())).append(',')
                    .append(escape(record.normalizedPayee())).append(',')
                    .append(BigDecimal.valueOf(record.amountMinor(), 2).toPlainString()).append(',')
                    .append(record.voided()).append(',')
                    .append(escape(record.warrantOrCheckNumber())).append(',')
                    .append(escape(record.accountCode())).append(',')
                    .append(escape(record.accountCategory())).append(',')
                    .append(record.provenanceConfidence()).append(',')
                    .append(escape(record.sourceDocumentId())).append(',')
                    .append(escape(String.join(";", record.corroboratingDocumentIds()))).append(',')
                    .append(record.pageIndex()).append(',')
                    .append(record.rowIndex())
                    .append('\n');
        }
        return builder.toString();
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or newlines.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n") || sanitized.contains("\r")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
