package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.config.LedgerProperties;
import com.example.ledgeraudit.domain.model.CanonicalLedger;
import com.example.ledgeraudit.domain.model.ControlTotalCheck;
import com.example.ledgeraudit.domain.model.SourceDocument;
import com.example.ledgeraudit.domain.model.TransactionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Compares each document's stated control figures (cover-letter net total, item count) with the
 * ledger records the document contributed to.
 */
@Service
public class ControlTotalReconciler {

    private static final Logger log = LoggerFactory.getLogger(ControlTotalReconciler.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal tolerancePercent;

    public ControlTotalReconciler(LedgerProperties properties) {
        this.tolerancePercent = BigDecimal.valueOf(properties.verification().controlTotalTolerancePercent());
    }

    /**
     * @param documents processed documents, in batch order
     * @param ledger    canonical ledger
     * @return one check per document that states a total or a count
     */
    public List<ControlTotalCheck> check(List<SourceDocument> documents, CanonicalLedger ledger) {
        List<ControlTotalCheck> checks = new ArrayList<>();
        for (SourceDocument document : documents) {
            if (document.controlTotalMinor() == null && document.controlItemCount() == null) {
                continue;
            }
            List<TransactionRecord> contributed = ledger.records().stream()
                    .filter(record -> record.allDocumentIds().contains(document.documentId()))
                    .toList();
            long ledgerTotal = contributed.stream().mapToLong(TransactionRecord::amountMinor).sum();
            int ledgerCount = contributed.size();

            Long difference = null;
            BigDecimal percent = null;
            boolean within = true;
            if (document.controlTotalMinor() != null) {
                long stated = document.controlTotalMinor();
                difference = ledgerTotal - stated;
                percent = percentOf(difference, stated);
                within = percent != null && percent.compareTo(tolerancePercent) <= 0;
            }
            if (document.controlItemCount() != null) {
                BigDecimal countPercent = percentOf(ledgerCount - document.controlItemCount(), document.controlItemCount());
                within = within && countPercent != null && countPercent.compareTo(tolerancePercent) <= 0;
            }
            if (!within) {
                log.warn("Control totals of {} deviate: stated {} / {} items, ledger {} / {} items",
                        document.documentId(), document.controlTotalMinor(), document.controlItemCount(), ledgerTotal, ledgerCount);
            }
            checks.add(new ControlTotalCheck(document.documentId(), document.controlTotalMinor(), ledgerTotal, difference,
                    percent, document.controlItemCount(), ledgerCount, within));
        }
        return checks;
    }

    /**
     * @return {@code |difference| / |stated| * 100} to four places; {@code null} when a non-zero difference meets a zero base
     */
    static BigDecimal percentOf(long difference, long stated) {
        if (stated == 0) {
            return difference == 0 ? BigDecimal.ZERO.setScale(4) : null;
        }
        return BigDecimal.valueOf(Math.abs(difference))
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(Math.abs(stated)), 4, RoundingMode.HALF_UP);
    }
}
