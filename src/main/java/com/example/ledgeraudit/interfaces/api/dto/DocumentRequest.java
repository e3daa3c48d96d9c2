package com.example.ledgeraudit.interfaces.api.dto;

import com.example.ledgeraudit.domain.model.DocumentType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * API-layer DTO describing one input document. Page text comes either inline ({@code lines}) or from an
 * OCR JSON file on the server ({@code ocrPath}).
 *
 * @param documentId       stable identifier used for provenance
 * @param fiscalYear       starting calendar year of the fiscal year; derived from {@code periodStart} when absent
 * @param documentType     register or vendor summary, defaults to register
 * @param periodStart      first day of the stated reporting period, optional
 * @param periodEnd        last day of the stated reporting period, optional
 * @param controlTotal     stated net total in dollars, optional
 * @param controlItemCount stated item count, optional
 * @param lines            inline OCR fragments
 * @param ocrPath          path of an OCR JSON file readable by the server
 */
public record DocumentRequest(
        String documentId,
        Integer fiscalYear,
        DocumentType documentType,
        LocalDate periodStart,
        LocalDate periodEnd,
        BigDecimal controlTotal,
        Integer controlItemCount,
        List<RawLineRequest> lines,
        String ocrPath
) {
}
