package com.example.ledgeraudit.interfaces.api.dto;

import java.util.List;

/**
 * API-layer DTO for one pipeline run: the documents to process and the claims to verify against them.
 */
public record BatchRequest(
        List<DocumentRequest> documents,
        List<ClaimRequest> claims
) {
}
