package com.example.ledgeraudit.domain.model;

public enum ClaimSourceKind {
    BUCKET,
    DOCUMENT,
    RECORD
}
