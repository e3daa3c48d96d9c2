package com.example.ledgeraudit.domain.model;

public enum ProvenanceConfidence {
    HIGH,
    MEDIUM,
    LOW
}
