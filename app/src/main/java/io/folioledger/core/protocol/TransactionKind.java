package io.folioledger.core.protocol;

import java.util.Locale;

public enum TransactionKind {
    RECORD_ISSUANCE,
    NODE_REGISTRATION,
    ACCOUNT_REGISTRATION,
    DOCUMENT_REQUEST,
    REQUEST_CLOSED;

    public static TransactionKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Transaction kind required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown transaction kind: " + value);
        }
    }
}
