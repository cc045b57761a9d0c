package io.folioledger.core.mempool;

import io.folioledger.core.protocol.ProtocolLimits;
import io.folioledger.core.protocol.Transaction;
import io.folioledger.core.protocol.TransactionKind;

import java.nio.charset.StandardCharsets;

public class TxValidator {
    private final int maxPayloadBytes;

    public TxValidator(int maxPayloadBytes) {
        this.maxPayloadBytes = maxPayloadBytes;
    }

    public TxValidator() {
        this(ProtocolLimits.MAX_PAYLOAD_BYTES);
    }

    public void validate(Transaction tx) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction required");
        }
        if (tx.id().isBlank() || tx.id().length() > ProtocolLimits.MAX_ID_LEN) {
            throw new IllegalArgumentException("Transaction id must be 1.." + ProtocolLimits.MAX_ID_LEN + " characters");
        }
        if (tx.createdAt() <= 0) {
            throw new IllegalArgumentException("createdAt must be > 0");
        }
        if (tx.payload().getBytes(StandardCharsets.UTF_8).length > maxPayloadBytes) {
            throw new IllegalArgumentException("Payload exceeds " + maxPayloadBytes + " bytes");
        }
        if ((tx.kind() == TransactionKind.RECORD_ISSUANCE || tx.kind() == TransactionKind.NODE_REGISTRATION)
                && tx.payload().isBlank()) {
            throw new IllegalArgumentException(tx.kind() + " requires a payload");
        }
    }
}
