package io.folioledger.core.sync;

import io.folioledger.core.LedgerException;

/** The authority refused a miner's handshake. */
public class HandshakeRejectedException extends LedgerException {
    private final String reason;

    public HandshakeRejectedException(String reason) {
        super("Handshake rejected: " + reason);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
