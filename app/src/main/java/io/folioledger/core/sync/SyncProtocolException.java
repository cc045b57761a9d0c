package io.folioledger.core.sync;

import io.folioledger.core.LedgerException;

/** A peer sent a message that does not fit the connection's state. The connection is dropped. */
public class SyncProtocolException extends LedgerException {
    public SyncProtocolException(String message) {
        super(message);
    }

    public SyncProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
