package io.folioledger.core.storage;

import io.folioledger.core.LedgerException;

/** Persisted state is corrupt or inconsistent. The node refuses to serve. */
public class StartupIntegrityException extends LedgerException {
    public StartupIntegrityException(String message) {
        super(message);
    }

    public StartupIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
