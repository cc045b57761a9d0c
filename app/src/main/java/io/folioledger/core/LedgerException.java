package io.folioledger.core;

/**
 * Base type for every ledger-level failure. All subclasses are unchecked so callers only catch the
 * kinds they can act on.
 */
public class LedgerException extends RuntimeException {
    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
