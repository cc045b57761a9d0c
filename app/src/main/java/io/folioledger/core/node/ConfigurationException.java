package io.folioledger.core.node;

import io.folioledger.core.LedgerException;

/** Invalid startup configuration. Fatal: the process exits non-zero. */
public class ConfigurationException extends LedgerException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
