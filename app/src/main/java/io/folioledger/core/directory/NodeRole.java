package io.folioledger.core.directory;

import java.util.Locale;

public enum NodeRole {
    AUTHORITY,
    ARCHIVAL_MINER;

    /**
     * Parses a role name. The deployment names {@code MASTER_NODE} and {@code ARCHIVAL_MINER_NODE}
     * are accepted as aliases.
     */
    public static NodeRole parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Node role required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (normalized) {
            case "AUTHORITY":
            case "MASTER_NODE":
            case "MASTER":
                return AUTHORITY;
            case "ARCHIVAL_MINER":
            case "ARCHIVAL_MINER_NODE":
            case "MINER":
                return ARCHIVAL_MINER;
            default:
                throw new IllegalArgumentException("Unknown node role: " + value);
        }
    }
}
