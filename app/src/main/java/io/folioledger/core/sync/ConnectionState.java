package io.folioledger.core.sync;

/**
 * Lifecycle of one peer connection. Forward moves follow the declared order; a synced peer may fall
 * back to CATCHING_UP; any state may drop to DISCONNECTED, which is final for the connection.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    HANDSHAKING,
    CATCHING_UP,
    SYNCED;

    public boolean canMoveTo(ConnectionState next) {
        if (next == DISCONNECTED) {
            return this != DISCONNECTED;
        }
        switch (this) {
            case DISCONNECTED:
                return false;
            case CONNECTING:
                return next == HANDSHAKING;
            case HANDSHAKING:
                return next == CATCHING_UP;
            case CATCHING_UP:
                return next == SYNCED;
            case SYNCED:
                return next == CATCHING_UP;
            default:
                return false;
        }
    }
}
