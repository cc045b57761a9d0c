package io.folioledger.core.directory;

/** Connection state of a directory record as seen by the local node. */
public enum NodeState {
    DISCONNECTED,
    CONNECTING,
    SYNCING,
    SYNCED
}
