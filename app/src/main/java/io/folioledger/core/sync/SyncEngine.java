package io.folioledger.core.sync;

import io.folioledger.core.directory.NodeRole;
import io.folioledger.core.p2p.PeerConnector;
import io.folioledger.core.p2p.PeerListener;

import java.util.List;

/**
 * Role-specific driver of the sync protocol. The transport feeds it through {@link PeerListener}.
 */
public interface SyncEngine extends PeerListener {
    NodeRole role();

    /** Begins accepting peers; a miner also dials the authority through {@code connector}. */
    void start(PeerConnector connector);

    void stop();

    List<PeerConnection> connections();
}
