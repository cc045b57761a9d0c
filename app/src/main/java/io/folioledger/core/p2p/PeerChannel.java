package io.folioledger.core.p2p;

/**
 * One open connection to a peer, as seen by the sync layer. Sends never block.
 */
public interface PeerChannel {
    String remoteAddress();

    void send(P2pMessage message);

    void close();

    boolean isOpen();
}
