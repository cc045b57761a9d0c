package io.folioledger.core.p2p;

/**
 * Callbacks of the transport. Calls for one channel arrive in order and never overlap.
 */
public interface PeerListener {
    void onPeerConnected(PeerChannel channel);

    void onPeerDisconnected(PeerChannel channel);

    void onMessage(PeerChannel channel, P2pMessage message);
}
