package io.folioledger.core.p2p;

import java.util.function.Consumer;

/** Opens outbound connections; failures are reported through {@code onFailure}. */
@FunctionalInterface
public interface PeerConnector {
    void connect(String host, int port, Consumer<Throwable> onFailure);
}
