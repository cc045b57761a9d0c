package io.folioledger.core.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.folioledger.core.p2p.P2pMessage;
import io.folioledger.core.p2p.PeerChannel;
import io.folioledger.core.p2p.PeerConnector;
import io.folioledger.core.p2p.PeerListener;
import io.folioledger.core.protocol.ProtocolLimits;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-process transport for sync tests. Every message goes through JSON like on the wire, and each
 * endpoint delivers on its own thread so per-channel ordering matches the Netty transport. Frames over
 * the transport limit close the link, as the frame decoder would.
 */
final class LoopbackConnector implements PeerConnector {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PeerListener server;
    private final PeerListener client;
    private final List<Link> links = new CopyOnWriteArrayList<>();
    private final List<ExecutorService> executors = new CopyOnWriteArrayList<>();
    private volatile boolean reachable = true;
    private volatile Predicate<P2pMessage> severTrigger;
    private volatile int largestFrame;

    LoopbackConnector(PeerListener server, PeerListener client) {
        this.server = server;
        this.client = client;
    }

    void reachable(boolean value) {
        this.reachable = value;
    }

    @Override
    public void connect(String host, int port, Consumer<Throwable> onFailure) {
        if (!reachable) {
            onFailure.accept(new IOException("Connection refused: " + host + ':' + port));
            return;
        }
        open(server, client);
    }

    /** Closes the link once, right after the first message matching {@code trigger} is delivered. */
    void severAfter(Predicate<P2pMessage> trigger) {
        this.severTrigger = trigger;
    }

    int linksOpened() {
        return links.size();
    }

    int largestFrame() {
        return largestFrame;
    }

    /** Opens a channel pair; {@code accepting} sees its side connect first. */
    Link open(PeerListener accepting, PeerListener dialing) {
        Link link = new Link(accepting, dialing);
        links.add(link);
        link.serverSide.connected();
        link.clientSide.connected();
        return link;
    }

    /** Drops every open channel, as a network partition would. */
    void severAll() {
        for (Link link : links) {
            link.close();
        }
    }

    void shutdown() {
        severAll();
        for (ExecutorService executor : executors) {
            executor.shutdownNow();
        }
    }

    final class Link {
        final Endpoint serverSide;
        final Endpoint clientSide;
        private final AtomicBoolean closed = new AtomicBoolean();

        Link(PeerListener accepting, PeerListener dialing) {
            this.serverSide = new Endpoint(this, accepting, "client:" + links.size());
            this.clientSide = new Endpoint(this, dialing, "server:0");
            serverSide.peer = clientSide;
            clientSide.peer = serverSide;
        }

        boolean isOpen() {
            return !closed.get();
        }

        void close() {
            if (closed.compareAndSet(false, true)) {
                serverSide.disconnected();
                clientSide.disconnected();
            }
        }
    }

    final class Endpoint implements PeerChannel {
        private final Link link;
        private final PeerListener owner;
        private final String remote;
        private final ExecutorService inbound;
        private Endpoint peer;

        Endpoint(Link link, PeerListener owner, String remote) {
            this.link = link;
            this.owner = owner;
            this.remote = remote;
            this.inbound = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "loopback-" + remote);
                t.setDaemon(true);
                return t;
            });
            executors.add(inbound);
        }

        void connected() {
            inbound.execute(() -> owner.onPeerConnected(this));
        }

        void disconnected() {
            inbound.execute(() -> owner.onPeerDisconnected(this));
        }

        /** Frames written before a close still arrive, ahead of the disconnect. */
        void deliver(P2pMessage message) {
            inbound.execute(() -> owner.onMessage(this, message));
        }

        @Override
        public String remoteAddress() {
            return remote;
        }

        @Override
        public void send(P2pMessage message) {
            if (!link.isOpen()) {
                return;
            }
            byte[] frame = encode(message);
            largestFrame = Math.max(largestFrame, frame.length);
            if (frame.length > ProtocolLimits.MAX_FRAME_BYTES) {
                link.close();
                return;
            }
            P2pMessage delivered = decode(frame, message.type());
            peer.deliver(delivered);
            Predicate<P2pMessage> trigger = severTrigger;
            if (trigger != null && trigger.test(delivered)) {
                severTrigger = null;
                link.close();
            }
        }

        @Override
        public void close() {
            link.close();
        }

        @Override
        public boolean isOpen() {
            return link.isOpen();
        }
    }

    private static byte[] encode(P2pMessage message) {
        try {
            return MAPPER.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Message does not encode: " + message.type(), e);
        }
    }

    private static P2pMessage decode(byte[] frame, String type) {
        try {
            return MAPPER.readValue(frame, P2pMessage.class);
        } catch (IOException e) {
            throw new IllegalStateException("Message does not survive JSON: " + type, e);
        }
    }
}
