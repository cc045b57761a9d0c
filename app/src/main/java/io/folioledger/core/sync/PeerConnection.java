package io.folioledger.core.sync;

import io.folioledger.core.p2p.P2pMessage;
import io.folioledger.core.p2p.PeerChannel;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Sync-level view of one transport channel: connection state, the remote node and the replies it
 * still owes. Every outstanding request has a deadline; expiry is reported to the engine.
 */
public final class PeerConnection {
    private final PeerChannel channel;
    private final ScheduledExecutorService timers;
    private final long timeoutMillis;
    private final BiConsumer<PeerConnection, String> onTimeout;
    private final Map<String, ScheduledFuture<?>> deadlines = new HashMap<>();

    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile String nodeId = "";
    private volatile long peerTip = -1L;
    private int catchUpFailures;
    private boolean reverse;

    public PeerConnection(PeerChannel channel,
                          ScheduledExecutorService timers,
                          long timeoutMillis,
                          BiConsumer<PeerConnection, String> onTimeout) {
        this.channel = channel;
        this.timers = timers;
        this.timeoutMillis = timeoutMillis;
        this.onTimeout = onTimeout;
    }

    public PeerChannel channel() {
        return channel;
    }

    public ConnectionState state() {
        return state;
    }

    public String nodeId() {
        return nodeId;
    }

    void nodeId(String id) {
        this.nodeId = id == null ? "" : id;
    }

    public long peerTip() {
        return peerTip;
    }

    void peerTip(long tip) {
        this.peerTip = tip;
    }

    /**
     * Moves to {@code next}. Returns false when already there.
     *
     * @throws IllegalStateException for a transition the lifecycle does not allow
     */
    synchronized boolean moveTo(ConnectionState next) {
        if (state == next) {
            return false;
        }
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next + " for " + this);
        }
        state = next;
        return true;
    }

    /** Marks the connection DISCONNECTED and drops every deadline. Returns false if it already was. */
    synchronized boolean disconnected() {
        cancelDeadlines();
        if (state == ConnectionState.DISCONNECTED) {
            return false;
        }
        state = ConnectionState.DISCONNECTED;
        return true;
    }

    public boolean isOpen() {
        return state != ConnectionState.DISCONNECTED && channel.isOpen();
    }

    public void send(P2pMessage message) {
        if (state != ConnectionState.DISCONNECTED) {
            channel.send(message);
        }
    }

    /** Starts the deadline for a reply identified by {@code key}, replacing an earlier one. */
    synchronized void expect(String key) {
        if (state == ConnectionState.DISCONNECTED) {
            return;
        }
        ScheduledFuture<?> previous = deadlines.remove(key);
        if (previous != null) {
            previous.cancel(false);
        }
        deadlines.put(key, timers.schedule(() -> expire(key), timeoutMillis, TimeUnit.MILLISECONDS));
    }

    /** The reply arrived. Returns false if nothing was outstanding under {@code key}. */
    synchronized boolean fulfil(String key) {
        ScheduledFuture<?> deadline = deadlines.remove(key);
        if (deadline == null) {
            return false;
        }
        deadline.cancel(false);
        return true;
    }

    synchronized boolean awaiting(String key) {
        return deadlines.containsKey(key);
    }

    synchronized int recordCatchUpFailure() {
        return ++catchUpFailures;
    }

    synchronized void resetCatchUpFailures() {
        catchUpFailures = 0;
    }

    synchronized boolean reverse() {
        return reverse;
    }

    synchronized void reverse(boolean value) {
        this.reverse = value;
    }

    private void expire(String key) {
        synchronized (this) {
            if (deadlines.remove(key) == null) {
                return;
            }
        }
        onTimeout.accept(this, key);
    }

    private void cancelDeadlines() {
        for (ScheduledFuture<?> deadline : deadlines.values()) {
            deadline.cancel(false);
        }
        deadlines.clear();
    }

    @Override
    public String toString() {
        String id = nodeId.isBlank() ? "?" : nodeId;
        return "Peer(" + id + "@" + channel.remoteAddress() + ", " + state + ")";
    }
}
