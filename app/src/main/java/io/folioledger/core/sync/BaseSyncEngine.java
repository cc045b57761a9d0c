package io.folioledger.core.sync;

import io.folioledger.core.LedgerException;
import io.folioledger.core.directory.NodeDirectory;
import io.folioledger.core.directory.NodeRole;
import io.folioledger.core.directory.NodeState;
import io.folioledger.core.mempool.TransactionPool;
import io.folioledger.core.metrics.LedgerMetrics;
import io.folioledger.core.node.NodeContext;
import io.folioledger.core.p2p.P2pMessage;
import io.folioledger.core.p2p.PeerChannel;
import io.folioledger.core.protocol.Block;
import io.folioledger.core.protocol.BlockCodec;
import io.folioledger.core.protocol.BlockStatus;
import io.folioledger.core.protocol.ProtocolLimits;
import io.folioledger.core.storage.ChainIntegrityException;
import io.folioledger.core.storage.LedgerStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Connection bookkeeping and the pull-based catch-up shared by both roles. Either side can be the
 * receiver: it asks for {@code get_blocks(tip + 1, chunk)} until it holds the holder's tip, then
 * sends {@code sync_complete}. Receiving is idempotent by sequence, so an interrupted catch-up
 * simply resumes from the receiver's tip.
 */
public abstract class BaseSyncEngine implements SyncEngine {
    private static final Logger LOG = Logger.getLogger(BaseSyncEngine.class.getName());

    static final int MAX_BLOCKS_PER_REPLY = 512;
    static final int MAX_CATCH_UP_FAILURES = 3;

    protected final NodeContext ctx;
    protected final LedgerStore ledger;
    protected final TransactionPool pool;
    protected final NodeDirectory directory;
    protected final ScheduledExecutorService timers;

    private final Map<PeerChannel, PeerConnection> connections = new ConcurrentHashMap<>();
    private volatile boolean running;

    protected BaseSyncEngine(NodeContext ctx) {
        this.ctx = ctx;
        this.ledger = ctx.ledger();
        this.pool = ctx.pool();
        this.directory = ctx.directory();
        this.timers = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "folioledger-sync-" + ctx.role().name().toLowerCase(Locale.ROOT));
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public NodeRole role() {
        return ctx.role();
    }

    protected void markRunning(boolean value) {
        this.running = value;
    }

    protected boolean isRunning() {
        return running;
    }

    @Override
    public void stop() {
        running = false;
        for (PeerConnection conn : connections()) {
            conn.channel().close();
            disconnect(conn);
        }
        timers.shutdownNow();
    }

    @Override
    public List<PeerConnection> connections() {
        return new ArrayList<>(connections.values());
    }

    @Override
    public void onPeerConnected(PeerChannel channel) {
        if (!running) {
            channel.close();
            return;
        }
        PeerConnection conn = new PeerConnection(channel, timers, ctx.config().peerTimeoutMillis, this::onTimeout);
        connections.put(channel, conn);
        LOG.fine(() -> "Peer connected: " + channel.remoteAddress());
        synchronized (conn) {
            try {
                onConnected(conn);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Failed to open sync session with " + conn, e);
                fail(conn, e.getMessage());
            }
        }
    }

    @Override
    public void onPeerDisconnected(PeerChannel channel) {
        PeerConnection conn = connections.get(channel);
        if (conn != null) {
            disconnect(conn);
        }
    }

    @Override
    public void onMessage(PeerChannel channel, P2pMessage message) {
        PeerConnection conn = connections.get(channel);
        if (conn == null || conn.state() == ConnectionState.DISCONNECTED) {
            return;
        }
        LOG.fine(() -> "<- " + message.type() + " from " + conn);
        synchronized (conn) {
            try {
                dispatch(conn, message);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Dropping " + conn + " after failed " + message.type(), e);
                fail(conn, e.getMessage());
            }
        }
    }

    /** Called once per new transport channel, before any message of it. */
    protected abstract void onConnected(PeerConnection conn);

    /** Handles one protocol message; an exception drops the connection. */
    protected abstract void dispatch(PeerConnection conn, P2pMessage message);

    /** Both sides hold the same tip now. */
    protected abstract void onSynced(PeerConnection conn, long peerTip, String peerTipHash);

    protected abstract void onDisconnected(PeerConnection conn);

    /** Prepares a block received through catch-up for appending. */
    protected Block admitReceived(PeerConnection conn, Block block) {
        return block;
    }

    /** Blocks dropped while returning to the confirmed tip. */
    protected void onRolledBack(List<Block> removed) {
    }

    protected void moveTo(PeerConnection conn, ConnectionState next) {
        ConnectionState previous = conn.state();
        if (!conn.moveTo(next)) {
            return;
        }
        LOG.info(() -> role() + " sync: " + conn.channel().remoteAddress() + " " + previous + " -> " + next);
        String nodeId = conn.nodeId();
        if (nodeId.isBlank() || !directory.contains(nodeId)) {
            return;
        }
        switch (next) {
            case HANDSHAKING:
                directory.transition(nodeId, NodeState.CONNECTING);
                break;
            case CATCHING_UP:
                directory.transition(nodeId, NodeState.SYNCING);
                break;
            case SYNCED:
                directory.transition(nodeId, NodeState.SYNCED);
                break;
            default:
                break;
        }
    }

    /** Closes the channel and runs the disconnect path. */
    protected void fail(PeerConnection conn, String reason) {
        LOG.warning(() -> "Closing " + conn + ": " + reason);
        conn.channel().close();
        disconnect(conn);
    }

    private void disconnect(PeerConnection conn) {
        connections.remove(conn.channel(), conn);
        if (!conn.disconnected()) {
            return;
        }
        LOG.info(() -> role() + " sync: " + conn.channel().remoteAddress() + " -> DISCONNECTED");
        if (!conn.nodeId().isBlank()) {
            directory.markDisconnected(conn.nodeId());
        }
        onDisconnected(conn);
    }

    private void onTimeout(PeerConnection conn, String awaited) {
        fail(conn, "no " + awaited + " within " + ctx.config().peerTimeoutMillis + "ms");
    }

    protected void requestBlocks(PeerConnection conn) {
        long from = ledger.tip().sequence() + 1;
        conn.send(SyncMessages.getBlocks(from, ctx.config().catchUpChunkSize));
        conn.expect(SyncMessages.BLOCKS);
    }

    protected void serveBlocks(PeerConnection conn, P2pMessage message) {
        long from = Math.max(0L, SyncMessages.requireNumber(message, "from"));
        int max = (int) Math.max(1L, Math.min(SyncMessages.requireNumber(message, "max"), MAX_BLOCKS_PER_REPLY));
        List<Block> range = ledger.range(from, max);
        List<Block> blocks = SyncMessages.withinBudget(range, ProtocolLimits.MAX_REPLY_BYTES);
        if (blocks.size() < range.size()) {
            LOG.fine(() -> "Trimmed blocks reply to " + conn + " from " + range.size() + " to " + blocks.size());
        }
        conn.send(SyncMessages.blocks(blocks, ledger.tip().sequence()));
    }

    /** Applies one chunk, then asks for the next or finishes the catch-up. */
    protected void receiveBlocks(PeerConnection conn, P2pMessage message) {
        if (!conn.fulfil(SyncMessages.BLOCKS)) {
            LOG.fine(() -> "Ignoring unrequested blocks from " + conn);
            return;
        }
        List<Block> blocks = BlockCodec.listFromValue(message.value("blocks"));
        long holderTip = SyncMessages.requireNumber(message, "holderTip");
        conn.peerTip(holderTip);
        int appended = 0;
        try {
            for (Block block : blocks) {
                if (applyReceived(conn, block)) {
                    appended++;
                }
            }
        } catch (LedgerException e) {
            LedgerMetrics.blocksReceived(appended);
            recoverCatchUp(conn, e);
            return;
        }
        LedgerMetrics.blocksReceived(appended);
        if (appended > 0) {
            conn.resetCatchUpFailures();
        }
        if (!blocks.isEmpty() && ledger.tip().sequence() < holderTip) {
            requestBlocks(conn);
        } else {
            completeCatchUp(conn);
        }
    }

    /** Returns true if the block was appended, false if an identical one was already held. */
    protected boolean applyReceived(PeerConnection conn, Block block) {
        Optional<Block> held = ledger.find(block.sequence());
        if (held.isPresent()) {
            if (!held.get().contentHash().equals(block.contentHash())) {
                throw new ChainIntegrityException(block.sequence(), "received block differs from the one held");
            }
            if (block.isConfirmed() && !held.get().isConfirmed()) {
                ledger.updateStatus(block.sequence(), BlockStatus.CONFIRMED);
            }
            return false;
        }
        Block admitted = admitReceived(conn, block);
        ledger.append(admitted);
        pool.remove(admitted.transactionIds());
        return true;
    }

    /** Drops the unconfirmed suffix and asks again from the confirmed tip. */
    protected void recoverCatchUp(PeerConnection conn, LedgerException cause) {
        int failures = conn.recordCatchUpFailure();
        LOG.log(Level.WARNING, "Catch-up from " + conn + " failed (attempt " + failures + ")", cause);
        if (failures > MAX_CATCH_UP_FAILURES) {
            fail(conn, "catch-up failed " + failures + " times");
            return;
        }
        rollBackTo(ledger.confirmedTip().sequence());
        requestBlocks(conn);
    }

    protected void rollBackTo(long sequence) {
        List<Block> removed = ledger.truncateTo(sequence);
        if (!removed.isEmpty()) {
            LOG.info(() -> "Rolled back " + removed.size() + " unconfirmed block(s) to " + sequence);
            onRolledBack(removed);
        }
    }

    protected void completeCatchUp(PeerConnection conn) {
        Block tip = ledger.tip();
        conn.send(SyncMessages.syncComplete(tip));
        moveTo(conn, ConnectionState.SYNCED);
        ctx.checkpoint();
        onSynced(conn, tip.sequence(), tip.contentHash());
    }

    /** The holder side of a catch-up learns that the receiver reached {@code tip}. */
    protected void receiveSyncComplete(PeerConnection conn, P2pMessage message) {
        long tip = SyncMessages.requireNumber(message, "tip");
        String tipHash = message.text("tipHash");
        conn.peerTip(tip);
        if (conn.state() == ConnectionState.CATCHING_UP) {
            moveTo(conn, ConnectionState.SYNCED);
        }
        if (conn.state() != ConnectionState.SYNCED) {
            throw new SyncProtocolException("sync_complete in state " + conn.state());
        }
        onSynced(conn, tip, tipHash);
    }

    protected Optional<PeerConnection> connectionOf(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            return Optional.empty();
        }
        for (PeerConnection conn : connections.values()) {
            if (nodeId.equals(conn.nodeId()) && conn.state() != ConnectionState.DISCONNECTED) {
                return Optional.of(conn);
            }
        }
        return Optional.empty();
    }
}
