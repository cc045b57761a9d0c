package io.folioledger.core.sync;

import io.folioledger.core.directory.DuplicateNodeException;
import io.folioledger.core.directory.NodeRecord;
import io.folioledger.core.directory.NodeRole;
import io.folioledger.core.mempool.TransactionPool;
import io.folioledger.core.metrics.LedgerMetrics;
import io.folioledger.core.node.NodeConfig;
import io.folioledger.core.node.NodeContext;
import io.folioledger.core.p2p.P2pMessage;
import io.folioledger.core.p2p.PeerConnector;
import io.folioledger.core.protocol.Block;
import io.folioledger.core.protocol.BlockCodec;
import io.folioledger.core.protocol.BlockStatus;
import io.folioledger.core.protocol.Transaction;
import io.folioledger.core.storage.ChainIntegrityException;
import io.folioledger.core.storage.ChainLinkageException;
import io.folioledger.core.storage.SequenceException;

import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Archival miner side of the sync protocol: keeps one connection to the authority, replicates its
 * chain, acknowledges pushed blocks and forwards locally submitted transactions.
 */
public final class MinerSyncEngine extends BaseSyncEngine implements TransactionPool.PoolListener {
    private static final Logger LOG = Logger.getLogger(MinerSyncEngine.class.getName());

    private final AtomicBoolean reconnectScheduled = new AtomicBoolean();
    private volatile PeerConnector connector;
    private volatile PeerConnection authority;
    private volatile HandshakeRejectedException lastRejection;

    public MinerSyncEngine(NodeContext ctx) {
        super(ctx);
        pool.addListener(this);
    }

    @Override
    public void start(PeerConnector connector) {
        this.connector = connector;
        markRunning(true);
        connect();
    }

    /** Current authority connection, if one is open. */
    public Optional<PeerConnection> authority() {
        PeerConnection current = authority;
        return current == null || !current.isOpen() ? Optional.empty() : Optional.of(current);
    }

    public boolean isSynced() {
        return authority().map(c -> c.state() == ConnectionState.SYNCED).orElse(false);
    }

    public Optional<HandshakeRejectedException> lastRejection() {
        return Optional.ofNullable(lastRejection);
    }

    private void connect() {
        reconnectScheduled.set(false);
        if (!isRunning() || authority().isPresent()) {
            return;
        }
        NodeConfig config = ctx.config();
        LOG.fine(() -> "Dialing authority " + config.authorityHost + ':' + config.authorityPort);
        connector.connect(config.authorityHost, config.authorityPort, error -> scheduleReconnect());
    }

    private void scheduleReconnect() {
        if (!isRunning() || !reconnectScheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            timers.schedule(this::connect, ctx.config().reconnectDelayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.log(Level.FINE, "Reconnect not scheduled, engine stopping", e);
        }
    }

    @Override
    protected void onConnected(PeerConnection conn) {
        PeerConnection current = authority;
        if (current != null && current.isOpen()) {
            throw new SyncProtocolException("Already connected to the authority through " + current);
        }
        authority = conn;
        NodeConfig config = ctx.config();
        moveTo(conn, ConnectionState.HANDSHAKING);
        conn.send(SyncMessages.handshake(NodeRole.ARCHIVAL_MINER, ctx.selfIdOrEmpty(), ledger.tip(), ledger.confirmedTip(),
                config.listenHost, config.listenPort));
        conn.expect(SyncMessages.HANDSHAKE_ACK);
    }

    @Override
    protected void dispatch(PeerConnection conn, P2pMessage message) {
        switch (message.type()) {
            case SyncMessages.HANDSHAKE_ACK:
                handleHandshakeAck(conn, message);
                break;
            case SyncMessages.HANDSHAKE_REJECT:
                conn.fulfil(SyncMessages.HANDSHAKE_ACK);
                HandshakeRejectedException rejection = new HandshakeRejectedException(message.text("reason"));
                lastRejection = rejection;
                throw rejection;
            case SyncMessages.GET_BLOCKS:
                requireAdmitted(conn, message);
                serveBlocks(conn, message);
                break;
            case SyncMessages.BLOCKS:
                requireAdmitted(conn, message);
                receiveBlocks(conn, message);
                break;
            case SyncMessages.SYNC_COMPLETE:
                requireAdmitted(conn, message);
                receiveSyncComplete(conn, message);
                break;
            case SyncMessages.REWIND:
                requireAdmitted(conn, message);
                handleRewind(conn, message);
                break;
            case SyncMessages.BLOCK_PUSH:
                requireAdmitted(conn, message);
                handleBlockPush(conn, message);
                break;
            case SyncMessages.BLOCK_STATUS:
                requireAdmitted(conn, message);
                handleBlockStatus(message);
                break;
            case SyncMessages.TX_RESULT:
                handleTxResult(message);
                break;
            default:
                throw new SyncProtocolException("Unexpected " + message.type() + " from authority");
        }
    }

    private void requireAdmitted(PeerConnection conn, P2pMessage message) {
        ConnectionState state = conn.state();
        if (state != ConnectionState.CATCHING_UP && state != ConnectionState.SYNCED) {
            throw new SyncProtocolException(message.type() + " before handshake_ack");
        }
    }

    private void handleHandshakeAck(PeerConnection conn, P2pMessage message) {
        if (!conn.fulfil(SyncMessages.HANDSHAKE_ACK)) {
            throw new SyncProtocolException("Unexpected handshake_ack");
        }
        String assigned = message.text("nodeId");
        String authorityId = message.text("authorityId");
        if (assigned.isBlank()) {
            throw new SyncProtocolException("handshake_ack without node id");
        }
        if (!assigned.equals(ctx.selfIdOrEmpty())) {
            LOG.info(() -> "Registered by the authority as " + assigned);
            ctx.assignSelfId(assigned);
        }
        conn.nodeId(authorityId);
        recordAuthority(authorityId);

        long rewindTo = message.number("rewindTo", SyncMessages.NO_REWIND);
        if (rewindTo >= 0 && rewindTo < ledger.tip().sequence()) {
            LOG.info(() -> "Authority asked to rewind to " + rewindTo);
            rollBackTo(rewindTo);
        }

        long authorityTip = SyncMessages.requireNumber(message, "tip");
        long authorityConfirmed = message.number("confirmedTip", 0L);
        conn.peerTip(authorityTip);
        long tip = ledger.tip().sequence();
        if (tip <= authorityTip) {
            ledger.confirmThrough(Math.min(authorityConfirmed, tip));
        }
        moveTo(conn, ConnectionState.CATCHING_UP);
        if (tip < authorityTip) {
            requestBlocks(conn);
        } else if (tip == authorityTip) {
            completeCatchUp(conn);
        } else {
            LOG.info(() -> "Local tip " + tip + " is ahead of the authority (" + authorityTip + "); serving catch-up");
        }
        ctx.checkpoint();
    }

    private void recordAuthority(String authorityId) {
        if (authorityId.isBlank()) {
            return;
        }
        NodeConfig config = ctx.config();
        try {
            directory.register(NodeRecord.candidate(authorityId, NodeRole.AUTHORITY, config.authorityHost, config.authorityPort));
        } catch (DuplicateNodeException e) {
            LOG.log(Level.WARNING, "Authority record not updated", e);
        }
    }

    private void handleRewind(PeerConnection conn, P2pMessage message) {
        long to = SyncMessages.requireNumber(message, "to");
        LOG.info(() -> "Rewinding to " + to + " on request of the authority");
        rollBackTo(to);
        if (conn.state() == ConnectionState.SYNCED) {
            moveTo(conn, ConnectionState.CATCHING_UP);
        }
        requestBlocks(conn);
    }

    private void handleBlockPush(PeerConnection conn, P2pMessage message) {
        Block block = BlockCodec.fromValue(message.value("block"));
        Optional<Block> held = ledger.find(block.sequence());
        if (held.isPresent() && held.get().contentHash().equals(block.contentHash())) {
            conn.send(SyncMessages.blockAck(block.sequence(), block.contentHash(), AckResult.OK));
            return;
        }
        try {
            ledger.append(block);
            pool.remove(block.transactionIds());
            LedgerMetrics.blocksReceived(1);
            conn.send(SyncMessages.blockAck(block.sequence(), block.contentHash(), AckResult.OK));
            LOG.fine(() -> "Appended pushed block " + block.sequence());
        } catch (SequenceException e) {
            if (e.isGap()) {
                conn.send(SyncMessages.blockAck(block.sequence(), block.contentHash(), AckResult.SEQUENCE_GAP));
                if (conn.state() == ConnectionState.SYNCED) {
                    moveTo(conn, ConnectionState.CATCHING_UP);
                }
                if (!conn.awaiting(SyncMessages.BLOCKS)) {
                    requestBlocks(conn);
                }
            } else {
                LOG.warning(() -> "Pushed block " + block.sequence() + " conflicts with the local chain");
                conn.send(SyncMessages.blockAck(block.sequence(), block.contentHash(), AckResult.CHAIN_LINKAGE));
            }
        } catch (ChainLinkageException e) {
            LOG.warning(() -> "Pushed block " + block.sequence() + " does not link: " + e.getMessage());
            conn.send(SyncMessages.blockAck(block.sequence(), block.contentHash(), AckResult.CHAIN_LINKAGE));
        } catch (ChainIntegrityException e) {
            LOG.warning(() -> "Pushed block " + block.sequence() + " failed integrity checks: " + e.getMessage());
            conn.send(SyncMessages.blockAck(block.sequence(), block.contentHash(), AckResult.CHAIN_INTEGRITY));
        }
    }

    private void handleBlockStatus(P2pMessage message) {
        long sequence = SyncMessages.requireNumber(message, "sequence");
        String hash = message.text("hash");
        BlockStatus status = BlockStatus.valueOf(message.text("status"));
        Optional<Block> held = ledger.find(sequence);
        if (held.isEmpty() || !held.get().contentHash().equals(hash)) {
            return;
        }
        if (status == BlockStatus.CONFIRMED) {
            if (ledger.confirmThrough(sequence) > 0) {
                LOG.fine(() -> "Block " + sequence + " confirmed by the authority");
                ctx.checkpoint();
            }
        } else if (status == BlockStatus.REJECTED && ledger.tip().sequence() == sequence && !held.get().isConfirmed()) {
            ledger.removeTip();
            LOG.info(() -> "Dropped block " + sequence + " rejected by the authority");
        }
    }

    private void handleTxResult(P2pMessage message) {
        String id = message.text("id");
        String result = message.text("result");
        if (TxResult.INVALID.name().equals(result) || TxResult.EVICTED.name().equals(result)) {
            pool.evict(id, "authority: " + message.text("message"));
        } else {
            LOG.fine(() -> "Transaction " + id + " " + result + " by the authority");
        }
    }

    @Override
    protected void onSynced(PeerConnection conn, long peerTip, String peerTipHash) {
        for (Transaction tx : pool.pending()) {
            conn.send(SyncMessages.txSubmit(tx));
        }
    }

    @Override
    protected void onDisconnected(PeerConnection conn) {
        if (authority == conn) {
            authority = null;
            scheduleReconnect();
        } else if (authority == null) {
            scheduleReconnect();
        }
    }

    @Override
    public void onSubmitted(Transaction tx, int poolSize) {
        PeerConnection conn = authority;
        if (conn != null && conn.state() == ConnectionState.SYNCED) {
            conn.send(SyncMessages.txSubmit(tx));
        }
    }
}
