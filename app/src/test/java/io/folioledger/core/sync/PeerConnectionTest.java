package io.folioledger.core.sync;

import io.folioledger.core.p2p.P2pMessage;
import io.folioledger.core.p2p.PeerChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PeerConnectionTest {

    private final ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor();
    private final RecordingChannel channel = new RecordingChannel();

    @AfterEach
    void tearDown() {
        timers.shutdownNow();
    }

    @Test
    void followsLifecycleOrder() {
        PeerConnection conn = new PeerConnection(channel, timers, 1_000L, (c, key) -> {});
        assertEquals(ConnectionState.CONNECTING, conn.state());
        assertTrue(conn.moveTo(ConnectionState.HANDSHAKING));
        assertFalse(conn.moveTo(ConnectionState.HANDSHAKING));
        assertThrows(IllegalStateException.class, () -> conn.moveTo(ConnectionState.SYNCED));
        assertTrue(conn.moveTo(ConnectionState.CATCHING_UP));
        assertTrue(conn.moveTo(ConnectionState.SYNCED));
        assertTrue(conn.moveTo(ConnectionState.CATCHING_UP));
        assertTrue(conn.disconnected());
        assertFalse(conn.disconnected());
        assertThrows(IllegalStateException.class, () -> conn.moveTo(ConnectionState.CONNECTING));
    }

    @Test
    void disconnectedConnectionDropsSends() {
        PeerConnection conn = new PeerConnection(channel, timers, 1_000L, (c, key) -> {});
        conn.send(new P2pMessage("a", Map.of()));
        conn.disconnected();
        conn.send(new P2pMessage("b", Map.of()));
        assertEquals(List.of("a"), channel.sent.stream().map(P2pMessage::type).toList());
        assertFalse(conn.isOpen());
    }

    @Test
    void unansweredRequestTimesOut() throws Exception {
        CountDownLatch expired = new CountDownLatch(1);
        List<String> keys = new CopyOnWriteArrayList<>();
        PeerConnection conn = new PeerConnection(channel, timers, 50L, (c, key) -> {
            keys.add(key);
            expired.countDown();
        });
        conn.expect(SyncMessages.HANDSHAKE_ACK);
        assertTrue(conn.awaiting(SyncMessages.HANDSHAKE_ACK));
        assertTrue(expired.await(2, TimeUnit.SECONDS));
        assertEquals(List.of(SyncMessages.HANDSHAKE_ACK), keys);
        assertFalse(conn.awaiting(SyncMessages.HANDSHAKE_ACK));
    }

    @Test
    void fulfilledRequestDoesNotTimeOut() throws Exception {
        CountDownLatch expired = new CountDownLatch(1);
        PeerConnection conn = new PeerConnection(channel, timers, 50L, (c, key) -> expired.countDown());
        conn.expect(SyncMessages.BLOCKS);
        assertTrue(conn.fulfil(SyncMessages.BLOCKS));
        assertFalse(conn.fulfil(SyncMessages.BLOCKS));
        assertFalse(expired.await(300, TimeUnit.MILLISECONDS));
    }

    @Test
    void disconnectCancelsDeadlines() throws Exception {
        CountDownLatch expired = new CountDownLatch(1);
        PeerConnection conn = new PeerConnection(channel, timers, 50L, (c, key) -> expired.countDown());
        conn.expect(SyncMessages.ackKey(4));
        conn.disconnected();
        assertFalse(expired.await(300, TimeUnit.MILLISECONDS));
    }

    @Test
    void ackResultRejectsUnknownValue() {
        assertEquals(AckResult.SEQUENCE_GAP, AckResult.parse("SEQUENCE_GAP"));
        assertThrows(SyncProtocolException.class, () -> AckResult.parse("MAYBE"));
    }

    private static final class RecordingChannel implements PeerChannel {
        final List<P2pMessage> sent = new CopyOnWriteArrayList<>();
        volatile boolean open = true;

        @Override
        public String remoteAddress() {
            return "test:0";
        }

        @Override
        public void send(P2pMessage message) {
            sent.add(message);
        }

        @Override
        public void close() {
            open = false;
        }

        @Override
        public boolean isOpen() {
            return open;
        }
    }
}
