package io.folioledger.core.directory;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class NodeDirectoryTest {

    private final AtomicLong clock = new AtomicLong(1_000L);
    private final NodeDirectory directory = new NodeDirectory(clock::get);

    @Test
    void blankIdGetsFreshId() {
        String id = directory.register(NodeRecord.candidate("", NodeRole.ARCHIVAL_MINER, "127.0.0.1", 7101));
        assertTrue(id.startsWith(NodeDirectory.NODE_ID_PREFIX));
        assertEquals(34, id.length());
        NodeRecord stored = directory.get(id).orElseThrow();
        assertEquals(NodeState.CONNECTING, stored.state());
        assertEquals(1_000L, stored.registeredAt());
    }

    @Test
    void activeIdCannotRegisterTwice() {
        String id = directory.register(NodeRecord.candidate("", NodeRole.ARCHIVAL_MINER, "h", 1));
        assertThrows(DuplicateNodeException.class,
                () -> directory.register(NodeRecord.candidate(id, NodeRole.ARCHIVAL_MINER, "h", 1)));
    }

    @Test
    void disconnectedIdReRegistersKeepingRegistrationTime() {
        String id = directory.register(NodeRecord.candidate("", NodeRole.ARCHIVAL_MINER, "h", 1));
        directory.markDisconnected(id);
        clock.set(5_000L);

        assertEquals(id, directory.register(NodeRecord.candidate(id, NodeRole.ARCHIVAL_MINER, "h2", 2)));
        NodeRecord record = directory.get(id).orElseThrow();
        assertEquals(1_000L, record.registeredAt());
        assertEquals(5_000L, record.lastSeen());
        assertEquals("h2:2", record.address());
    }

    @Test
    void onlyOneAuthority() {
        directory.register(new NodeRecord("fl-auth", NodeRole.AUTHORITY, "h", 7000, 0L, 0L, NodeState.SYNCED));
        assertThrows(DuplicateNodeException.class,
                () -> directory.register(new NodeRecord("fl-other", NodeRole.AUTHORITY, "h", 7001, 0L, 0L, NodeState.SYNCED)));
    }

    @Test
    void minerQueriesFollowStates() {
        directory.register(new NodeRecord("fl-auth", NodeRole.AUTHORITY, "h", 7000, 0L, 0L, NodeState.SYNCED));
        String a = directory.register(NodeRecord.candidate("", NodeRole.ARCHIVAL_MINER, "h", 1));
        String b = directory.register(NodeRecord.candidate("", NodeRole.ARCHIVAL_MINER, "h", 2));
        directory.transition(a, NodeState.SYNCED);
        directory.markDisconnected(b);

        assertEquals(2, directory.registeredMiners().size());
        assertEquals(List.of(a), directory.syncedMiners().stream().map(NodeRecord::nodeId).toList());
        assertEquals(List.of(a), directory.activeMiners().stream().map(NodeRecord::nodeId).toList());

        directory.markSeen(b);
        assertEquals(NodeState.CONNECTING, directory.get(b).orElseThrow().state());
    }

    @Test
    void restoredRecordsStartDisconnected() {
        NodeRecord synced = new NodeRecord("fl-m", NodeRole.ARCHIVAL_MINER, "h", 1, 1L, 2L, NodeState.SYNCED);
        directory.restore(List.of(synced));
        assertEquals(NodeState.DISCONNECTED, directory.get("fl-m").orElseThrow().state());
        assertTrue(directory.activeMiners().isEmpty());
        assertEquals(1, directory.registeredMiners().size());
    }

    @Test
    void transitionOfUnknownNodeFails() {
        assertThrows(IllegalArgumentException.class, () -> directory.transition("fl-none", NodeState.SYNCED));
    }

    @Test
    void roleAliasesParse() {
        assertEquals(NodeRole.AUTHORITY, NodeRole.parse("MASTER_NODE"));
        assertEquals(NodeRole.ARCHIVAL_MINER, NodeRole.parse("archival-miner-node"));
        assertThrows(IllegalArgumentException.class, () -> NodeRole.parse("observer"));
    }
}
