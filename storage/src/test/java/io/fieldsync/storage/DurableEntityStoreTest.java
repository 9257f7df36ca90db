package io.fieldsync.storage;

import io.fieldsync.core.EntityKey;
import io.fieldsync.core.EntityRecord;
import io.fieldsync.core.EntityType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DurableEntityStoreTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private DurableEntityStore open(int snapshotEvery) {
        return new DurableEntityStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir),
                new SnapshotPolicy(snapshotEvery));
    }

    private static EntityRecord renamed(EntityRecord r, String label) {
        var data = r.data();
        data.put(EntityRecord.LABEL_FIELD, label);
        return r.withData(data, r.fieldVersions(), "bob", Fixtures.T0.plusSeconds(1));
    }

    @Test
    void stale_revision_is_refused() {
        var store = open(1000);
        var r1 = Fixtures.camera("k1", "CAM 1", Map.of());
        store.insert(r1);

        var fromA = renamed(r1, "CAM A");
        var fromB = renamed(r1, "CAM B");

        assertTrue(store.compareAndSet(1, fromA));
        assertFalse(store.compareAndSet(1, fromB), "B read revision 1, A already committed 2");
        assertEquals("CAM A", store.get(r1.key()).label());
        assertEquals(2, store.get(r1.key()).revision());
    }

    @Test
    void duplicate_insert_is_rejected() {
        var store = open(1000);
        store.insert(Fixtures.camera("k1", "CAM 1", Map.of()));
        assertThrows(IllegalStateException.class, () -> store.insert(Fixtures.camera("k1", "CAM X", Map.of())));
    }

    @Test
    void revision_must_advance() {
        var store = open(1000);
        var r1 = Fixtures.camera("k1", "CAM 1", Map.of());
        store.insert(r1);
        assertThrows(IllegalArgumentException.class, () -> store.compareAndSet(1, r1));
    }

    @Test
    void remove_is_guarded_by_revision_too() {
        var store = open(1000);
        var r1 = Fixtures.camera("k1", "CAM 1", Map.of());
        store.insert(r1);

        assertFalse(store.remove(r1.key(), 7));
        assertTrue(store.remove(r1.key(), 1));
        assertNull(store.get(r1.key()));
        assertFalse(store.compareAndSet(1, renamed(r1, "CAM 2")));
    }

    @Test
    void listing_skips_soft_deleted_and_other_scopes() {
        var store = open(1000);
        var a = Fixtures.camera("a", "CAM 1", Map.of());
        var b = Fixtures.camera("b", "CAM 2", Map.of());
        store.insert(a);
        store.insert(b);
        store.insert(new EntityRecord(new EntityKey("c"), EntityType.CAMERA, "p2", "CAM 3", Map.of(),
                a.fieldVersions(), 1, Fixtures.T0, Fixtures.T0, "u", false));
        store.insert(new EntityRecord(new EntityKey("d"), EntityType.CCU, "p1", "CCU 1", Map.of(),
                a.fieldVersions(), 1, Fixtures.T0, Fixtures.T0, "u", false));
        store.compareAndSet(1, b.asDeleted("bob", Fixtures.T0.plusSeconds(5)));

        assertEquals(List.of(a), store.listByProduction("p1", EntityType.CAMERA));
        assertTrue(store.get(b.key()).deleted(), "soft-deleted records stay readable");
    }

    @Test
    void latest_state_survives_restart() {
        var store1 = open(1000);
        var r1 = Fixtures.camera("k1", "CAM 1", Map.of("note", "first"));
        store1.insert(r1);
        store1.compareAndSet(1, renamed(r1, "CAM 2"));
        store1.insert(Fixtures.camera("k2", "CAM 9", Map.of()));
        store1.remove(new EntityKey("k2"), 1);

        var store2 = open(1000);

        assertEquals("CAM 2", store2.get(r1.key()).label());
        assertEquals(2, store2.get(r1.key()).revision());
        assertEquals("first", store2.get(r1.key()).attributes().get("note"));
        assertNull(store2.get(new EntityKey("k2")));
    }

    @Test
    void snapshot_compacts_the_wal_and_recovery_combines_both() throws Exception {
        var store1 = open(3);
        EntityRecord current = Fixtures.camera("k1", "v0", Map.of());
        store1.insert(current);
        for (int i = 1; i <= 4; i++) {
            EntityRecord next = renamed(current, "v" + i);
            assertTrue(store1.compareAndSet(current.revision(), next));
            current = next;
        }
        // 5 writes with a snapshot every 3: one snapshot, 2 writes in the fresh WAL segment.
        try (var files = Files.list(snapDir)) {
            assertEquals(1, files.count());
        }

        var store2 = open(3);
        assertEquals("v4", store2.get(current.key()).label());
        assertEquals(5, store2.get(current.key()).revision());
        assertEquals(1, store2.size());
    }

    @Test
    void failed_snapshot_does_not_fail_committed_writes() {
        var store1 = new DurableEntityStore(new FileWal(walDir, 1L << 60), new FailingSnapshotter(),
                new SnapshotPolicy(2));
        EntityRecord r1 = Fixtures.camera("k1", "CAM 1", Map.of());
        store1.insert(r1);
        EntityRecord r2 = renamed(r1, "CAM 2");
        assertTrue(store1.compareAndSet(1, r2), "second write trips the snapshot");
        assertTrue(store1.compareAndSet(2, renamed(r2, "CAM 3")), "snapshot retried and failed again");
        assertEquals("CAM 3", store1.get(r1.key()).label());

        var store2 = open(1000);
        assertEquals("CAM 3", store2.get(r1.key()).label());
        assertEquals(3, store2.get(r1.key()).revision());
    }

    /** Snapshotter that never manages to write, as on a full disk. */
    private static final class FailingSnapshotter implements Snapshotter {
        @Override
        public String writeSnapshot(Map<EntityKey, EntityRecord> state) {
            throw new StorageException("disk full");
        }

        @Override
        public LoadedSnapshot loadLatest() {
            return null;
        }
    }
}
