package io.fieldsync.storage;

import io.fieldsync.core.EntityKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTornTailTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private static byte[] put(String key, String label) {
        return RecordCodec.encode(new RecordCodec.EntityPut(Fixtures.camera(key, label, Map.of("name", label))));
    }

    @Test
    void replay_ignores_truncated_tail_and_applies_all_prior_records() {
        var wal = new FileWal(walDir, 1L << 60); // huge rotate threshold so single segment
        wal.append(put("k1", "CAM 1"));
        wal.append(put("k2", "CAM 2"));
        wal.close();

        // Third record only half-written, as if the process died mid-append.
        byte[] r3 = put("k3", "CAM 3");
        Path seg = walDir.resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(r3, 0, r3.length - 5);
        } catch (Exception e) {
            fail(e);
        }

        var store = new DurableEntityStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir));

        assertEquals("CAM 1", store.get(new EntityKey("k1")).label());
        assertEquals("CAM 2", store.get(new EntityKey("k2")).label());
        assertNull(store.get(new EntityKey("k3")));
    }

    @Test
    void appends_after_a_torn_tail_are_readable() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(put("k1", "CAM 1"));
        wal.close();
        Path seg = walDir.resolve("00000001.log");
        long clean = Files.size(seg);
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(new byte[] {0x7E, (byte) 0xD1, 1, 9}); // header fragment
        }

        var reopened = new FileWal(walDir, 1L << 60);
        assertEquals(clean, Files.size(seg), "torn bytes are cut on open");
        reopened.append(put("k2", "CAM 2"));
        reopened.close();

        var store = new DurableEntityStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir));
        assertNotNull(store.get(new EntityKey("k1")));
        assertNotNull(store.get(new EntityKey("k2")));
    }

    @Test
    void reader_walks_every_segment_in_order() {
        var wal = new FileWal(walDir, 1); // rotate after every record
        for (int i = 1; i <= 3; i++) {
            wal.append(put("k" + i, "CAM " + i));
            wal.rotateIfNeeded();
        }
        assertEquals("00000004.log", wal.currentSegment().getFileName().toString());

        int count = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                var rec = (RecordCodec.EntityPut) RecordCodec.decode(payload);
                count++;
                assertEquals("k" + count, rec.entity().key().value());
            }
        }
        assertEquals(3, count);
        wal.close();
    }

    @Test
    void compact_keeps_only_a_fresh_segment() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(put("k1", "CAM 1"));
        wal.compact();

        try (var files = Files.list(walDir)) {
            assertEquals(1, files.count());
        }
        try (Wal.WalReader r = wal.openReader()) {
            assertNull(r.next());
        }
        wal.close();
    }
}
