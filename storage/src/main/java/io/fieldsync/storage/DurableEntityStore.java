package io.fieldsync.storage;

import io.fieldsync.core.EntityKey;
import io.fieldsync.core.EntityRecord;
import io.fieldsync.core.EntityType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable entity table.
 * <p>
 * Responsibilities:
 *  - Maintain an in-memory map: key -> EntityRecord.
 *  - On write (insert / compareAndSet / remove), under the store lock:
 *      1) Check the precondition (key free, or current revision as expected).
 *      2) Append+fsync the full new state to the WAL.
 *      3) Apply it to memory.
 *      4) Rotate WAL segment if needed.
 *      5) Possibly write a snapshot and compact the WAL, per SnapshotPolicy.
 *      Steps 4 and 5 run after the write is committed; their failures are logged,
 *      never reported as a failed write.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay WAL records in order. Each record is a full state (or an erase),
 *         so replaying records already covered by the snapshot is harmless.
 * <p>
 * Reads are lock-free against the concurrent map.
 */
public class DurableEntityStore implements EntityStore {
    private static final Logger log = Logger.getLogger(DurableEntityStore.class.getName());

    public static final int DEFAULT_SNAPSHOT_EVERY = 10_000;

    private final Map<EntityKey, EntityRecord> mem = new ConcurrentHashMap<>();
    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;

    public DurableEntityStore(Wal wal, Snapshotter snaps) {
        this(wal, snaps, new SnapshotPolicy(DEFAULT_SNAPSHOT_EVERY));
    }

    public DurableEntityStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        recover();
    }

    @Override
    public EntityRecord get(EntityKey key) {
        return mem.get(key);
    }

    @Override
    public synchronized void insert(EntityRecord record) {
        if (mem.containsKey(record.key())) {
            throw new IllegalStateException("entity " + record.key() + " already exists");
        }
        persist(new RecordCodec.EntityPut(record));
        mem.put(record.key(), record);
        afterWrite();
    }

    @Override
    public synchronized boolean compareAndSet(long expectedRevision, EntityRecord next) {
        EntityRecord current = mem.get(next.key());
        if (current == null || current.revision() != expectedRevision) return false;
        if (next.revision() <= expectedRevision) {
            throw new IllegalArgumentException("revision must advance past " + expectedRevision);
        }
        persist(new RecordCodec.EntityPut(next));
        mem.put(next.key(), next);
        afterWrite();
        return true;
    }

    @Override
    public synchronized boolean remove(EntityKey key, long expectedRevision) {
        EntityRecord current = mem.get(key);
        if (current == null || current.revision() != expectedRevision) return false;
        persist(new RecordCodec.EntityRemoved(key));
        mem.remove(key);
        afterWrite();
        return true;
    }

    @Override
    public List<EntityRecord> listByProduction(String productionId, EntityType type) {
        var out = new ArrayList<EntityRecord>();
        for (EntityRecord r : mem.values()) {
            if (!r.deleted() && r.type() == type && r.productionId().equals(productionId)) out.add(r);
        }
        out.sort(Comparator.comparing(EntityRecord::createdAt).thenComparing(r -> r.key().value()));
        return out;
    }

    /** Number of records held, soft-deleted included. */
    public int size() {
        return mem.size();
    }

    private void persist(RecordCodec.LogRecord rec) {
        wal.append(RecordCodec.encode(rec));
    }

    private void afterWrite() {
        try {
            wal.rotateIfNeeded();
            if (snapPolicy.maybeSnapshot(mem, snaps)) {
                wal.compact();
            }
        } catch (StorageException e) {
            // The WAL still holds every write, so recovery stays complete.
            log.log(Level.WARNING, "entity store housekeeping failed after a committed write", e);
        }
    }

    private void recover() {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null && loaded.data() != null) {
            mem.putAll(loaded.data());
        }

        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.LogRecord rec = RecordCodec.decode(payload);
                if (rec instanceof RecordCodec.EntityPut put) {
                    mem.put(put.entity().key(), put.entity());
                } else if (rec instanceof RecordCodec.EntityRemoved removed) {
                    mem.remove(removed.key());
                } else {
                    throw new StorageException("entity WAL holds a non-entity record: " + rec.getClass().getSimpleName());
                }
            }
        }
    }
}
