package io.fieldsync.storage;

import io.fieldsync.core.EntityKey;
import io.fieldsync.core.EntityRecord;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot policy that triggers a full snapshot after every N writes.
 * <p>
 * Bounds worst-case recovery time by limiting WAL replay length.
 * Does not consider file size or time.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /**
     * Call after each successful durable write. Snapshots when threshold is hit.
     *
     * @return true if a snapshot was written
     */
    public boolean maybeSnapshot(Map<EntityKey, EntityRecord> mem, Snapshotter snaps) {
        if (sinceLast.incrementAndGet() >= everyOps) {
            snaps.writeSnapshot(Map.copyOf(mem));
            sinceLast.set(0);
            return true;
        }
        return false;
    }
}
