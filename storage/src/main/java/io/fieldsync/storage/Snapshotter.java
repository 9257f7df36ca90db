package io.fieldsync.storage;

import io.fieldsync.core.EntityKey;
import io.fieldsync.core.EntityRecord;

import java.util.Map;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the entity table at some point in time.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay WAL records written after that snapshot.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the current table.
     *
     * @param current immutable copy of key -> record
     * @return snapshot identifier (e.g., filename).
     */
    String writeSnapshot(Map<EntityKey, EntityRecord> current);

    /** Load the latest snapshot if present, else null. */
    LoadedSnapshot loadLatest();

    /** Simple holder for snapshot id and its data */
    record LoadedSnapshot(String id, Map<EntityKey, EntityRecord> data) {}
}
