package io.fieldsync.storage;

import io.fieldsync.core.EntityKey;
import io.fieldsync.core.EntityRecord;
import io.fieldsync.core.EntityType;

import java.util.List;

/**
 * Durable entity table used by the sync layer.
 * <p>
 * Semantics:
 *  - Every write is durable before returning (WAL+fsync).
 *  - Writes are guarded by the whole-row {@code revision}: a write based on a stale
 *    read is refused instead of silently overwriting a concurrent commit.
 *  - Soft-deleted records stay readable through get(); listings skip them.
 */
public interface EntityStore {

    /** Current record for {@code key} (soft-deleted included), or null if none. */
    EntityRecord get(EntityKey key);

    /**
     * Store a brand-new record.
     *
     * @throws IllegalStateException if the key is already taken
     */
    void insert(EntityRecord record);

    /**
     * Replace the record iff its current revision is {@code expectedRevision}.
     * {@code next} must carry a higher revision than the one it replaces.
     *
     * @return false if the record is gone or another writer committed first
     */
    boolean compareAndSet(long expectedRevision, EntityRecord next);

    /**
     * Erase a record iff its current revision is {@code expectedRevision}.
     * Only used to undo an insert whose event could not be recorded.
     */
    boolean remove(EntityKey key, long expectedRevision);

    /** Live (not soft-deleted) records of one type in a production, oldest first. */
    List<EntityRecord> listByProduction(String productionId, EntityType type);
}
