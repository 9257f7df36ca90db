package io.fieldsync.storage;

import io.fieldsync.core.ChangeEvent;
import io.fieldsync.core.ChangeOperation;
import io.fieldsync.core.EntityKey;
import io.fieldsync.core.EntityType;
import io.fieldsync.core.SnapshotDiff;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Append-only audit log of accepted entity mutations.
 * <p>
 * Semantics:
 *  - record() is durable before returning and never fails silently: a failed
 *    append raises {@link StorageException} and leaves the log unchanged.
 *  - Events are never updated or deleted.
 *  - Timestamps are assigned by the log and strictly increase in record order.
 */
public interface EventLog {

    /**
     * Append one event stamped with the server time and return it.
     *
     * @param snapshot full post-mutation snapshot (pre-delete snapshot for DELETE)
     * @param diff     {@link SnapshotDiff.Created} for CREATE, per-field changes, or null
     */
    ChangeEvent record(String productionId,
                       EntityType entityType,
                       ChangeOperation operation,
                       EntityKey entityKey,
                       Map<String, Object> snapshot,
                       SnapshotDiff.Diff diff,
                       String userId,
                       String userName,
                       long revision);

    /** Most recent {@code limit} events of a production, newest first. */
    List<ChangeEvent> listByProduction(String productionId, int limit);

    /** Every event of one entity, newest first. */
    List<ChangeEvent> listByEntity(String productionId, EntityKey entityKey);

    /** Events recorded strictly after {@code since}, oldest first. */
    List<ChangeEvent> listSince(String productionId, Instant since);
}
