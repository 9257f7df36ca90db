package io.fieldsync.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable audit record of one accepted entity mutation.
 * <p>
 * Fields:
 *  - eventId:    unique id of this event.
 *  - sequence:   position in the log, strictly increasing, assigned by the recorder.
 *  - snapshot:   full post-mutation snapshot (pre-delete snapshot for DELETE).
 *  - diff:       {@link SnapshotDiff.Created} for CREATE, changed fields otherwise,
 *                or null if nothing differed.
 *  - revision:   entity record revision at the time of the mutation.
 *  - timestamp:  server time in whole milliseconds, strictly increasing along {@code sequence}.
 */
public record ChangeEvent(
        String eventId,
        long sequence,
        String productionId,
        EntityType entityType,
        ChangeOperation operation,
        EntityKey entityKey,
        Map<String, Object> snapshot,
        SnapshotDiff.Diff diff,
        String userId,
        String userName,
        long revision,
        Instant timestamp
) {
    public ChangeEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(productionId, "productionId");
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(entityKey, "entityKey");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(timestamp, "timestamp");
        snapshot = snapshot == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(snapshot));
    }
}
