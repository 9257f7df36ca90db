package io.fieldsync.storage;

import io.fieldsync.core.ChangeEvent;
import io.fieldsync.core.ChangeOperation;
import io.fieldsync.core.EntityKey;
import io.fieldsync.core.EntityType;
import io.fieldsync.core.SnapshotDiff;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Event log whose WAL is the store itself.
 * <p>
 * Responsibilities:
 *  - On record():
 *      1) Assign the next sequence number and a strictly increasing millisecond timestamp.
 *      2) Append+fsync the event to the WAL.
 *      3) Only then index it in memory, so a failed append leaves no trace.
 *      4) Rotate WAL segment if needed. The event is committed by then, so a
 *         rotation failure is logged and the event still returned.
 * <p>
 *  - On startup: replay every WAL record; events at or below the highest
 *    sequence already seen are skipped, so replay is idempotent.
 * <p>
 * Events are never compacted away: the WAL is the audit trail.
 */
public final class DurableEventLog implements EventLog {
    private static final Logger log = Logger.getLogger(DurableEventLog.class.getName());

    private final Wal wal;
    private final Clock clock;

    // Per production, in record order (ascending sequence and timestamp).
    private final Map<String, List<ChangeEvent>> byProduction = new HashMap<>();
    private long lastSequence = 0;
    private Instant lastTimestamp = Instant.EPOCH;

    public DurableEventLog(Wal wal) {
        this(wal, Clock.systemUTC());
    }

    public DurableEventLog(Wal wal, Clock clock) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.clock = Objects.requireNonNull(clock, "clock");
        recover();
    }

    @Override
    public synchronized ChangeEvent record(String productionId,
                                           EntityType entityType,
                                           ChangeOperation operation,
                                           EntityKey entityKey,
                                           Map<String, Object> snapshot,
                                           SnapshotDiff.Diff diff,
                                           String userId,
                                           String userName,
                                           long revision) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        if (!now.isAfter(lastTimestamp)) {
            // listSince() is exclusive, so two events may never share a timestamp.
            now = lastTimestamp.plusMillis(1);
        }
        var event = new ChangeEvent(UUID.randomUUID().toString(), lastSequence + 1, productionId,
                entityType, operation, entityKey, snapshot, diff, userId, userName, revision, now);

        wal.append(RecordCodec.encode(new RecordCodec.EventAppended(event)));
        apply(event);
        try {
            wal.rotateIfNeeded();
        } catch (StorageException e) {
            log.log(Level.WARNING, "event WAL rotation failed after event " + event.sequence() + " was committed", e);
        }
        return event;
    }

    @Override
    public synchronized List<ChangeEvent> listByProduction(String productionId, int limit) {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        List<ChangeEvent> all = byProduction.getOrDefault(productionId, List.of());
        var out = new ArrayList<ChangeEvent>(Math.min(limit, all.size()));
        for (int i = all.size() - 1; i >= 0 && out.size() < limit; i--) {
            out.add(all.get(i));
        }
        return out;
    }

    @Override
    public synchronized List<ChangeEvent> listByEntity(String productionId, EntityKey entityKey) {
        List<ChangeEvent> all = byProduction.getOrDefault(productionId, List.of());
        var out = new ArrayList<ChangeEvent>();
        for (int i = all.size() - 1; i >= 0; i--) {
            if (all.get(i).entityKey().equals(entityKey)) out.add(all.get(i));
        }
        return out;
    }

    @Override
    public synchronized List<ChangeEvent> listSince(String productionId, Instant since) {
        Objects.requireNonNull(since, "since");
        List<ChangeEvent> all = byProduction.getOrDefault(productionId, List.of());
        // Timestamps ascend, so find the first one after 'since' and take the rest.
        int lo = 0, hi = all.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (all.get(mid).timestamp().isAfter(since)) hi = mid; else lo = mid + 1;
        }
        return List.copyOf(all.subList(lo, all.size()));
    }

    private void recover() {
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.LogRecord rec = RecordCodec.decode(payload);
                if (!(rec instanceof RecordCodec.EventAppended appended)) {
                    throw new StorageException("event WAL holds a non-event record: " + rec.getClass().getSimpleName());
                }
                if (appended.event().sequence() > lastSequence) {
                    apply(appended.event());
                }
            }
        }
    }

    private void apply(ChangeEvent event) {
        byProduction.computeIfAbsent(event.productionId(), k -> new ArrayList<>()).add(event);
        lastSequence = event.sequence();
        if (event.timestamp().isAfter(lastTimestamp)) lastTimestamp = event.timestamp();
    }
}
