package io.fieldsync.server;

import io.fieldsync.core.ChangeEvent;
import io.fieldsync.core.ChangeOperation;
import io.fieldsync.core.EntityKey;
import io.fieldsync.core.EntityRecord;
import io.fieldsync.core.EntityType;
import io.fieldsync.core.FieldMerger;
import io.fieldsync.core.FieldVersions;
import io.fieldsync.core.SnapshotDiff;
import io.fieldsync.core.VersionedFieldCatalog;
import io.fieldsync.server.presence.BroadcastHub;
import io.fieldsync.storage.EntityStore;
import io.fieldsync.storage.EventLog;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Application service for entity synchronization.
 * <p>
 * Responsibilities:
 *  - Hide storage details (WAL, snapshots, revisions) from the HTTP layer.
 *  - Validate untrusted input (field versions, reserved fields) before any merge.
 *  - Run read -> merge -> compare-and-swap, retrying on a concurrent commit.
 *  - Record exactly one event per accepted mutation, undoing the entity write
 *    if the event cannot be recorded.
 *  - Broadcast only what durably committed.
 * <p>
 * Mutation order for every operation:
 *  1) entity write (guarded by revision),
 *  2) event append,
 *  3) broadcast (failures logged by the hub, never surfaced here).
 */
public class SyncService {
    private static final Logger log = Logger.getLogger(SyncService.class.getName());

    public static final String SYSTEM_USER_ID = "system";
    public static final String SYSTEM_USER_NAME = "System";

    private static final Set<String> SERVER_MANAGED = Set.of(
            "entityType", "fieldVersions", "revision", "createdAt", "updatedAt", "lastModifiedBy", "deleted");

    private final EntityStore store;
    private final EventLog events;
    private final BroadcastHub hub;
    private final VersionedFieldCatalog catalog;
    private final FieldMerger merger;
    private final Clock clock;
    private final int maxCasAttempts;

    public SyncService(EntityStore store,
                       EventLog events,
                       BroadcastHub hub,
                       VersionedFieldCatalog catalog,
                       FieldMerger merger,
                       Clock clock,
                       int maxCasAttempts) {
        if (maxCasAttempts < 1) throw new IllegalArgumentException("maxCasAttempts must be >= 1");
        this.store = Objects.requireNonNull(store, "store");
        this.events = Objects.requireNonNull(events, "events");
        this.hub = Objects.requireNonNull(hub, "hub");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.merger = Objects.requireNonNull(merger, "merger");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxCasAttempts = maxCasAttempts;
    }

    // ---------- create ----------

    /**
     * Create an entity: fresh internal key, every versioned field at version 1,
     * CREATE event with the "created" diff, {@code <type>:created} broadcast.
     *
     * @param data display label under {@code "id"} plus domain attributes
     */
    public EntityRecord create(String productionId,
                               EntityType type,
                               Map<String, Object> data,
                               String userId,
                               String userName,
                               String originSessionId) {
        requireText(productionId, "productionId");
        Objects.requireNonNull(type, "type");
        userId = orSystem(userId);
        userName = userName == null || userName.isBlank() ? defaultName(userId) : userName;

        var attributes = new LinkedHashMap<String, Object>(data == null ? Map.of() : data);
        Object label = attributes.remove(EntityRecord.LABEL_FIELD);
        for (String reserved : EntityRecord.RESERVED_FIELDS) {
            if (attributes.containsKey(reserved)) {
                throw new IllegalArgumentException("'" + reserved + "' is assigned by the server");
            }
        }

        Instant now = clock.instant();
        var created = EntityRecord.create(EntityKey.generate(), type, productionId,
                label == null ? null : label.toString(), attributes,
                FieldVersions.initialize(catalog.versionedFields(type), clock), userId, now);

        store.insert(created);
        ChangeEvent event;
        try {
            event = events.record(productionId, type, ChangeOperation.CREATE, created.key(),
                    created.snapshot(), SnapshotDiff.Created.INSTANCE, userId, userName, created.revision());
        } catch (RuntimeException e) {
            undoCreate(created, e);
            throw e;
        }

        log.info(() -> String.format("recorded CREATE %s %s by %s (event %d)",
                type.wireName(), created.key(), event.userId(), event.sequence()));
        hub.broadcastCreated(productionId, type, created.key(), created.snapshot(), originSessionId);
        return created;
    }

    // ---------- update ----------

    /**
     * Propose a field-level update.
     * <p>
     * With {@code clientFieldVersions}: fields the client last saw at an older version
     * than the server's are conflicts and keep the server value; every other submitted
     * field is applied (versioned ones bumped). The accepted subset is written even
     * when some fields conflict; if nothing is accepted nothing is written.
     * <p>
     * Without field versions: if {@code expectedRevision} is given it must match the
     * record revision, else {@link StaleRevisionException}; all fields are then applied.
     *
     * @param clientFieldVersions untrusted Field Versions blob as parsed from JSON, or null
     * @param expectedRevision    record revision the client last saw, or null
     * @throws io.fieldsync.core.MalformedFieldVersionsException if the blob is malformed
     * @throws EntityNotFoundException   if there is no live entity of that type and key
     * @throws WriteContentionException  if every compare-and-swap attempt lost
     */
    public UpdateResult proposeUpdate(EntityType type,
                                      EntityKey key,
                                      Object clientFieldVersions,
                                      Long expectedRevision,
                                      Map<String, Object> clientData,
                                      String userId,
                                      String userName,
                                      String originSessionId) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(key, "key");
        FieldVersions clientVersions = clientFieldVersions == null
                ? null
                : FieldVersions.fromUntrusted(clientFieldVersions);
        userId = orSystem(userId);
        userName = userName == null || userName.isBlank() ? defaultName(userId) : userName;
        Set<String> versioned = catalog.versionedFields(type);

        for (int attempt = 1; attempt <= maxCasAttempts; attempt++) {
            EntityRecord current = requireLive(type, key);
            Map<String, Object> submitted = editableFields(current, clientData);

            if (clientVersions == null && expectedRevision != null && expectedRevision != current.revision()) {
                throw new StaleRevisionException(current.revision(), expectedRevision);
            }
            // No field versions means the caller read the current state.
            FieldVersions premise = clientVersions == null ? current.fieldVersions() : clientVersions;

            FieldMerger.MergeResult merge = merger.merge(premise, current.fieldVersions(),
                    submitted, current.data(), versioned);
            if (merge.acceptedFields().isEmpty()) {
                return new UpdateResult(merge, current, null);
            }

            EntityRecord next = current.withData(merge.mergedData(), merge.mergedVersions(), userId, clock.instant());
            if (!store.compareAndSet(current.revision(), next)) {
                log.fine(() -> String.format("revision race on %s %s, retrying", type.wireName(), key));
                continue;
            }

            ChangeEvent event;
            try {
                event = events.record(next.productionId(), type, ChangeOperation.UPDATE, key, next.snapshot(),
                        SnapshotDiff.diff(current.data(), next.data()), userId, userName, next.revision());
            } catch (RuntimeException e) {
                undoWrite(current, next, e);
                throw e;
            }

            if (merge.hasConflicts()) {
                log.info(() -> String.format("recorded UPDATE %s %s by %s (event %d), %d field(s) conflicted",
                        type.wireName(), key, event.userId(), event.sequence(), merge.conflicts().size()));
            } else {
                log.info(() -> String.format("recorded UPDATE %s %s by %s (event %d)",
                        type.wireName(), key, event.userId(), event.sequence()));
            }
            hub.broadcastUpdated(next.productionId(), type, key, next.snapshot(), originSessionId);
            return new UpdateResult(merge, next, event);
        }
        throw new WriteContentionException(key, maxCasAttempts);
    }

    // ---------- delete ----------

    /**
     * Soft-delete: DELETE event carrying the pre-delete snapshot,
     * {@code <type>:deleted} broadcast with just the key.
     */
    public EntityRecord delete(EntityType type,
                               EntityKey key,
                               String userId,
                               String userName,
                               String originSessionId) {
        userId = orSystem(userId);
        userName = userName == null || userName.isBlank() ? defaultName(userId) : userName;

        for (int attempt = 1; attempt <= maxCasAttempts; attempt++) {
            EntityRecord current = requireLive(type, key);
            EntityRecord next = current.asDeleted(userId, clock.instant());
            if (!store.compareAndSet(current.revision(), next)) continue;

            ChangeEvent event;
            try {
                event = events.record(next.productionId(), type, ChangeOperation.DELETE, key,
                        current.snapshot(), null, userId, userName, next.revision());
            } catch (RuntimeException e) {
                undoWrite(current, next, e);
                throw e;
            }

            log.info(() -> String.format("recorded DELETE %s %s by %s (event %d)",
                    type.wireName(), key, event.userId(), event.sequence()));
            hub.broadcastDeleted(next.productionId(), type, key, originSessionId);
            return next;
        }
        throw new WriteContentionException(key, maxCasAttempts);
    }

    // ---------- reads ----------

    /** Live entity, or {@link EntityNotFoundException}. */
    public EntityRecord get(EntityType type, EntityKey key) {
        return requireLive(type, key);
    }

    public List<EntityRecord> list(String productionId, EntityType type) {
        return store.listByProduction(productionId, type);
    }

    public List<ChangeEvent> history(String productionId, int limit) {
        return events.listByProduction(productionId, limit);
    }

    public List<ChangeEvent> entityHistory(String productionId, EntityKey key) {
        return events.listByEntity(productionId, key);
    }

    public List<ChangeEvent> eventsSince(String productionId, Instant since) {
        return events.listSince(productionId, since);
    }

    public VersionedFieldCatalog catalog() {
        return catalog;
    }

    // ---------- helpers ----------

    private EntityRecord requireLive(EntityType type, EntityKey key) {
        EntityRecord current = store.get(key);
        if (current == null || current.deleted() || current.type() != type) {
            throw new EntityNotFoundException(type, key);
        }
        return current;
    }

    /**
     * Submitted data minus identity and server-managed fields. Echoing the current
     * key or production is allowed; changing either is not.
     */
    private static Map<String, Object> editableFields(EntityRecord current, Map<String, Object> clientData) {
        var out = new LinkedHashMap<String, Object>();
        if (clientData == null) return out;
        for (var e : clientData.entrySet()) {
            String field = e.getKey();
            if (EntityRecord.KEY_FIELD.equals(field)) {
                if (!current.key().value().equals(e.getValue())) {
                    throw new IllegalArgumentException("'" + field + "' is immutable");
                }
            } else if (EntityRecord.PRODUCTION_FIELD.equals(field)) {
                if (!current.productionId().equals(e.getValue())) {
                    throw new IllegalArgumentException("entities never move between productions");
                }
            } else if (!SERVER_MANAGED.contains(field)) {
                out.put(field, e.getValue());
            }
        }
        return out;
    }

    private void undoCreate(EntityRecord record, RuntimeException cause) {
        try {
            if (!store.remove(record.key(), record.revision())) {
                log.severe("could not undo create of " + record.key() + ": record changed meanwhile");
            }
        } catch (RuntimeException undo) {
            cause.addSuppressed(undo);
            log.log(Level.SEVERE, "could not undo create of " + record.key(), undo);
        }
    }

    /** Put {@code previous} back under a fresh revision so stale readers still fail their CAS. */
    private void undoWrite(EntityRecord previous, EntityRecord written, RuntimeException cause) {
        try {
            if (!store.compareAndSet(written.revision(), previous.withRevision(written.revision() + 1))) {
                log.severe("could not undo write of " + written.key() + ": record changed meanwhile");
            }
        } catch (RuntimeException undo) {
            cause.addSuppressed(undo);
            log.log(Level.SEVERE, "could not undo write of " + written.key(), undo);
        }
    }

    private static String orSystem(String userId) {
        return userId == null || userId.isBlank() ? SYSTEM_USER_ID : userId;
    }

    private static String defaultName(String userId) {
        return SYSTEM_USER_ID.equals(userId) ? SYSTEM_USER_NAME : userId;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException(name + " must not be empty");
    }
}
