package io.fieldsync.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One trackable equipment record (camera, source, checklist item, ...).
 * <p>
 * Identity:
 *  - {@code key}:   internal key, immutable, the true identity ({@value #KEY_FIELD} on the wire).
 *  - {@code label}: user-facing display label ({@value #LABEL_FIELD} on the wire), mutable,
 *                   not unique, never versioned.
 * <p>
 * {@code revision} is the whole-row optimistic-lock counter, orthogonal to field versions.
 * {@code productionId} never changes after creation.
 * {@code attributes} may hold null values and never holds a reserved field.
 */
public record EntityRecord(
        EntityKey key,
        EntityType type,
        String productionId,
        String label,
        Map<String, Object> attributes,
        FieldVersions fieldVersions,
        long revision,
        Instant createdAt,
        Instant updatedAt,
        String lastModifiedBy,
        boolean deleted
) {
    public static final String KEY_FIELD = "uuid";
    public static final String LABEL_FIELD = "id";
    public static final String PRODUCTION_FIELD = "productionId";

    /** Record-level names that can never be attributes, nor versioned fields. */
    public static final Set<String> RESERVED_FIELDS = Set.of(
            KEY_FIELD, LABEL_FIELD, PRODUCTION_FIELD, "entityType", "fieldVersions",
            "revision", "createdAt", "updatedAt", "lastModifiedBy", "deleted");

    public EntityRecord {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(type, "type");
        if (productionId == null || productionId.isBlank()) {
            throw new IllegalArgumentException("productionId must not be empty");
        }
        Objects.requireNonNull(fieldVersions, "fieldVersions");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if (revision < 1) throw new IllegalArgumentException("revision must be >= 1");
        for (String name : attributes.keySet()) {
            if (RESERVED_FIELDS.contains(name)) {
                throw new IllegalArgumentException("'" + name + "' is not an attribute");
            }
        }
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /** A fresh record at revision 1. */
    public static EntityRecord create(EntityKey key,
                                      EntityType type,
                                      String productionId,
                                      String label,
                                      Map<String, Object> attributes,
                                      FieldVersions fieldVersions,
                                      String userId,
                                      Instant now) {
        return new EntityRecord(key, type, productionId, label, attributes, fieldVersions,
                1, now, now, userId, false);
    }

    /**
     * Mutable data as the merger sees it: the display label under {@value #LABEL_FIELD}
     * followed by every attribute.
     */
    public Map<String, Object> data() {
        var m = new LinkedHashMap<String, Object>();
        m.put(LABEL_FIELD, label);
        m.putAll(attributes);
        return m;
    }

    /**
     * Next revision carrying {@code mergedData} (label under {@value #LABEL_FIELD}) and
     * {@code mergedVersions}.
     */
    public EntityRecord withData(Map<String, Object> mergedData,
                                 FieldVersions mergedVersions,
                                 String userId,
                                 Instant now) {
        var attrs = new LinkedHashMap<>(mergedData);
        Object newLabel = attrs.containsKey(LABEL_FIELD) ? attrs.remove(LABEL_FIELD) : label;
        return new EntityRecord(key, type, productionId, newLabel == null ? null : newLabel.toString(),
                attrs, mergedVersions, revision + 1, createdAt, now, userId, deleted);
    }

    /** Next revision, soft-deleted. */
    public EntityRecord asDeleted(String userId, Instant now) {
        return new EntityRecord(key, type, productionId, label, attributes, fieldVersions,
                revision + 1, createdAt, now, userId, true);
    }

    /** Same content under another revision number. */
    public EntityRecord withRevision(long newRevision) {
        return new EntityRecord(key, type, productionId, label, attributes, fieldVersions,
                newRevision, createdAt, updatedAt, lastModifiedBy, deleted);
    }

    /**
     * Full flat, JSON-shaped view used for event snapshots and broadcasts.
     */
    public Map<String, Object> snapshot() {
        var m = new LinkedHashMap<String, Object>();
        m.put(KEY_FIELD, key.value());
        m.put(LABEL_FIELD, label);
        m.put(PRODUCTION_FIELD, productionId);
        m.put("entityType", type.wireName());
        m.putAll(attributes);
        m.put("fieldVersions", fieldVersions.toJson());
        m.put("revision", revision);
        m.put("createdAt", createdAt.toString());
        m.put("updatedAt", updatedAt.toString());
        m.put("lastModifiedBy", lastModifiedBy);
        m.put("deleted", deleted);
        return m;
    }
}
