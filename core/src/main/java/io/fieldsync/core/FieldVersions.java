package io.fieldsync.core;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable per-entity revision clock: versioned field name -> {@link FieldVersion}.
 * <p>
 * Only fields declared in an entity type's versioned-field set ever appear here;
 * {@link #initialize(Set, Clock)} creates exactly those, and the merger only bumps
 * fields it has checked against the same set.
 * <p>
 * Design mirrors a vector clock:
 *  - Immutable: every mutation returns a new instance.
 *  - Missing entries read as version 0.
 *  - Value object: equals/hashCode over contents.
 */
public final class FieldVersions {

    /** JSON property holding the counter of one entry. */
    public static final String VERSION = "version";

    /** JSON property holding the ISO-8601 time of one entry. */
    public static final String UPDATED_AT = "updatedAt";

    private static final FieldVersions EMPTY = new FieldVersions(Map.of());

    private final Map<String, FieldVersion> entries;

    public FieldVersions(Map<String, FieldVersion> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(entries, "entries")));
    }

    public static FieldVersions empty() { return EMPTY; }

    /**
     * Every declared field at version 1, stamped with the clock's current instant.
     */
    public static FieldVersions initialize(Set<String> versionedFields, Clock clock) {
        Instant now = clock.instant();
        var m = new LinkedHashMap<String, FieldVersion>();
        for (String field : versionedFields) {
            m.put(field, new FieldVersion(1, now));
        }
        return new FieldVersions(m);
    }

    public static FieldVersions initialize(Set<String> versionedFields) {
        return initialize(versionedFields, Clock.systemUTC());
    }

    /**
     * Return a copy where {@code field} is one version higher (absent counts as 0)
     * and stamped with the clock's current instant. This instance is left untouched.
     */
    public FieldVersions bump(String field, Clock clock) {
        Objects.requireNonNull(field, "field");
        var m = new LinkedHashMap<>(entries);
        m.put(field, new FieldVersion(versionOf(field) + 1, clock.instant()));
        return new FieldVersions(m);
    }

    public FieldVersions bump(String field) {
        return bump(field, Clock.systemUTC());
    }

    /** Counter for {@code field}, or 0 when the field has no entry. */
    public int versionOf(String field) {
        FieldVersion fv = entries.get(field);
        return fv == null ? 0 : fv.version();
    }

    /** Entry for {@code field}, or null. */
    public FieldVersion get(String field) { return entries.get(field); }

    public boolean contains(String field) { return entries.containsKey(field); }

    public int size() { return entries.size(); }

    /** Read-only view, insertion ordered. */
    public Map<String, FieldVersion> entries() { return entries; }

    // ---------- trust boundary ----------

    /**
     * Structural check for a Field Versions blob that came from a client or a legacy
     * record (typically the output of a JSON parser).
     * <p>
     * Rejects: null, non-map values (arrays included), entries that are not maps,
     * entries whose {@code version} is not a non-negative integer, and entries whose
     * {@code updatedAt} is not an ISO-8601 instant string.
     */
    public static boolean isWellFormed(Object value) {
        if (!(value instanceof Map<?, ?> map)) return false;
        for (var e : map.entrySet()) {
            if (!(e.getKey() instanceof String)) return false;
            if (!(e.getValue() instanceof Map<?, ?> entry)) return false;
            if (toVersion(entry.get(VERSION)) == null) return false;
            if (toInstant(entry.get(UPDATED_AT)) == null) return false;
        }
        return true;
    }

    /**
     * Parse an untrusted blob. Callers must reject the request rather than coerce it,
     * so a malformed blob raises {@link MalformedFieldVersionsException}.
     */
    public static FieldVersions fromUntrusted(Object value) {
        if (!isWellFormed(value)) {
            throw new MalformedFieldVersionsException("fieldVersions is malformed");
        }
        var m = new LinkedHashMap<String, FieldVersion>();
        for (var e : ((Map<?, ?>) value).entrySet()) {
            var entry = (Map<?, ?>) e.getValue();
            m.put((String) e.getKey(), new FieldVersion(toVersion(entry.get(VERSION)), toInstant(entry.get(UPDATED_AT))));
        }
        return new FieldVersions(m);
    }

    /** JSON-shaped view: {@code {field: {version, updatedAt}}} with ISO-8601 strings. */
    public Map<String, Object> toJson() {
        var out = new LinkedHashMap<String, Object>();
        for (var e : entries.entrySet()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put(VERSION, e.getValue().version());
            entry.put(UPDATED_AT, e.getValue().updatedAt().toString());
            out.put(e.getKey(), entry);
        }
        return out;
    }

    private static Integer toVersion(Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            long v = ((Number) raw).longValue();
            return (v < 0 || v > Integer.MAX_VALUE) ? null : (int) v;
        }
        if (raw instanceof BigInteger big) {
            return (big.signum() < 0 || big.bitLength() > 31) ? null : big.intValue();
        }
        return null;
    }

    private static Instant toInstant(Object raw) {
        if (!(raw instanceof String s)) return null;
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldVersions other)) return false;
        return entries.equals(other.entries);
    }

    @Override public int hashCode() { return entries.hashCode(); }

    @Override public String toString() { return entries.toString(); }
}
