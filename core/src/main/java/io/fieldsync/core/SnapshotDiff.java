package io.fieldsync.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Field-by-field difference between two entity snapshots.
 * <p>
 * Values are compared on their JSON meaning, not their Java type: every number is
 * widened to an exact {@link BigDecimal}, so {@code 3} (Integer), {@code 3L} and
 * {@code BigInteger.valueOf(3)} are equal, and integers past 2^53 never lose precision.
 * Maps compare without regard to key order; lists compare element-wise.
 */
public final class SnapshotDiff {

    private SnapshotDiff() {
        // utility
    }

    /** Result of {@link #diff}: either the creation sentinel or a per-field change map. */
    public sealed interface Diff permits Created, Changes {}

    /** Sentinel meaning "entity created", used instead of a per-field diff. */
    public enum Created implements Diff { INSTANCE }

    /** Changed fields only, in snapshot key order. */
    public record Changes(Map<String, Change> fields) implements Diff {
        public Changes {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }
    }

    /** One changed field. Either side may be null (field added or removed). */
    public record Change(Object from, Object to) {}

    /**
     * @return {@link Created#INSTANCE} if {@code before} is null, null if nothing
     *         differs, otherwise the changed keys over the union of both snapshots.
     */
    public static Diff diff(Map<String, Object> before, Map<String, Object> after) {
        if (before == null) return Created.INSTANCE;

        var keys = new LinkedHashSet<String>(before.keySet());
        keys.addAll(after.keySet());

        var changes = new LinkedHashMap<String, Change>();
        for (String k : keys) {
            Object from = before.get(k);
            Object to = after.get(k);
            if (!normalize(from).equals(normalize(to))) {
                changes.put(k, new Change(from, to));
            }
        }
        return changes.isEmpty() ? null : new Changes(changes);
    }

    // ---------- wire form ----------

    private static final String CREATED_KEY = "all";
    private static final String CREATED_VALUE = "created";

    /** {@code {"all":"created"}}, {@code {field: {from, to}}}, or null. */
    public static Map<String, Object> toJson(Diff diff) {
        if (diff == null) return null;
        var out = new LinkedHashMap<String, Object>();
        if (diff instanceof Created) {
            out.put(CREATED_KEY, CREATED_VALUE);
            return out;
        }
        for (var e : ((Changes) diff).fields().entrySet()) {
            var change = new LinkedHashMap<String, Object>();
            change.put("from", e.getValue().from());
            change.put("to", e.getValue().to());
            out.put(e.getKey(), change);
        }
        return out;
    }

    /** Inverse of {@link #toJson}. */
    public static Diff fromJson(Map<String, Object> json) {
        if (json == null) return null;
        if (json.size() == 1 && CREATED_VALUE.equals(json.get(CREATED_KEY))) return Created.INSTANCE;

        var changes = new LinkedHashMap<String, Change>();
        for (var e : json.entrySet()) {
            if (!(e.getValue() instanceof Map<?, ?> change)) {
                throw new IllegalArgumentException("diff entry '" + e.getKey() + "' is not an object");
            }
            changes.put(e.getKey(), new Change(change.get("from"), change.get("to")));
        }
        return new Changes(changes);
    }

    // ---------- normalization ----------

    private static final Object NULL = new Object();

    static Object normalize(Object v) {
        if (v == null) return NULL;
        if (v instanceof Number n) return normalizeNumber(n);
        if (v instanceof Map<?, ?> m) {
            var out = new LinkedHashMap<Object, Object>();
            for (var e : m.entrySet()) out.put(e.getKey(), normalize(e.getValue()));
            return out;
        }
        if (v instanceof Collection<?> c) {
            List<Object> out = new ArrayList<>(c.size());
            for (Object o : c) out.add(normalize(o));
            return out;
        }
        if (v instanceof Enum<?> e) return e.name();
        return v;
    }

    private static Object normalizeNumber(Number n) {
        BigDecimal d;
        if (n instanceof BigDecimal bd) {
            d = bd;
        } else if (n instanceof BigInteger bi) {
            d = new BigDecimal(bi);
        } else if (n instanceof Double || n instanceof Float) {
            double x = n.doubleValue();
            if (Double.isNaN(x) || Double.isInfinite(x)) return x;
            d = new BigDecimal(Double.toString(x));
        } else {
            d = BigDecimal.valueOf(n.longValue());
        }
        return d.signum() == 0 ? BigDecimal.ZERO : d.stripTrailingZeros();
    }
}
