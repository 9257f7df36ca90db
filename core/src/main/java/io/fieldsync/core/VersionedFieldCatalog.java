package io.fieldsync.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Versioned-field set per entity type. Configuration data: the defaults come
 * from {@link EntityType}, deployments may override individual types.
 * <p>
 * Invariant: no set contains a reserved record field ({@link EntityRecord#RESERVED_FIELDS}),
 * in particular neither the internal key nor the display label.
 */
public final class VersionedFieldCatalog {
    private final Map<EntityType, Set<String>> fields;

    private VersionedFieldCatalog(Map<EntityType, Set<String>> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static VersionedFieldCatalog defaults() {
        return of(Map.of());
    }

    /**
     * Defaults, with the given types replaced by the supplied field lists.
     *
     * @throws IllegalArgumentException if an override names a reserved field or is empty
     */
    public static VersionedFieldCatalog of(Map<EntityType, ? extends Iterable<String>> overrides) {
        var m = new EnumMap<EntityType, Set<String>>(EntityType.class);
        for (EntityType t : EntityType.values()) {
            Iterable<String> source = overrides.containsKey(t) ? overrides.get(t) : t.defaultVersionedFields();
            m.put(t, validated(t, source));
        }
        return new VersionedFieldCatalog(m);
    }

    /** Insertion-ordered, read-only set of versioned fields for {@code type}. */
    public Set<String> versionedFields(EntityType type) {
        return fields.get(Objects.requireNonNull(type, "type"));
    }

    private static Set<String> validated(EntityType type, Iterable<String> names) {
        var set = new LinkedHashSet<String>();
        for (String n : names) {
            if (n == null || n.isBlank()) {
                throw new IllegalArgumentException(type.wireName() + ": blank versioned field name");
            }
            if (EntityRecord.RESERVED_FIELDS.contains(n)) {
                throw new IllegalArgumentException(type.wireName() + ": '" + n + "' is reserved and cannot be versioned");
            }
            set.add(n);
        }
        if (set.isEmpty()) {
            throw new IllegalArgumentException(type.wireName() + ": versioned field set must not be empty");
        }
        return Collections.unmodifiableSet(set);
    }
}
