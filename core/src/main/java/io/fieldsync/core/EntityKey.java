package io.fieldsync.core;

import java.util.UUID;

/**
 * Internal key of an entity: generated once at creation, never reassigned and never
 * edited by users. The only reference used between entities and for conflict bookkeeping.
 */
public record EntityKey(String value) {
    public EntityKey {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("entity key must not be empty");
        }
    }

    public static EntityKey generate() {
        return new EntityKey(UUID.randomUUID().toString());
    }

    @Override public String toString() { return value; }
}
