package io.fieldsync.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Revision counter of a single versioned field.
 *
 * @param version   number of accepted writes to the field (1 after creation)
 * @param updatedAt server time of the last accepted write
 */
public record FieldVersion(int version, Instant updatedAt) {
    public FieldVersion {
        if (version < 0) throw new IllegalArgumentException("version must be >= 0");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }
}
