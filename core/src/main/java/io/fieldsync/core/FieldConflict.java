package io.fieldsync.core;

/**
 * One versioned field whose client-side version is older than the server's.
 * Transient: handed back once to the caller that proposed the write, never stored.
 *
 * @param field         versioned field name
 * @param clientVersion version the client last saw (0 if it sent none)
 * @param serverVersion current server version
 * @param clientValue   value the client tried to write
 * @param serverValue   value currently stored (kept by the merge)
 */
public record FieldConflict(
        String field,
        int clientVersion,
        int serverVersion,
        Object clientValue,
        Object serverValue
) {}
