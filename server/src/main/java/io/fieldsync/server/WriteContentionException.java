package io.fieldsync.server;

import io.fieldsync.core.EntityKey;

/**
 * Every compare-and-swap attempt on one entity lost to a concurrent writer.
 * The caller may re-read and resubmit.
 */
public class WriteContentionException extends RuntimeException {
    public WriteContentionException(EntityKey key, int attempts) {
        super("entity " + key + " kept changing underneath the write (" + attempts + " attempts)");
    }
}
