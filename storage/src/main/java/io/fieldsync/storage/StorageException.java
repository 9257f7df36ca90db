package io.fieldsync.storage;

/**
 * A durable write, read or recovery step failed (WAL append/fsync, snapshot I/O,
 * undecodable record). Always fatal to the operation that hit it.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
