package io.fieldsync.server;

/**
 * Whole-record version check failed: an update without field versions named a
 * record revision that is no longer current.
 */
public class StaleRevisionException extends RuntimeException {
    private final long currentRevision;
    private final long clientRevision;

    public StaleRevisionException(long currentRevision, long clientRevision) {
        super("record was modified by another user (revision " + currentRevision + ", client had " + clientRevision + ")");
        this.currentRevision = currentRevision;
        this.clientRevision = clientRevision;
    }

    public long currentRevision() { return currentRevision; }

    public long clientRevision() { return clientRevision; }
}
