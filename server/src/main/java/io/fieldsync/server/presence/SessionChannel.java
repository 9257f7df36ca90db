package io.fieldsync.server.presence;

import java.io.IOException;

/**
 * One live client connection, as seen by the hub.
 * The transport layer owns the real socket.
 */
public interface SessionChannel {

    /** Stable id of this connection; also what clients send back as X-Session-Id. */
    String id();

    /**
     * Queue one text frame. Implementations may deliver asynchronously and report
     * late failures themselves.
     *
     * @throws IOException if the frame cannot be queued (e.g. the connection is closed)
     */
    void send(String text) throws IOException;
}
