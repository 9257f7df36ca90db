package io.fieldsync.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One log line per HTTP request.
 *
 * Levels:
 *  - 5xx: SEVERE, with the stack trace when there is one.
 *  - slower than {@link #SLOW_MILLIS}: WARNING.
 *  - everything else: INFO; rejected requests (4xx) carry the rejection reason.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    static final long SLOW_MILLIS = 1_000L;

    private RequestLogger() {
        // utility
    }

    /**
     * @param totalMillis   wall-clock latency for the whole request
     * @param serviceMillis time spent inside SyncService, or -1 if it was never called
     * @param error         exception the request failed with, or null
     */
    public static void logRequest(String method,
                                  String path,
                                  int status,
                                  long totalMillis,
                                  long serviceMillis,
                                  Throwable error) {
        var line = new StringBuilder()
                .append(method).append(' ').append(path)
                .append(" -> ").append(status)
                .append(" in ").append(totalMillis).append("ms");
        if (serviceMillis >= 0) {
            line.append(" (sync ").append(serviceMillis).append("ms)");
        }

        if (status >= 500) {
            log.log(Level.SEVERE, line.toString(), error);
            return;
        }
        if (error != null) {
            line.append(": ").append(error.getMessage());
        }
        log.log(totalMillis >= SLOW_MILLIS ? Level.WARNING : Level.INFO, line.toString());
    }
}
