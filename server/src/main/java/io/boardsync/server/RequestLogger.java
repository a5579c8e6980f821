// file: server/src/main/java/io/boardsync/server/RequestLogger.java
package io.boardsync.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/** One log line per HTTP request: method, path, status and latency. */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param repoMillis time spent in the repository, or -1 if the request never got there
     * @param error      the failure behind a 5xx, null otherwise
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long repoMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                repoMillis >= 0 ? ", repo=" + repoMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null) {
            log.log(Level.FINE, msg, error);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
