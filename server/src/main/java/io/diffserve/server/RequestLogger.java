// file: server/src/main/java/io/diffserve/server/RequestLogger.java
package io.diffserve.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging hook.
 *
 * One line per completed HTTP request with method, path, status and latency.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method        HTTP method
     * @param path          request path
     * @param status        HTTP status code
     * @param totalMillis   wall-clock latency for the whole request
     * @param serviceMillis latency of the sync service call, or -1 if not reached
     * @param error         optional exception (logged with 5xx), null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long serviceMillis,
            Throwable error
    ) {
        String msg = format(method, path, status, totalMillis, serviceMillis);

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }

    static String format(String method, String path, int status, long totalMillis, long serviceMillis) {
        return String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                serviceMillis >= 0 ? ", storage=" + serviceMillis + "ms" : ""
        );
    }
}
