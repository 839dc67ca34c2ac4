package Server.http.accesslog;

import Server.http.HttpUtils;
import Server.http.RequestContext;
import com.sun.net.httpserver.HttpExchange;

/**
 * One completed request as written to the access log.
 */
public record AccessLogRecord(
        String correlationId,
        String method,
        String path,
        String remoteAddress,
        String userAgent
) {

    /** Written when no correlation id reached the access log stage. */
    public static final String UNKNOWN_CORRELATION_ID = "unknown";

    static final String MISSING = "-";

    public static AccessLogRecord of(HttpExchange exchange, RequestContext context) {
        String userAgent = HttpUtils.firstHeader(exchange, "User-Agent");
        return new AccessLogRecord(
                context.correlationId().orElse(UNKNOWN_CORRELATION_ID),
                orMissing(exchange.getRequestMethod()),
                orMissing(HttpUtils.requestPath(exchange)),
                HttpUtils.remoteAddress(exchange),
                orMissing(userAgent));
    }

    public String toLogLine() {
        return String.join(" ", correlationId, method, path, remoteAddress, userAgent);
    }

    private static String orMissing(String value) {
        return value == null || value.isBlank() ? MISSING : value;
    }
}
