package Server.http.accesslog;

/**
 * Destination for access log records. Implementations may throw; the access
 * log stage treats every write as best-effort.
 */
@FunctionalInterface
public interface AccessLogSink {

    void write(AccessLogRecord record);
}
