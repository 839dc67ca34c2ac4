package Server.http.filters;

import Server.http.ContextualHandler;
import Server.http.RequestContext;
import Server.http.Stage;
import Server.http.accesslog.AccessLogRecord;
import Server.http.accesslog.AccessLogSink;
import com.sun.net.httpserver.HttpExchange;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stage that writes exactly one access log record per request, after the next
 * stage has returned or thrown. Must sit inside {@link CorrelationIdFilter}.
 *
 * Sink failures never reach the client; they are only counted.
 */
public class AccessLogFilter implements Stage {

    private final AccessLogSink sink;
    private final AtomicLong droppedRecords = new AtomicLong();

    public AccessLogFilter(AccessLogSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public ContextualHandler wrap(ContextualHandler next) {
        return (exchange, context) -> {
            try {
                next.handle(exchange, context);
            } finally {
                emit(exchange, context);
            }
        };
    }

    private void emit(HttpExchange exchange, RequestContext context) {
        try {
            sink.write(AccessLogRecord.of(exchange, context));
        } catch (RuntimeException e) {
            droppedRecords.incrementAndGet();
        }
    }

    /**
     * Number of records the sink failed to accept since this stage was created.
     */
    public long droppedRecords() {
        return droppedRecords.get();
    }

    @Override
    public String description() {
        return "Writes one access log line per request";
    }
}
