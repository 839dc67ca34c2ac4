package Server.http.accesslog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one line per request to the {@code http.access} logger.
 */
public final class Slf4jAccessLogSink implements AccessLogSink {

    public static final String LOGGER_NAME = "http.access";

    private final Logger logger;

    public Slf4jAccessLogSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    public Slf4jAccessLogSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void write(AccessLogRecord record) {
        logger.info(record.toLogLine());
    }
}
