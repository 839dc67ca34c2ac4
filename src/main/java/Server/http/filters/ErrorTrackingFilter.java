package Server.http.filters;

import Server.http.ContextualHandler;
import Server.http.HttpUtils;
import Server.http.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Stage that catches unhandled runtime exceptions from route handlers and turns
 * them into a 500 response if nothing has been sent yet.
 *
 * {@link IOException}s are not caught: they mean the client connection is gone
 * and the server has to drop it.
 */
public class ErrorTrackingFilter implements Stage {

    private static final Logger log = LoggerFactory.getLogger(ErrorTrackingFilter.class);

    @Override
    public ContextualHandler wrap(ContextualHandler next) {
        return (exchange, context) -> {
            try {
                next.handle(exchange, context);
            } catch (RuntimeException e) {
                log.error("Unhandled exception in request {} {} [{}]: {}",
                        exchange.getRequestMethod(),
                        HttpUtils.requestPath(exchange),
                        context.correlationId().orElse("unknown"),
                        e.getMessage(),
                        e);

                // -1 means no status line has been written yet
                if (exchange.getResponseCode() == -1) {
                    HttpUtils.sendApiError(exchange, 500, "internal_error", "An unexpected error occurred");
                }
            }
        };
    }

    @Override
    public String description() {
        return "Converts unhandled handler exceptions into 500 responses";
    }
}
