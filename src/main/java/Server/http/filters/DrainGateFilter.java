package Server.http.filters;

import Server.http.ContextualHandler;
import Server.http.HttpUtils;
import Server.http.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Stage that refuses requests which arrive after draining has started, so that
 * keep-alive connections cannot feed new work into a shutting-down server.
 *
 * <p>Whether a request arrived in time is decided by the
 * {@link InFlightTrackingFilter} when it counts the exchange, so a request that
 * is already counted as in flight is never refused here.</p>
 *
 * <p>Health probes are let through: they answer 503 from the liveness flag
 * themselves, which is what load balancers look for.</p>
 */
public class DrainGateFilter implements Stage {

    private static final Logger log = LoggerFactory.getLogger(DrainGateFilter.class);

    private final InFlightTrackingFilter tracker;
    private final Set<String> passThroughPaths;
    private final String retryAfterSeconds;

    public DrainGateFilter(InFlightTrackingFilter tracker, Set<String> passThroughPaths, Duration retryAfter) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.passThroughPaths = Set.copyOf(passThroughPaths);
        this.retryAfterSeconds = Long.toString(retryAfterSeconds(retryAfter));
    }

    @Override
    public ContextualHandler wrap(ContextualHandler next) {
        return (exchange, context) -> {
            String path = HttpUtils.requestPath(exchange);
            if (tracker.isAdmitted(exchange) || passThroughPaths.contains(path)) {
                next.handle(exchange, context);
                return;
            }

            log.debug("Rejecting request during drain: {} {}", exchange.getRequestMethod(), path);
            exchange.getResponseHeaders().set("Retry-After", retryAfterSeconds);
            exchange.getResponseHeaders().set("Connection", "close");
            HttpUtils.sendApiError(exchange, 503, "shutting_down", "Server is shutting down");
        };
    }

    /** Whole seconds, rounded up, never below one. */
    static long retryAfterSeconds(Duration retryAfter) {
        long seconds = retryAfter.getSeconds() + (retryAfter.getNano() > 0 ? 1 : 0);
        return Math.max(1, seconds);
    }

    @Override
    public String description() {
        return "Rejects new requests while the server drains";
    }
}
