package Server.routes;

import Server.http.HandlerRegistry;
import Server.http.HttpUtils;
import Server.http.RequestContext;
import Server.lifecycle.LivenessFlag;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.util.Objects;

/**
 * Health check endpoint for load balancers and orchestration tooling.
 * Answers 204 while the instance is ready and 503 before startup completes
 * and once draining has begun. Never sends a body.
 */
public class HealthRoutes {

    public static final String HEALTH_PATH = "/health";

    private final LivenessFlag liveness;

    public HealthRoutes(LivenessFlag liveness) {
        this.liveness = Objects.requireNonNull(liveness, "liveness");
    }

    public void register(HandlerRegistry registry) {
        registry.register(HEALTH_PATH, this::handleHealth);
    }

    private void handleHealth(HttpExchange exchange, RequestContext context) throws IOException {
        if (!HttpUtils.isGetOrHead(exchange)) {
            exchange.getResponseHeaders().set("Allow", "GET, HEAD");
            HttpUtils.sendApiError(exchange, 405, "method_not_allowed", "Only GET is supported");
            return;
        }
        if (liveness.isReady()) {
            HttpUtils.sendNoContent(exchange);
        } else {
            HttpUtils.sendStatus(exchange, 503);
        }
    }
}
