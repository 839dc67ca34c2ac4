package Server.http;

import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exact path to handler map. Paths that are not registered get a 404.
 */
public final class HandlerRegistry implements ContextualHandler {

    private final Map<String, ContextualHandler> routes = new ConcurrentHashMap<>();

    public HandlerRegistry register(String path, ContextualHandler handler) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(handler, "handler");
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("Path must start with '/': " + path);
        }
        if (routes.putIfAbsent(path, handler) != null) {
            throw new IllegalStateException("Route already registered: " + path);
        }
        return this;
    }

    public boolean isRegistered(String path) {
        return routes.containsKey(path);
    }

    @Override
    public void handle(HttpExchange exchange, RequestContext context) throws IOException {
        String path = exchange.getRequestURI() != null ? exchange.getRequestURI().getPath() : null;
        ContextualHandler handler = path == null ? null : routes.get(path);
        if (handler == null) {
            HttpUtils.sendApiError(exchange, 404, "not_found", "Not Found");
            return;
        }
        handler.handle(exchange, context);
    }
}
