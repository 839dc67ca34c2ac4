package Server.http;

import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;

/**
 * A request handler that receives the request context explicitly instead of
 * looking it up from the exchange.
 */
@FunctionalInterface
public interface ContextualHandler {

    void handle(HttpExchange exchange, RequestContext context) throws IOException;
}
