package Server.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Composes {@link Stage}s around a terminal handler and exposes the result as a
 * JDK {@link HttpHandler}. The first stage in the list is the outermost one.
 */
public final class Pipeline implements HttpHandler {

    private final ContextualHandler chain;
    private final List<Stage> stages;

    private Pipeline(List<Stage> stages, ContextualHandler chain) {
        this.stages = stages;
        this.chain = chain;
    }

    public static Pipeline of(List<Stage> stages, ContextualHandler terminal) {
        Objects.requireNonNull(terminal, "terminal");
        List<Stage> ordered = List.copyOf(stages);
        ContextualHandler handler = terminal;
        for (int i = ordered.size() - 1; i >= 0; i--) {
            handler = ordered.get(i).wrap(handler);
        }
        return new Pipeline(ordered, handler);
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            chain.handle(exchange, RequestContext.empty());
        } finally {
            exchange.close();
        }
    }

    public List<Stage> stages() {
        return stages;
    }
}
