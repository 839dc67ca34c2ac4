package Server.http.filters;

import Server.http.ContextualHandler;
import Server.http.RequestContext;
import Server.http.Stage;
import org.slf4j.MDC;

import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Stage that assigns a correlation id to every request.
 *
 * The correlation id is:
 1. Taken verbatim from the X-Request-Id header if present and non-empty
 2. Generated otherwise
 3. Stored in the {@link RequestContext} handed to the next stage
 4. Set on the X-Request-Id response header before the next stage runs
 5. Put into the MDC while the request is handled, so log lines carry it
 */
public class CorrelationIdFilter implements Stage {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String MDC_REQUEST_ID_KEY = "requestId";

    private final Supplier<String> idGenerator;

    public CorrelationIdFilter() {
        this(() -> UUID.randomUUID().toString());
    }

    public CorrelationIdFilter(Supplier<String> idGenerator) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    @Override
    public ContextualHandler wrap(ContextualHandler next) {
        return (exchange, context) -> {
            if (context.correlationId().isPresent()) {
                next.handle(exchange, context);
                return;
            }

            String correlationId = extractOrGenerate(exchange.getRequestHeaders().getFirst(REQUEST_ID_HEADER));
            exchange.getResponseHeaders().set(REQUEST_ID_HEADER, correlationId);

            MDC.put(MDC_REQUEST_ID_KEY, correlationId);
            try {
                next.handle(exchange, context.withCorrelationId(correlationId));
            } finally {
                MDC.remove(MDC_REQUEST_ID_KEY);
            }
        };
    }

    String extractOrGenerate(String inbound) {
        if (inbound != null && !inbound.isEmpty()) {
            return inbound;
        }
        String generated = idGenerator.get();
        if (generated == null || generated.isEmpty()) {
            // a broken generator must not fail the request
            generated = UUID.randomUUID().toString();
        }
        return generated;
    }

    @Override
    public String description() {
        return "Propagates or generates X-Request-Id correlation ids";
    }
}
