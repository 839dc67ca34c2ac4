package Server.http;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable per-request values handed down the stage chain.
 *
 * <p>The correlation id is absent until the correlation stage runs and is
 * never replaced once set.</p>
 */
public final class RequestContext {

    private static final RequestContext EMPTY = new RequestContext(null);

    private final String correlationId;

    private RequestContext(String correlationId) {
        this.correlationId = correlationId;
    }

    public static RequestContext empty() {
        return EMPTY;
    }

    public Optional<String> correlationId() {
        return Optional.ofNullable(correlationId);
    }

    /**
     * @throws IllegalStateException if this context already carries a correlation id
     */
    public RequestContext withCorrelationId(String id) {
        Objects.requireNonNull(id, "id");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("correlation id must not be empty");
        }
        if (correlationId != null) {
            throw new IllegalStateException("correlation id already set to " + correlationId);
        }
        return new RequestContext(id);
    }

    @Override
    public String toString() {
        return "RequestContext{correlationId=" + correlationId + "}";
    }
}
