package Server.http.filters;

import Server.http.ContextualHandler;
import Server.http.FakeExchange;
import Server.http.RequestContext;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorTrackingFilterTest {

    @Test
    void turnsRuntimeExceptionInto500() throws Exception {
        ContextualHandler chain = new ErrorTrackingFilter().wrap((ex, ctx) -> {
            throw new IllegalStateException("boom");
        });

        FakeExchange exchange = new FakeExchange("GET", "/hello");
        chain.handle(exchange, RequestContext.empty().withCorrelationId("err-1"));

        assertEquals(500, exchange.getResponseCode());
        assertTrue(exchange.responseBodyAsString().contains("internal_error"));
    }

    @Test
    void leavesStartedResponseAlone() throws Exception {
        ContextualHandler chain = new ErrorTrackingFilter().wrap((ex, ctx) -> {
            ex.sendResponseHeaders(200, -1);
            throw new IllegalStateException("late failure");
        });

        FakeExchange exchange = new FakeExchange("GET", "/hello");
        chain.handle(exchange, RequestContext.empty());

        assertEquals(200, exchange.getResponseCode());
        assertEquals("", exchange.responseBodyAsString());
    }

    @Test
    void propagatesIoFailures() {
        ContextualHandler chain = new ErrorTrackingFilter().wrap((ex, ctx) -> {
            throw new IOException("Connection reset");
        });

        assertThrows(IOException.class, () -> chain.handle(new FakeExchange("GET", "/"), RequestContext.empty()));
    }
}
