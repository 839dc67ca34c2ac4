package Server.http;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class HandlerRegistryTest {

    @Test
    void dispatchesOnExactPath() throws Exception {
        HandlerRegistry registry = new HandlerRegistry();
        AtomicBoolean called = new AtomicBoolean(false);
        registry.register("/hello", (ex, ctx) -> called.set(true));

        registry.handle(new FakeExchange("GET", "/hello"), RequestContext.empty());
        assertTrue(called.get());
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        HandlerRegistry registry = new HandlerRegistry();
        registry.register("/", (ex, ctx) -> fail("root must not match other paths"));

        FakeExchange exchange = new FakeExchange("GET", "/missing");
        registry.handle(exchange, RequestContext.empty());

        assertEquals(404, exchange.getResponseCode());
        JsonNode json = HttpUtils.getMapper().readTree(exchange.responseBodyAsString());
        assertEquals("not_found", json.path("error").path("code").asText());
    }

    @Test
    void rejectsDuplicateAndRelativePaths() {
        HandlerRegistry registry = new HandlerRegistry();
        registry.register("/a", (ex, ctx) -> {});

        assertThrows(IllegalStateException.class, () -> registry.register("/a", (ex, ctx) -> {}));
        assertThrows(IllegalArgumentException.class, () -> registry.register("a", (ex, ctx) -> {}));
        assertTrue(registry.isRegistered("/a"));
    }
}
