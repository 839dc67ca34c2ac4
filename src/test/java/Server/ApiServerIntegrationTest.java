package Server;

import Server.http.HttpUtils;
import Server.http.accesslog.AccessLogRecord;
import Server.lifecycle.LivenessFlag;
import Server.lifecycle.ShutdownOrchestrator;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ApiServerIntegrationTest {

    private final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    private final List<AccessLogRecord> accessLog = new CopyOnWriteArrayList<>();
    private ShutdownOrchestrator orchestrator;
    private int port;

    @BeforeAll
    void startServer() throws Exception {
        LivenessFlag liveness = new LivenessFlag();
        ServerSettings settings = ServerSettings.defaults()
                .withListenAddress(new InetSocketAddress("127.0.0.1", 0))
                .withShutdownTimeout(Duration.ofSeconds(5));
        ServerSession session = ApiServer.bind(settings, ApiServer.defaultRoutes(liveness), accessLog::add);
        orchestrator = new ShutdownOrchestrator(session, liveness, settings.shutdownTimeout());
        orchestrator.start();
        port = session.address().getPort();
        assertTrue(port > 0);
    }

    @AfterAll
    void stopServer() {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
    }

    @Test
    void helloReturnsGreeting() throws Exception {
        HttpResponse<String> resp = get("/hello");
        assertEquals(200, resp.statusCode());
        assertEquals("Hello, World!\n", resp.body());
    }

    @Test
    void jsonAsTextIsServedAsPlainText() throws Exception {
        HttpResponse<String> resp = get("/json-as-text");
        assertEquals(200, resp.statusCode());
        assertTrue(resp.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
        assertEquals("nosniff", resp.headers().firstValue("X-Content-Type-Options").orElse(null));
        JsonNode json = HttpUtils.getMapper().readTree(resp.body());
        assertEquals("ok", json.path("status").asText());
    }

    @Test
    void indexRendersHtmlWithLinks() throws Exception {
        HttpResponse<String> resp = get("/");
        assertEquals(200, resp.statusCode());
        assertTrue(resp.body().toLowerCase().contains("<!doctype html"));
        assertTrue(resp.body().contains("href=\"/health\""));
        assertTrue(resp.body().contains("Your IP: 127.0.0.1:"));
    }

    @Test
    void unknownRouteIsNotFoundAndStillCorrelated() throws Exception {
        HttpResponse<String> resp = get("/nope");
        assertEquals(404, resp.statusCode());
        JsonNode json = HttpUtils.getMapper().readTree(resp.body());
        assertEquals("not_found", json.path("error").path("code").asText());
        assertTrue(resp.headers().firstValue("X-Request-Id").isPresent());
    }

    @Test
    void healthIsNoContentWhileServing() throws Exception {
        HttpResponse<String> resp = get("/health");
        assertEquals(204, resp.statusCode());
        assertEquals("", resp.body());
    }

    @Test
    void healthRejectsPost() throws Exception {
        HttpResponse<String> resp = client.send(
                HttpRequest.newBuilder(uri("/health"))
                        .timeout(Duration.ofSeconds(5))
                        .POST(HttpRequest.BodyPublishers.noBody())
                        .build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        assertEquals(405, resp.statusCode());
    }

    @Test
    void inboundRequestIdIsEchoedAndLogged() throws Exception {
        HttpResponse<String> resp = client.send(
                HttpRequest.newBuilder(uri("/hello"))
                        .timeout(Duration.ofSeconds(5))
                        .header("X-Request-Id", "trace-123")
                        .header("User-Agent", "integration-test")
                        .GET()
                        .build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

        assertEquals("trace-123", resp.headers().firstValue("X-Request-Id").orElse(null));
        AccessLogRecord record = awaitSingleRecord("trace-123");
        assertEquals("trace-123", record.correlationId());
        assertEquals("GET", record.method());
        assertEquals("/hello", record.path());
        assertTrue(record.remoteAddress().startsWith("127.0.0.1:"));
        assertEquals("integration-test", record.userAgent());
    }

    @Test
    void generatedRequestIdMatchesAccessLog() throws Exception {
        HttpResponse<String> resp = get("/hello");

        String id = resp.headers().firstValue("X-Request-Id").orElse(null);
        assertNotNull(id);
        assertFalse(id.isBlank());
        assertEquals(id, awaitSingleRecord(id).correlationId());
    }

    @Test
    void sequentialRequestsGetDistinctIds() throws Exception {
        String first = get("/hello").headers().firstValue("X-Request-Id").orElseThrow();
        String second = get("/hello").headers().firstValue("X-Request-Id").orElseThrow();
        assertNotEquals(first, second);
    }

    // the record is written after the response is flushed, so give the worker a moment
    private AccessLogRecord awaitSingleRecord(String correlationId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        List<AccessLogRecord> matching = List.of();
        while (System.nanoTime() < deadline) {
            matching = accessLog.stream().filter(r -> r.correlationId().equals(correlationId)).toList();
            if (!matching.isEmpty()) {
                break;
            }
            Thread.sleep(10);
        }
        assertEquals(1, matching.size(), "records for " + correlationId);
        return matching.get(0);
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(
                HttpRequest.newBuilder(uri(path))
                        .timeout(Duration.ofSeconds(5))
                        .GET()
                        .build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + port + path);
    }
}
