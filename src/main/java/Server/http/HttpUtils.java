package Server.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Shared HTTP utilities for request/response handling.
 */
public final class HttpUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpUtils() {}

    public static ObjectMapper getMapper() {
        return MAPPER;
    }

    // =========================================================================
    // Request Helpers
    // =========================================================================

    public static String requestPath(HttpExchange exchange) {
        if (exchange.getRequestURI() == null || exchange.getRequestURI().getPath() == null) {
            return "";
        }
        return exchange.getRequestURI().getPath();
    }

    public static String firstHeader(HttpExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? null : value.trim();
    }

    /**
     * Formats the peer as {@code host:port}, or {@code unknown} if the exchange has none.
     */
    public static String remoteAddress(HttpExchange exchange) {
        return formatAddress(exchange.getRemoteAddress());
    }

    /**
     * {@code host:port}, with IPv6 hosts in brackets and without the leading
     * slash of {@link InetSocketAddress#toString()}.
     */
    public static String formatAddress(InetSocketAddress socketAddress) {
        if (socketAddress == null) return "unknown";
        InetAddress address = socketAddress.getAddress();
        String host = address != null ? address.getHostAddress() : socketAddress.getHostString();
        if (host.indexOf(':') >= 0) {
            host = "[" + host + "]";
        }
        return host + ":" + socketAddress.getPort();
    }

    public static boolean isGetOrHead(HttpExchange exchange) {
        String method = exchange.getRequestMethod();
        return "GET".equalsIgnoreCase(method) || "HEAD".equalsIgnoreCase(method);
    }

    // =========================================================================
    // Response Helpers
    // =========================================================================

    public static void sendJson(HttpExchange exchange, int statusCode, Object payload) throws IOException {
        byte[] body = MAPPER.writeValueAsBytes(payload);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        sendBody(exchange, statusCode, body);
    }

    public static void sendApiError(HttpExchange exchange, int statusCode, String code, String message) throws IOException {
        String safeCode = (code == null || code.isBlank()) ? "error" : code.trim();
        String safeMessage = (message == null || message.isBlank()) ? "Request failed" : message;
        sendJson(exchange, statusCode, ApiErrorResponse.of(safeCode, statusCode, safeMessage));
    }

    public static void sendText(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendText(exchange, statusCode, "text/plain; charset=utf-8", message);
    }

    public static void sendText(HttpExchange exchange, int statusCode, String contentType, String message) throws IOException {
        byte[] body = (message == null ? "" : message).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        sendBody(exchange, statusCode, body);
    }

    /**
     * Sends a status line and headers without a body, e.g. 204 or a bare 503.
     */
    public static void sendStatus(HttpExchange exchange, int statusCode) throws IOException {
        exchange.sendResponseHeaders(statusCode, -1);
    }

    public static void sendNoContent(HttpExchange exchange) throws IOException {
        sendStatus(exchange, 204);
    }

    private static void sendBody(HttpExchange exchange, int statusCode, byte[] body) throws IOException {
        // a length of 0 would switch the JDK server to chunked encoding
        if (body.length == 0 || "HEAD".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(statusCode, -1);
            return;
        }
        exchange.sendResponseHeaders(statusCode, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
