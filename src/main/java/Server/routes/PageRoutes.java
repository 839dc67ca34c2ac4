package Server.routes;

import Server.http.HandlerRegistry;
import Server.http.HttpUtils;
import Server.http.RequestContext;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The plain content routes: a landing page, a greeting and a JSON document
 * served as text.
 */
public class PageRoutes {

    private static final Map<String, String> LINKS = links();

    public void register(HandlerRegistry registry) {
        registry.register("/", this::handleIndex);
        registry.register("/hello", this::handleHello);
        registry.register("/json-as-text", this::handleJsonAsText);
    }

    private void handleIndex(HttpExchange exchange, RequestContext context) throws IOException {
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n<html><body>\n");
        html.append("<h1>Hi there!</h1>\n");
        html.append("<p>").append(OffsetDateTime.now().truncatedTo(ChronoUnit.SECONDS)
                .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME)).append("</p>\n");
        html.append("<p>Your IP: ").append(escape(HttpUtils.remoteAddress(exchange))).append("</p>\n");
        html.append("<ul>\n");
        for (Map.Entry<String, String> link : LINKS.entrySet()) {
            html.append("<li><a href=\"").append(link.getValue()).append("\">")
                    .append(link.getKey()).append("</a></li>\n");
        }
        html.append("</ul>\n</body></html>\n");
        HttpUtils.sendText(exchange, 200, "text/html; charset=utf-8", html.toString());
    }

    private void handleHello(HttpExchange exchange, RequestContext context) throws IOException {
        HttpUtils.sendText(exchange, 200, "Hello, World!\n");
    }

    private void handleJsonAsText(HttpExchange exchange, RequestContext context) throws IOException {
        exchange.getResponseHeaders().set("X-Content-Type-Options", "nosniff");
        String body = HttpUtils.getMapper().writeValueAsString(Map.of("status", "ok")) + "\n";
        HttpUtils.sendText(exchange, 200, body);
    }

    private static String escape(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    private static Map<String, String> links() {
        Map<String, String> links = new LinkedHashMap<>();
        links.put("Home", "/");
        links.put("Hello", "/hello");
        links.put("Health Ping", "/health");
        links.put("JSON as TEXT", "/json-as-text");
        return links;
    }
}
