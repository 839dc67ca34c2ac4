package Server;

import Server.http.ApiFilters;
import Server.http.HandlerRegistry;
import Server.http.Pipeline;
import Server.http.Stage;
import Server.http.accesslog.AccessLogSink;
import Server.http.accesslog.Slf4jAccessLogSink;
import Server.lifecycle.LivenessFlag;
import Server.routes.HealthRoutes;
import Server.routes.PageRoutes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.stream.Collectors;

/**
 * Wires routes and stages into a bound {@link ServerSession}.
 */
public final class ApiServer {

    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private ApiServer() {}

    public static HandlerRegistry defaultRoutes(LivenessFlag liveness) {
        HandlerRegistry registry = new HandlerRegistry();
        new PageRoutes().register(registry);
        new HealthRoutes(liveness).register(registry);
        return registry;
    }

    public static ServerSession bind(ServerSettings settings, LivenessFlag liveness) throws IOException {
        return bind(settings, defaultRoutes(liveness), new Slf4jAccessLogSink());
    }

    public static ServerSession bind(ServerSettings settings, HandlerRegistry registry,
                                     AccessLogSink accessLogSink) throws IOException {
        return bind(settings, registry, new ApiFilters(accessLogSink, settings.shutdownTimeout()));
    }

    public static ServerSession bind(ServerSettings settings, HandlerRegistry registry, ApiFilters filters) throws IOException {
        Pipeline pipeline = Pipeline.of(filters.all(), registry);
        log.debug("Request pipeline: {}", pipeline.stages().stream()
                .map(Stage::description)
                .collect(Collectors.joining(" -> ")));
        return ServerSession.bind(settings, pipeline, filters.inFlight());
    }
}
