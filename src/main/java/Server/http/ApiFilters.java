package Server.http;

import Server.http.accesslog.AccessLogSink;
import Server.http.filters.AccessLogFilter;
import Server.http.filters.CorrelationIdFilter;
import Server.http.filters.DrainGateFilter;
import Server.http.filters.ErrorTrackingFilter;
import Server.http.filters.InFlightTrackingFilter;
import Server.routes.HealthRoutes;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * The stage set of one server, built per instance so that several servers in
 * one JVM do not share state.
 *
 * The in-flight tracker is not a stage: it is attached to the server context
 * and the drain gate consults it.
 */
public final class ApiFilters {

    private final InFlightTrackingFilter inFlight;
    private final CorrelationIdFilter correlationId;
    private final AccessLogFilter accessLog;
    private final DrainGateFilter drainGate;
    private final ErrorTrackingFilter errorTracking;

    public ApiFilters(AccessLogSink accessLogSink, Duration retryAfter) {
        this(new CorrelationIdFilter(), accessLogSink, retryAfter);
    }

    public ApiFilters(CorrelationIdFilter correlationId, AccessLogSink accessLogSink, Duration retryAfter) {
        this.inFlight = new InFlightTrackingFilter();
        this.correlationId = correlationId;
        this.accessLog = new AccessLogFilter(accessLogSink);
        this.drainGate = new DrainGateFilter(inFlight, Set.of(HealthRoutes.HEALTH_PATH), retryAfter);
        this.errorTracking = new ErrorTrackingFilter();
    }

    public InFlightTrackingFilter inFlight() {
        return inFlight;
    }

    public CorrelationIdFilter correlationId() {
        return correlationId;
    }

    public AccessLogFilter accessLog() {
        return accessLog;
    }

    public DrainGateFilter drainGate() {
        return drainGate;
    }

    public ErrorTrackingFilter errorTracking() {
        return errorTracking;
    }

    /**
     * All stages, outermost first.
     * Order: CorrelationId -> AccessLog -> DrainGate -> ErrorTracking
     */
    public List<Stage> all() {
        return List.of(correlationId, accessLog, drainGate, errorTracking);
    }
}
