package Server;

import Server.http.filters.InFlightTrackingFilter;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The bound listening socket together with its worker pool and in-flight
 * accounting. Owned by the main control flow from bind until {@link #drain}.
 */
public final class ServerSession {

    private static final Logger log = LoggerFactory.getLogger(ServerSession.class);

    private static final Duration WORKER_EXIT_TIME = Duration.ofMillis(500);

    private final HttpServer server;
    private final ExecutorService executor;
    private final InFlightTrackingFilter tracker;

    private ServerSession(HttpServer server, ExecutorService executor, InFlightTrackingFilter tracker) {
        this.server = server;
        this.executor = executor;
        this.tracker = tracker;
    }

    /**
     * Binds the listening socket. Nothing is accepted until {@link #start()}.
     * The tracker is attached to the context; the handler's drain gate must
     * consult the same instance.
     *
     * @throws IOException if the address cannot be bound; there is no retry
     */
    public static ServerSession bind(ServerSettings settings, HttpHandler handler,
                                     InFlightTrackingFilter tracker) throws IOException {
        applyTimeouts(settings);

        HttpServer server;
        try {
            server = HttpServer.create(settings.listenAddress(), 0);
        } catch (BindException e) {
            throw new IOException("Could not listen on " + settings.listenAddress() + ": " + e.getMessage(), e);
        }

        HttpContext context = server.createContext("/", handler);
        context.getFilters().add(tracker);

        ExecutorService executor = Executors.newCachedThreadPool(workerThreadFactory());
        server.setExecutor(executor);
        return new ServerSession(server, executor, tracker);
    }

    public void start() {
        server.start();
        log.debug("Accepting connections on {}", address());
    }

    public InetSocketAddress address() {
        return server.getAddress();
    }

    public int inFlight() {
        return tracker.inFlight();
    }

    /**
     * Requests arriving from now on are refused and their responses carry
     * {@code Connection: close}. Requests already in flight are not affected.
     */
    public void beginDrain() {
        tracker.beginDrain();
    }

    public boolean isDraining() {
        return tracker.isDraining();
    }

    /**
     * Waits up to {@code deadline} for in-flight exchanges to finish, then
     * closes the listening socket and every remaining connection and
     * interrupts the workers still running.
     *
     * <p>Call {@link #beginDrain()} first: requests arriving after that are
     * refused by the drain gate, so nothing new starts while this waits.</p>
     *
     * @return number of requests that were still running when connections were closed
     */
    public int drain(Duration deadline) {
        log.debug("Draining {} request(s) in flight, waiting up to {} ms", tracker.inFlight(), deadline.toMillis());
        boolean idle;
        try {
            idle = tracker.awaitIdle(deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            idle = false;
        }
        int remaining = idle ? 0 : tracker.inFlight();

        server.stop(0);
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(WORKER_EXIT_TIME.toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("Some workers ignored interruption and are left to die with the process");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return remaining;
    }

    /**
     * The JDK server reads these once, when the first server in the JVM is
     * created. Values already set on the command line are kept.
     */
    static void applyTimeouts(ServerSettings settings) {
        setIfAbsent("sun.net.httpserver.maxReqTime", ceilSeconds(settings.readTimeout()));
        setIfAbsent("sun.net.httpserver.maxRspTime", ceilSeconds(settings.writeTimeout()));
        setIfAbsent("sun.net.httpserver.idleInterval", ceilSeconds(settings.idleTimeout()));
    }

    private static void setIfAbsent(String property, long seconds) {
        if (System.getProperty(property) == null) {
            System.setProperty(property, Long.toString(seconds));
        }
    }

    static long ceilSeconds(Duration d) {
        long seconds = d.getSeconds();
        return d.getNano() > 0 ? seconds + 1 : seconds;
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "http-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
