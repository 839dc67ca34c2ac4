package Server.lifecycle;

import Server.ServerSession;
import Server.http.HttpUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one server session through {@code STARTING -> SERVING -> DRAINING -> STOPPED}.
 *
 * <p>The orchestrator is the only writer of the {@link LivenessFlag}. On
 * shutdown it marks the flag draining, which makes health checks fail and the
 * drain gate refuse new requests, then disables keep-alive, and only then
 * starts waiting for in-flight requests. Requests still running when the
 * deadline passes are cut off; that is logged as a warning and is not an
 * error.</p>
 *
 * <p>A second shutdown request while draining does not start another drain: it
 * waits for the first one and returns its result.</p>
 *
 * <p>The orchestrator never exits the process. The caller waits in
 * {@link #awaitStopped()} and picks the exit status from {@link #result()}.</p>
 */
public final class ShutdownOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ShutdownOrchestrator.class);

    static final List<String> SHUTDOWN_SIGNALS = List.of("INT", "TERM");

    public enum State {
        STARTING,
        SERVING,
        DRAINING,
        STOPPED
    }

    private final ServerSession session;
    private final LivenessFlag liveness;
    private final Duration shutdownTimeout;
    private final AtomicReference<State> state = new AtomicReference<>(State.STARTING);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile DrainResult result;

    public ShutdownOrchestrator(ServerSession session, LivenessFlag liveness, Duration shutdownTimeout) {
        this.session = Objects.requireNonNull(session, "session");
        this.liveness = Objects.requireNonNull(liveness, "liveness");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    }

    /**
     * Starts accepting connections and reports ready.
     *
     * @throws IllegalStateException if called more than once or after shutdown
     */
    public void start() {
        if (!state.compareAndSet(State.STARTING, State.SERVING)) {
            throw new IllegalStateException("Cannot start from state " + state.get());
        }
        session.start();
        liveness.setReady();
        log.info("Server is ready to handle requests at {}", HttpUtils.formatAddress(session.address()));
    }

    /**
     * Handles SIGINT and SIGTERM by running {@link #shutdown()} on its own
     * thread. The JVM keeps running while the drain is in progress, so the exit
     * status is decided by whoever waits in {@link #awaitStopped()}.
     *
     * @throws IllegalArgumentException if the JVM does not let the signals be handled,
     *                                  for example when started with {@code -Xrs}
     */
    public void installSignalHandler() {
        for (String name : SHUTDOWN_SIGNALS) {
            Signal.handle(new Signal(name), signal -> onSignal(signal.getName()));
        }
    }

    Thread onSignal(String signalName) {
        log.info("Received SIG{}", signalName);
        Thread drainer = new Thread(this::shutdown, "shutdown-orchestrator");
        drainer.start();
        return drainer;
    }

    /**
     * Marks the server draining, refuses new requests, waits for in-flight
     * requests up to the shutdown timeout and releases the session.
     */
    public DrainResult shutdown() {
        State previous = state.getAndUpdate(s -> s == State.STARTING || s == State.SERVING ? State.DRAINING : s);
        if (previous == State.DRAINING || previous == State.STOPPED) {
            log.info("Shutdown already in progress, waiting for it to finish");
            awaitStoppedUninterruptibly();
            return result;
        }

        log.info("Server is shutting down...");
        long startNanos = System.nanoTime();
        liveness.setDraining();
        session.beginDrain();

        DrainResult outcome;
        try {
            int forced = session.drain(shutdownTimeout);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            if (forced > 0) {
                log.warn("Shutdown timeout of {} ms elapsed, forcibly closed {} in-flight request(s)",
                        shutdownTimeout.toMillis(), forced);
                outcome = DrainResult.forced(forced, elapsed);
            } else {
                outcome = DrainResult.drained(elapsed);
            }
        } catch (RuntimeException e) {
            log.error("Could not gracefully shutdown the server: {}", e.getMessage(), e);
            outcome = DrainResult.failed(e, Duration.ofNanos(System.nanoTime() - startNanos));
        }

        result = outcome;
        state.set(State.STOPPED);
        log.info("Server stopped after {} ms", outcome.elapsed().toMillis());
        stopped.countDown();
        return outcome;
    }

    public void awaitStopped() throws InterruptedException {
        stopped.await();
    }

    /**
     * @return {@code true} if the server reached {@link State#STOPPED} within the timeout
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public State state() {
        return state.get();
    }

    /**
     * @return the shutdown outcome, or {@code null} while not yet stopped
     */
    public DrainResult result() {
        return result;
    }

    private void awaitStoppedUninterruptibly() {
        boolean interrupted = false;
        while (true) {
            try {
                stopped.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
