package Server.http.filters;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Counts exchanges currently being handled and remembers which of them were
 * admitted before draining began. Exchanges arriving after {@link #beginDrain()}
 * are still counted but are not admitted, and they ask the client to close the
 * connection after the response.
 *
 * Attached directly to the server context so it sees every exchange before the
 * stage pipeline does.
 */
public class InFlightTrackingFilter extends Filter {

    private final Object lock = new Object();
    private final Set<HttpExchange> admitted = Collections.newSetFromMap(new IdentityHashMap<>());
    private int inFlight;
    private boolean draining;

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        boolean lateArrival;
        synchronized (lock) {
            inFlight++;
            lateArrival = draining;
            if (!lateArrival) {
                admitted.add(exchange);
            }
        }
        try {
            if (lateArrival) {
                exchange.getResponseHeaders().set("Connection", "close");
            }
            chain.doFilter(exchange);
        } finally {
            synchronized (lock) {
                admitted.remove(exchange);
                inFlight--;
                if (inFlight == 0) {
                    lock.notifyAll();
                }
            }
        }
    }

    public int inFlight() {
        synchronized (lock) {
            return inFlight;
        }
    }

    /**
     * From now on exchanges are no longer admitted and keep-alive is off.
     * Exchanges already admitted stay admitted until they finish.
     */
    public void beginDrain() {
        synchronized (lock) {
            draining = true;
        }
    }

    public boolean isDraining() {
        synchronized (lock) {
            return draining;
        }
    }

    /**
     * @return {@code true} if the exchange entered this filter before draining began
     */
    public boolean isAdmitted(HttpExchange exchange) {
        synchronized (lock) {
            return admitted.contains(exchange);
        }
    }

    /**
     * Blocks until no exchange is in flight or the timeout elapses.
     *
     * @return {@code true} if the server went idle within the timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            while (inFlight > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                long millis = Math.max(1, remaining / 1_000_000L);
                lock.wait(millis);
            }
            return true;
        }
    }

    @Override
    public String description() {
        return "Tracks in-flight exchanges for graceful shutdown";
    }
}
