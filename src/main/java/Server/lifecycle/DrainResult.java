package Server.lifecycle;

import java.time.Duration;

/**
 * Outcome of one shutdown.
 *
 * @param drained      every in-flight request finished before the deadline
 * @param forcedClosed requests still running when the connections were closed
 * @param elapsed      time from the start of draining until the session was released
 * @param failure      error raised while releasing the session, or {@code null}
 */
public record DrainResult(boolean drained, int forcedClosed, Duration elapsed, RuntimeException failure) {

    public static DrainResult drained(Duration elapsed) {
        return new DrainResult(true, 0, elapsed, null);
    }

    public static DrainResult forced(int forcedClosed, Duration elapsed) {
        return new DrainResult(false, forcedClosed, elapsed, null);
    }

    public static DrainResult failed(RuntimeException failure, Duration elapsed) {
        return new DrainResult(false, 0, elapsed, failure);
    }

    public boolean failed() {
        return failure != null;
    }
}
