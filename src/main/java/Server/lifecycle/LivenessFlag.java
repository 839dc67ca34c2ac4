package Server.lifecycle;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Liveness of one server instance, read by health checks and written only by
 * the {@link ShutdownOrchestrator}.
 *
 * <p>Transitions are monotone: {@code STARTING -> READY -> DRAINING}. Once
 * draining, the flag never reports ready again.</p>
 */
public final class LivenessFlag {

    public enum Phase {
        STARTING,
        READY,
        DRAINING
    }

    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.STARTING);

    /**
     * Marks the instance ready. Has no effect once draining has begun.
     */
    public void setReady() {
        phase.compareAndSet(Phase.STARTING, Phase.READY);
    }

    public void setDraining() {
        phase.set(Phase.DRAINING);
    }

    public boolean isReady() {
        return phase.get() == Phase.READY;
    }

    public boolean isDraining() {
        return phase.get() == Phase.DRAINING;
    }

    public Phase phase() {
        return phase.get();
    }
}
