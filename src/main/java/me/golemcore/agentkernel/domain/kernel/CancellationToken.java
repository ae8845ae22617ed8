package me.golemcore.agentkernel.domain.kernel;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal shared by the kernel, the dispatcher and
 * callers. A token derived with {@link #withDeadline} is cancelled when its
 * parent is cancelled or its deadline passes.
 */
public final class CancellationToken {

    private static final String DEFAULT_REASON = "cancelled";

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final CancellationToken parent;
    private final Instant deadline;
    private final Clock clock;

    private CancellationToken(CancellationToken parent, Instant deadline, Clock clock) {
        this.parent = parent;
        this.deadline = deadline;
        this.clock = clock;
    }

    public static CancellationToken create() {
        return new CancellationToken(null, null, null);
    }

    /**
     * Derives a child token that also fires once {@code deadline} is reached.
     */
    public CancellationToken withDeadline(Instant deadline, Clock clock) {
        return new CancellationToken(this, deadline, clock);
    }

    public void cancel() {
        cancel(DEFAULT_REASON);
    }

    public void cancel(String why) {
        reason.compareAndSet(null, why != null ? why : DEFAULT_REASON);
    }

    public boolean isCancelled() {
        if (reason.get() != null) {
            return true;
        }
        if (parent != null && parent.isCancelled()) {
            return true;
        }
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Returns why the token fired, or null while it has not.
     */
    public String getReason() {
        String own = reason.get();
        if (own != null) {
            return own;
        }
        if (parent != null && parent.isCancelled()) {
            return parent.getReason();
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            return "run timeout exceeded";
        }
        return null;
    }

    public Instant getDeadline() {
        return deadline;
    }
}
