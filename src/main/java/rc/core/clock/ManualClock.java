package rc.core.clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated clock, advanced explicitly by the test driving it.
 * Readable from many threads at once: concurrent acquirers observe every advance.
 */
public final class ManualClock implements Clock {
    private final AtomicLong now;

    public ManualClock(long startNanos) {
        this.now = new AtomicLong(startNanos);
    }

    @Override
    public long nowNanos() {
        return now.get();
    }

    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now.addAndGet(delta);
    }

    public void advanceMillis(long deltaMillis) {
        advanceNanos(deltaMillis * 1_000_000L);
    }
}
