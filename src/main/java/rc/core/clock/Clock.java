package rc.core.clock;

/**
 * Monotonic time source in nanoseconds.
 * Injected everywhere time matters so tests can drive it deterministically.
 */
public interface Clock {
    long nowNanos();
}
