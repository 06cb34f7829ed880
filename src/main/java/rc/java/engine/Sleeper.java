package rc.java.engine;

import java.util.concurrent.TimeUnit;

/**
 * Backoff sleep, injectable so retry loops can be tested without real waiting.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long nanos) throws InterruptedException;

    static Sleeper system() {
        return nanos -> {
            if (nanos > 0) TimeUnit.NANOSECONDS.sleep(nanos);
        };
    }
}
