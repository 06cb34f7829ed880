package rc.java.transport;

import org.junit.jupiter.api.Test;
import rc.core.clock.ManualClock;
import rc.core.clock.SystemClock;
import rc.core.error.PoolExhaustedException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ConnectionPoolTest {

    private static final String TARGET = "https://api.example.com:443";
    private static final long IDLE_TIMEOUT = TimeUnit.SECONDS.toNanos(30);

    private final List<Connection> opened = new ArrayList<>();

    private ConnectionFactory mockFactory() {
        return target -> {
            Connection c = mock(Connection.class);
            when(c.target()).thenReturn(target);
            when(c.isAlive()).thenReturn(true);
            synchronized (opened) {
                opened.add(c);
            }
            return c;
        };
    }

    private static long in(long millis) {
        return SystemClock.instance().nowNanos() + TimeUnit.MILLISECONDS.toNanos(millis);
    }

    @Test
    void releasedConnectionIsReused() throws Exception {
        ConnectionPool pool = new ConnectionPool(mockFactory(), SystemClock.instance(), 2, IDLE_TIMEOUT);

        PooledConnection first = pool.acquire(TARGET, in(100));
        Connection underlying = first.connection();
        first.close();

        try (PooledConnection second = pool.acquire(TARGET, in(100))) {
            assertSame(underlying, second.connection());
        }
        assertEquals(1, opened.size());
        assertEquals(0, pool.leased(TARGET));
        assertEquals(1, pool.idle(TARGET));
    }

    @Test
    void releasingTwiceIsNoOp() throws Exception {
        ConnectionPool pool = new ConnectionPool(mockFactory(), SystemClock.instance(), 1, IDLE_TIMEOUT);
        PooledConnection handle = pool.acquire(TARGET, in(100));
        handle.close();
        handle.close();
        assertEquals(1, pool.idle(TARGET));
        assertThrows(IllegalStateException.class, () -> handle.send(null, null));
    }

    @Test
    void exhaustedPoolTimesOut() throws Exception {
        ConnectionPool pool = new ConnectionPool(mockFactory(), SystemClock.instance(), 1, IDLE_TIMEOUT);

        try (PooledConnection held = pool.acquire(TARGET, in(100))) {
            long start = System.nanoTime();
            assertThrows(PoolExhaustedException.class, () -> pool.acquire(TARGET, in(50)));
            assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(40));
            assertEquals(1, pool.leased(TARGET));
        }
    }

    @Test
    void targetsHaveSeparateLimits() throws Exception {
        ConnectionPool pool = new ConnectionPool(mockFactory(), SystemClock.instance(), 1, IDLE_TIMEOUT);
        try (PooledConnection a = pool.acquire(TARGET, in(100));
             PooledConnection b = pool.acquire("https://other.example.com:443", in(100))) {
            assertNotSame(a.connection(), b.connection());
        }
    }

    @Test
    void waiterGetsConnectionWhenReleased() throws Exception {
        ConnectionPool pool = new ConnectionPool(mockFactory(), SystemClock.instance(), 1, IDLE_TIMEOUT);
        PooledConnection held = pool.acquire(TARGET, in(100));
        Connection underlying = held.connection();

        ExecutorService waiter = Executors.newSingleThreadExecutor();
        try {
            CountDownLatch started = new CountDownLatch(1);
            Future<Connection> got = waiter.submit(() -> {
                started.countDown();
                try (PooledConnection c = pool.acquire(TARGET, in(5_000))) {
                    return c.connection();
                }
            });
            assertTrue(started.await(1, TimeUnit.SECONDS));
            Thread.sleep(50);
            held.close();

            assertSame(underlying, got.get(2, TimeUnit.SECONDS));
        } finally {
            waiter.shutdownNow();
        }
        assertEquals(1, opened.size());
    }

    @Test
    void deadIdleConnectionIsReplaced() throws Exception {
        ConnectionPool pool = new ConnectionPool(mockFactory(), SystemClock.instance(), 1, IDLE_TIMEOUT);
        PooledConnection first = pool.acquire(TARGET, in(100));
        Connection dead = first.connection();
        first.close();
        when(dead.isAlive()).thenReturn(false);

        try (PooledConnection second = pool.acquire(TARGET, in(100))) {
            assertNotSame(dead, second.connection());
        }
        verify(dead).close();
        assertEquals(2, opened.size());
    }

    @Test
    void connectionIdlePastTimeoutIsReplaced() throws Exception {
        ManualClock clock = new ManualClock(0);
        ConnectionPool pool = new ConnectionPool(mockFactory(), clock, 1, IDLE_TIMEOUT);

        PooledConnection first = pool.acquire(TARGET, TimeUnit.SECONDS.toNanos(1));
        Connection stale = first.connection();
        first.close();

        clock.advanceNanos(IDLE_TIMEOUT + 1);
        try (PooledConnection second = pool.acquire(TARGET, clock.nowNanos() + 1)) {
            assertNotSame(stale, second.connection());
        }
        verify(stale).close();
    }

    @Test
    void idleConnectionToAbandonedTargetIsClosedByOtherTraffic() throws Exception {
        ManualClock clock = new ManualClock(0);
        ConnectionPool pool = new ConnectionPool(mockFactory(), clock, 2, IDLE_TIMEOUT);
        String other = "https://other.example.com:443";

        PooledConnection abandoned = pool.acquire(TARGET, TimeUnit.SECONDS.toNanos(1));
        Connection stale = abandoned.connection();
        abandoned.close();
        assertEquals(1, pool.idle(TARGET));

        clock.advanceNanos(IDLE_TIMEOUT + 1);
        try (PooledConnection c = pool.acquire(other, clock.nowNanos() + 1)) {
            verify(stale).close();
            assertEquals(0, pool.idle(TARGET));
            assertEquals(1, pool.trackedTargets());
        }
    }

    @Test
    void targetWithoutConnectionsIsForgotten() throws Exception {
        ManualClock clock = new ManualClock(0);
        ConnectionPool pool = new ConnectionPool(mockFactory(), clock, 1, IDLE_TIMEOUT);

        for (int i = 0; i < 5; i++) {
            PooledConnection handle = pool.acquire("https://host-" + i + ".example.com:443", clock.nowNanos() + 1);
            handle.invalidate();
            handle.close();
        }
        assertEquals(5, pool.trackedTargets());

        clock.advanceNanos(TimeUnit.SECONDS.toNanos(1));
        try (PooledConnection c = pool.acquire(TARGET, clock.nowNanos() + 1)) {
            assertEquals(1, pool.trackedTargets());
            assertEquals(1, pool.leased(TARGET));
        }
    }

    @Test
    void invalidatedConnectionIsClosedOnRelease() throws Exception {
        ConnectionPool pool = new ConnectionPool(mockFactory(), SystemClock.instance(), 1, IDLE_TIMEOUT);
        PooledConnection handle = pool.acquire(TARGET, in(100));
        Connection broken = handle.connection();
        handle.invalidate();
        handle.close();

        verify(broken).close();
        assertEquals(0, pool.idle(TARGET));
        assertEquals(0, pool.leased(TARGET));

        // the slot is free again
        try (PooledConnection next = pool.acquire(TARGET, in(100))) {
            assertNotSame(broken, next.connection());
        }
    }

    @Test
    void failedOpenFreesTheSlot() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ConnectionFactory flaky = target -> {
            if (calls.incrementAndGet() == 1) throw new IllegalStateException("cannot open");
            return mockFactory().open(target);
        };
        ConnectionPool pool = new ConnectionPool(flaky, SystemClock.instance(), 1, IDLE_TIMEOUT);

        assertThrows(IllegalStateException.class, () -> pool.acquire(TARGET, in(100)));
        try (PooledConnection c = pool.acquire(TARGET, in(100))) {
            assertNotNull(c.connection());
        }
    }

    @Test
    void neverExceedsMaxPerHostUnderContention() throws Exception {
        int maxPerHost = 3;
        ConnectionPool pool = new ConnectionPool(mockFactory(), SystemClock.instance(), maxPerHost, IDLE_TIMEOUT);
        AtomicInteger inUse = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 20; i++) {
                    try (PooledConnection c = pool.acquire(TARGET, in(5_000))) {
                        int now = inUse.incrementAndGet();
                        peak.accumulateAndGet(now, Math::max);
                        Thread.sleep(1);
                        inUse.decrementAndGet();
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        executor.shutdown();

        assertTrue(peak.get() <= maxPerHost, "peak " + peak.get());
        assertTrue(opened.size() <= maxPerHost, "opened " + opened.size());
        assertEquals(0, pool.leased(TARGET));
    }

    @Test
    void closeClosesIdleAndRejectsAcquire() throws Exception {
        ConnectionPool pool = new ConnectionPool(mockFactory(), SystemClock.instance(), 2, IDLE_TIMEOUT);
        PooledConnection idle = pool.acquire(TARGET, in(100));
        PooledConnection leased = pool.acquire(TARGET, in(100));
        idle.close();

        pool.close();
        verify(idle.connection()).close();
        verify(leased.connection(), never()).close();

        leased.close();
        verify(leased.connection()).close();
        assertThrows(IllegalStateException.class, () -> pool.acquire(TARGET, in(100)));
    }
}
