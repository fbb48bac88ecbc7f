package io.reposync.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class SingleFlightTest {

    @Test
    void concurrentCallersShareOneExecution() throws Exception {
        SingleFlight<String, Integer> flight = new SingleFlight<>();
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            futures.add(pool.submit(() -> flight.run("k", () -> {
                runs.incrementAndGet();
                started.countDown();
                await(release);
                return 42;
            })));
            Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));
            for (int i = 0; i < 7; i++) {
                futures.add(pool.submit(() -> flight.run("k", () -> {
                    runs.incrementAndGet();
                    return -1;
                })));
            }
            long deadline = System.currentTimeMillis() + 200L;
            while (System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            release.countDown();
            for (Future<Integer> f : futures) {
                Assertions.assertEquals(42, f.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        Assertions.assertEquals(1, runs.get());
        Assertions.assertEquals(0, flight.inFlightCount());
    }

    @Test
    void failureIsSharedAndTheKeyIsReleased() {
        SingleFlight<String, Integer> flight = new SingleFlight<>();
        IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
                () -> flight.run("k", () -> {
                    throw new IllegalStateException("boom");
                }));
        Assertions.assertEquals("boom", e.getMessage());
        Assertions.assertEquals(0, flight.inFlightCount());
        Assertions.assertEquals(7, flight.run("k", () -> 7));
    }

    @Test
    void distinctKeysRunIndependently() {
        SingleFlight<String, String> flight = new SingleFlight<>();
        String outer = flight.run("a", () -> flight.run("b", () -> "inner") + "+outer");
        Assertions.assertEquals("inner+outer", outer);
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
