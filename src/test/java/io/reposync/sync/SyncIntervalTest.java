package io.reposync.sync;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SyncIntervalTest {
    private static final long MIN = 60_000L;
    private static final long NOW = 1_700_000_000_000L;

    @Test
    void neverSyncedServiceUsesTheMinimum() {
        Assertions.assertEquals(MIN, SyncInterval.next(NOW, 0L, MIN, false, true));
    }

    @Test
    void changedPassWithoutErrorsResetsToTheMinimum() {
        Assertions.assertEquals(MIN, SyncInterval.next(NOW, NOW - 3_600_000L, MIN, true, false));
    }

    @Test
    void changedButErroredPassBacksOff() {
        long elapsed = 30 * 60_000L;
        Assertions.assertEquals(2 * elapsed, SyncInterval.next(NOW, NOW - elapsed, MIN, true, true));
        Assertions.assertEquals(MIN, SyncInterval.next(NOW, NOW - elapsed, MIN, true, false));
    }

    @Test
    void quietOrFailingPassesDoubleTheElapsedTime() {
        Assertions.assertEquals(20 * 60_000L, SyncInterval.next(NOW, NOW - 10 * 60_000L, MIN, false, false));
        Assertions.assertEquals(20 * 60_000L, SyncInterval.next(NOW, NOW - 10 * 60_000L, MIN, true, true));
    }

    @Test
    void intervalIsClampedBetweenMinimumAndEightHours() {
        Assertions.assertEquals(MIN, SyncInterval.next(NOW, NOW - 1_000L, MIN, false, false));
        Assertions.assertEquals(SyncInterval.MAX_INTERVAL_MS, SyncInterval.next(NOW, NOW - 5 * 3_600_000L, MIN, false, false));
        Assertions.assertEquals(SyncInterval.MAX_INTERVAL_MS, SyncInterval.next(NOW, 1L, MIN, false, false));
        Assertions.assertEquals(SyncInterval.MAX_INTERVAL_MS,
                SyncInterval.next(NOW, NOW - 1_000L, 24 * 3_600_000L, false, false));
    }
}
