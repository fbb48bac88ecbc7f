package io.reposync.sync;

import io.reposync.model.Diff;
import io.reposync.util.SyncContext;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded channel of committed diffs. Publishers block while it is full.
 */
public final class SyncedChannel {
    private static final long OFFER_WAIT_MS = 100L;
    private final BlockingQueue<Diff> queue;

    public SyncedChannel(int capacity) {
        this.queue = new LinkedBlockingQueue<>(Math.max(1, capacity));
    }

    /**
     * Blocks until the diff is queued or {@code ctx} is cancelled.
     *
     * @return false when the context was cancelled first
     */
    public boolean publish(SyncContext ctx, Diff diff) {
        try {
            while (!ctx.isCancelled()) {
                if (queue.offer(diff, OFFER_WAIT_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    /**
     * @return the next diff, or null when none arrived within the timeout
     */
    public Diff poll(long timeoutMs) throws InterruptedException {
        return queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public List<Diff> drain() {
        List<Diff> out = new ArrayList<>();
        queue.drainTo(out);
        return out;
    }

    public int size() {
        return queue.size();
    }
}
