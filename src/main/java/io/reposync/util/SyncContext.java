package io.reposync.util;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Cancellation scope handed to every sync operation.
 *
 * <p>A context is cancelled when {@link #cancel()} was called on it or on any ancestor, or when
 * its deadline has passed. Callbacks registered with {@link #onCancel(Runnable)} run on the
 * thread that cancels and must be idempotent. Deadlines are only observed by polling.
 */
public final class SyncContext {
    private final SyncContext parent;
    private final Clock clock;
    private final long deadlineMs;
    private final List<Runnable> callbacks;
    private final List<SyncContext> children;
    private volatile boolean cancelled;

    private SyncContext(SyncContext parent, Clock clock, long deadlineMs) {
        this.parent = parent;
        this.clock = clock;
        this.deadlineMs = deadlineMs;
        this.callbacks = new CopyOnWriteArrayList<>();
        this.children = new CopyOnWriteArrayList<>();
        this.cancelled = false;
    }

    public static SyncContext background() {
        return background(Clock.systemUTC());
    }

    public static SyncContext background(Clock clock) {
        return new SyncContext(null, clock, Long.MAX_VALUE);
    }

    public SyncContext child() {
        SyncContext c = new SyncContext(this, clock, deadlineMs);
        children.add(c);
        if (isCancelled()) {
            c.cancel();
        }
        return c;
    }

    public SyncContext withTimeout(Duration timeout) {
        long deadline = clock.millis() + Math.max(0L, timeout.toMillis());
        SyncContext c = new SyncContext(this, clock, Math.min(deadlineMs, deadline));
        children.add(c);
        if (isCancelled()) {
            c.cancel();
        }
        return c;
    }

    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        for (SyncContext c : children) {
            c.cancel();
        }
        for (Runnable callback : callbacks) {
            callback.run();
        }
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    public boolean isCancelled() {
        if (cancelled) {
            return true;
        }
        if (deadlineMs != Long.MAX_VALUE && clock.millis() >= deadlineMs) {
            return true;
        }
        return parent != null && parent.isCancelled();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("sync context cancelled");
        }
    }

    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled) {
            callback.run();
        }
    }
}
