package io.reposync.source;

import io.reposync.util.SyncContext;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Streams a {@link Source} listing through a bounded queue.
 *
 * <p>The listing runs on a producer thread taken from the supplied executor; the caller consumes
 * it as an iterator. Closing the stream cancels the stream's own context and interrupts the
 * producer, which is how an aborted pass stops a long listing. A listing that ends any other way
 * than by the producer's end marker is reported by {@link #completed()} returning false.
 */
public final class SourceStream implements Iterator<SourceResult>, AutoCloseable {
    private static final long POLL_MS = 50L;

    private final SyncContext ctx;
    private final BlockingQueue<Item> queue;
    private volatile Future<?> producer;
    private volatile boolean producerDone;
    private SourceResult pending;
    private boolean ended;
    private boolean completed;

    private SourceStream(SyncContext ctx, int capacity) {
        this.ctx = ctx;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.producerDone = false;
        this.ended = false;
        this.completed = false;
    }

    public static SourceStream open(ExecutorService executor, Source source, SyncContext parent, int capacity) {
        SourceStream stream = new SourceStream(parent.child(), capacity);
        stream.producer = executor.submit(() -> stream.produce(source));
        stream.ctx.onCancel(() -> {
            Future<?> f = stream.producer;
            if (f != null) {
                f.cancel(true);
            }
        });
        return stream;
    }

    private void produce(Source source) {
        try {
            source.listRepos(ctx, this::offer);
        } catch (RuntimeException e) {
            offer(SourceResult.failed(e));
        } catch (Throwable t) {
            offer(SourceResult.failed(new SourceException(
                    SourceException.Reason.UNAVAILABLE, "listing aborted: " + t, t)));
        } finally {
            producerDone = true;
            offerItem(new Item(null));
        }
    }

    private boolean offer(SourceResult result) {
        if (result == null) {
            return !ctx.isCancelled();
        }
        return offerItem(new Item(result));
    }

    private boolean offerItem(Item item) {
        try {
            while (!ctx.isCancelled()) {
                if (queue.offer(item, POLL_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (ended) {
            return false;
        }
        try {
            while (true) {
                if (ctx.isCancelled()) {
                    ended = true;
                    return false;
                }
                Item item = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (item == null) {
                    continue;
                }
                if (item.result() == null) {
                    ended = true;
                    completed = true;
                    return false;
                }
                pending = item.result();
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ended = true;
            return false;
        }
    }

    @Override
    public SourceResult next() {
        if (!hasNext()) {
            throw new NoSuchElementException("source stream exhausted");
        }
        SourceResult out = pending;
        pending = null;
        return out;
    }

    /**
     * Whether the listing ran to its end marker. False after cancellation, an interrupt of the
     * consuming thread, or while the stream is still being read.
     */
    public boolean completed() {
        return completed;
    }

    public boolean producerDone() {
        return producerDone;
    }

    @Override
    public void close() {
        ctx.cancel();
    }

    private record Item(SourceResult result) {
    }
}
