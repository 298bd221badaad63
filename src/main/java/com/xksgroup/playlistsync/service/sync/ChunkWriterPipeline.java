package com.xksgroup.playlistsync.service.sync;

import com.xksgroup.playlistsync.exception.SyncCancelledException;
import com.xksgroup.playlistsync.model.PlaylistItem;
import com.xksgroup.playlistsync.parser.BatchSink;
import com.xksgroup.playlistsync.service.store.ChunkStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bounded hand-off between a parser (producer) and one writer task (consumer)
 * that stores each batch as the next chunk of an owner.
 * <p>
 * The producer blocks in {@link #accept(List)} while the queue is full, so a
 * slow store slows the parser down instead of buffering the whole source.
 * ChunkIds start at 0 and increase by one per stored batch.
 */
@Slf4j
public class ChunkWriterPipeline implements BatchSink, AutoCloseable {

    private static final long POLL_INTERVAL_MS = 50;

    // Identity marker, never stored
    private static final List<PlaylistItem> END_OF_STREAM = new ArrayList<>();

    private final ChunkStore store;
    private final String ownerId;
    private final CancellationToken token;
    private final BlockingQueue<List<PlaylistItem>> queue;
    private final AtomicReference<Throwable> writerFailure = new AtomicReference<>();
    private final CompletableFuture<Void> writer;
    private final CancellationToken.Registration cancelHook;

    private volatile boolean closed;
    private int chunksWritten;

    private ChunkWriterPipeline(ChunkStore store, String ownerId, int capacity,
                                Executor executor, CancellationToken token) {
        this.store = store;
        this.ownerId = ownerId;
        this.token = token;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.writer = CompletableFuture.runAsync(this::drain, executor);
        this.cancelHook = token.onCancel(() -> closed = true);
    }

    public static ChunkWriterPipeline start(ChunkStore store, String ownerId, int capacity,
                                            Executor executor, CancellationToken token) {
        return new ChunkWriterPipeline(store, ownerId, capacity, executor, token);
    }

    @Override
    public void accept(List<PlaylistItem> batch) {
        enqueue(batch);
    }

    /**
     * Signal end of input and wait until every queued batch is stored.
     *
     * @return number of chunks written
     */
    public int finish() {
        enqueue(END_OF_STREAM);
        awaitWriter();
        rethrowWriterFailure();
        token.throwIfCancelled();
        log.debug("Writer for {} finished after {} chunks", ownerId, chunksWritten);
        return chunksWritten;
    }

    /**
     * Stop the writer and wait for it. Safe to call after {@link #finish()}.
     * Once this returns, no further chunk is written for the owner.
     */
    @Override
    public void close() {
        closed = true;
        queue.clear();
        cancelHook.close();
        awaitWriter();
    }

    private void enqueue(List<PlaylistItem> batch) {
        try {
            while (true) {
                token.throwIfCancelled();
                rethrowWriterFailure();
                if (closed || writer.isDone()) {
                    throw new SyncCancelledException("Chunk writer closed for " + ownerId);
                }
                if (queue.offer(batch, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncCancelledException("Interrupted while queuing a batch for " + ownerId, e);
        }
    }

    private void drain() {
        int nextChunkId = 0;
        try {
            while (!closed) {
                List<PlaylistItem> batch = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (batch == null) {
                    continue;
                }
                if (batch == END_OF_STREAM) {
                    return;
                }
                token.throwIfCancelled();
                store.put(ownerId, nextChunkId++, batch);
                chunksWritten = nextChunkId;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writerFailure.compareAndSet(null, new SyncCancelledException("Chunk writer interrupted for " + ownerId, e));
        } catch (RuntimeException e) {
            writerFailure.compareAndSet(null, e);
        }
    }

    private void awaitWriter() {
        try {
            writer.join();
        } catch (CompletionException e) {
            writerFailure.compareAndSet(null, e.getCause());
        }
    }

    private void rethrowWriterFailure() {
        Throwable failure = writerFailure.get();
        if (failure == null) {
            return;
        }
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        throw new IllegalStateException("Chunk writer failed for " + ownerId, failure);
    }
}
