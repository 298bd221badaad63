package com.xksgroup.playlistsync.service.sync;

import com.xksgroup.playlistsync.exception.SyncCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for one sync attempt. Long-running steps poll
 * {@link #throwIfCancelled()} at their suspension points; blocking I/O registers
 * an {@link #onCancel(Runnable) abort hook} so it can be interrupted immediately.
 */
@Slf4j
public class CancellationToken {

    private final String label;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public CancellationToken(String label) {
        this.label = label;
    }

    public static CancellationToken none() {
        return new CancellationToken("none");
    }

    /**
     * Signal cancellation. Returns false when the token was already cancelled.
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        log.debug("Cancellation requested for {}", label);
        for (Runnable callback : callbacks) {
            runQuietly(callback);
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new SyncCancelledException("Sync cancelled: " + label);
        }
    }

    /**
     * Register a hook run on cancellation. Runs immediately when already cancelled.
     * Closing the returned registration removes the hook.
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runQuietly(callback);
        }
        return () -> callbacks.remove(callback);
    }

    public String getLabel() {
        return label;
    }

    private void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation hook failed for {}: {}", label, e.getMessage());
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
