package com.xksgroup.playlistsync.service.sync;

import com.xksgroup.playlistsync.exception.SyncCancelledException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One sync attempt of one resource: its cancellation token and a latch that
 * completes once the attempt has fully settled (cleanup included).
 * <p>
 * Attempts form a chain. An attempt never counts as settled before the attempt it
 * superseded, so waiting on the newest attempt covers every older one.
 */
@Slf4j
@Getter
public class SyncSession {

    private final String resourceId;
    private final CancellationToken token;
    private final CompletableFuture<Void> settled = new CompletableFuture<>();

    // Superseded attempt this one must wait for, released once it settled
    private volatile SyncSession previous;

    public SyncSession(String resourceId, SyncSession previous) {
        this.resourceId = resourceId;
        this.token = new CancellationToken(resourceId);
        this.previous = previous;
    }

    /**
     * Block until the superseded attempt has settled. Gives up as soon as this
     * attempt is itself cancelled, in which case it keeps its predecessor and
     * settles after it.
     */
    public void awaitPrevious(long pollTimeoutMs) {
        SyncSession superseded = previous;
        if (superseded == null) {
            return;
        }
        CompletableFuture<Void> cancelled = new CompletableFuture<>();
        try (CancellationToken.Registration ignored = token.onCancel(() -> cancelled.complete(null))) {
            CompletableFuture<Object> either = CompletableFuture.anyOf(superseded.settled, cancelled);
            while (!await(either, pollTimeoutMs)) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new SyncCancelledException("Interrupted while waiting for the previous sync of " + resourceId);
                }
                log.warn("Still waiting for the previous sync of {} to stop", resourceId);
            }
        }
        if (superseded.settled.isDone()) {
            previous = null;
        }
        token.throwIfCancelled();
    }

    /**
     * True once no older attempt can still write to the store, i.e. the superseded
     * attempt has settled or there never was one.
     */
    public boolean ownsStore() {
        return previous == null;
    }

    /**
     * Complete the latch, or chain it onto the superseded attempt when this one
     * gave up waiting for it.
     */
    public void markSettled() {
        SyncSession superseded = previous;
        if (superseded == null) {
            settled.complete(null);
            return;
        }
        log.debug("Sync of {} ended before its predecessor, settling once it does", resourceId);
        superseded.settled.whenComplete((ignored, failure) -> settled.complete(null));
    }

    /**
     * @return false when the attempt did not settle within the timeout
     */
    public boolean awaitSettled(long timeoutMs) {
        return await(settled, timeoutMs);
    }

    private static boolean await(CompletableFuture<?> future, long timeoutMs) {
        try {
            future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException e) {
            return false;
        }
    }
}
