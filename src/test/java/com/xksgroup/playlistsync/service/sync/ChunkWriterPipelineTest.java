package com.xksgroup.playlistsync.service.sync;

import com.xksgroup.playlistsync.exception.ChunkStoreException;
import com.xksgroup.playlistsync.exception.SyncCancelledException;
import com.xksgroup.playlistsync.model.PlaylistItem;
import com.xksgroup.playlistsync.service.store.InMemoryChunkStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkWriterPipelineTest {

    private static final String OWNER = "temp_res-1";

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final InMemoryChunkStore store = new InMemoryChunkStore();

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void storesBatchesAsConsecutiveChunks() {
        CancellationToken token = new CancellationToken("test");
        int written;
        try (ChunkWriterPipeline pipeline = ChunkWriterPipeline.start(store, OWNER, 1, executor, token)) {
            pipeline.accept(batch("a", "b"));
            pipeline.accept(batch("c"));
            pipeline.accept(batch("d", "e"));
            written = pipeline.finish();
        }

        assertThat(written).isEqualTo(3);
        assertThat(store.chunkIds(OWNER)).containsExactly(0, 1, 2);
        assertThat(store.getAll(OWNER)).get()
                .extracting(playlist -> playlist.flatten().size()).isEqualTo(5);
    }

    @Test
    void finishWithoutBatchesWritesNothing() {
        try (ChunkWriterPipeline pipeline = ChunkWriterPipeline.start(store, OWNER, 1, executor,
                new CancellationToken("test"))) {
            assertThat(pipeline.finish()).isZero();
        }
        assertThat(store.countChunks(OWNER)).isZero();
    }

    @Test
    void producerBlocksWhileStoreIsSlow() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        store.onPut((owner, chunkId) -> awaitQuietly(release));
        CancellationToken token = new CancellationToken("test");
        AtomicBoolean producerDone = new AtomicBoolean();

        try (ChunkWriterPipeline pipeline = ChunkWriterPipeline.start(store, OWNER, 1, executor, token)) {
            Thread producer = new Thread(() -> {
                // First batch is taken by the blocked writer, second fills the queue, third waits
                pipeline.accept(batch("a"));
                pipeline.accept(batch("b"));
                pipeline.accept(batch("c"));
                producerDone.set(true);
            });
            producer.start();

            Thread.sleep(300);
            assertThat(producerDone).isFalse();

            release.countDown();
            producer.join(5000);
            assertThat(producerDone).isTrue();
            assertThat(pipeline.finish()).isEqualTo(3);
        }
    }

    @Test
    void storeFailureSurfacesToProducer() {
        store.onPut((owner, chunkId) -> {
            throw new ChunkStoreException("disk full", new IllegalStateException());
        });
        CancellationToken token = new CancellationToken("test");

        try (ChunkWriterPipeline pipeline = ChunkWriterPipeline.start(store, OWNER, 1, executor, token)) {
            pipeline.accept(batch("a"));
            assertThatThrownBy(() -> {
                for (int i = 0; i < 100; i++) {
                    pipeline.accept(batch("x" + i));
                }
                pipeline.finish();
            }).isInstanceOf(ChunkStoreException.class).hasMessageContaining("disk full");
        }
    }

    @Test
    void cancellationStopsWritesAfterClose() {
        CancellationToken token = new CancellationToken("test");
        store.onPut((owner, chunkId) -> {
            if (chunkId == 0) {
                token.cancel();
            }
        });

        try (ChunkWriterPipeline pipeline = ChunkWriterPipeline.start(store, OWNER, 1, executor, token)) {
            pipeline.accept(batch("a"));
            assertThatThrownBy(() -> {
                for (int i = 0; i < 100; i++) {
                    pipeline.accept(batch("x" + i));
                }
                pipeline.finish();
            }).isInstanceOf(SyncCancelledException.class);
        }

        long afterClose = store.countChunks(OWNER);
        assertThat(afterClose).isLessThanOrEqualTo(1);
        store.deleteAll(OWNER);
        assertThat(store.countChunks(OWNER)).isZero();
    }

    @Test
    void acceptOnCancelledTokenFailsImmediately() {
        CancellationToken token = new CancellationToken("test");
        token.cancel();

        try (ChunkWriterPipeline pipeline = ChunkWriterPipeline.start(store, OWNER, 1, executor, token)) {
            assertThatThrownBy(() -> pipeline.accept(batch("a"))).isInstanceOf(SyncCancelledException.class);
        }
        assertThat(store.countChunks(OWNER)).isZero();
    }

    private static List<PlaylistItem> batch(String... titles) {
        return Arrays.stream(titles)
                .map(title -> PlaylistItem.builder().title(title).url("http://host/live/" + title + ".ts").build())
                .collect(Collectors.toList());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
