package com.xksgroup.playlistsync.parser;

import com.xksgroup.playlistsync.exception.SyncCancelledException;
import com.xksgroup.playlistsync.model.ContentCategory;
import com.xksgroup.playlistsync.model.PlaylistItem;
import com.xksgroup.playlistsync.model.PlaylistStats;
import com.xksgroup.playlistsync.service.sync.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Streaming M3U/M3U8 parser.
 * <p>
 * Lines are fed through a small state machine: an {@code #EXTINF:} line fills the
 * pending item, any other {@code #} directive is skipped, and the next plain line
 * is the URL that completes the pending item. Completed items are categorized and
 * collected into batches of {@code batchSize}; every full batch is handed to the
 * {@link BatchSink} before another byte is read, so memory stays bounded by one
 * batch whatever the size of the source.
 * <p>
 * {@link #parseStream} and {@link #parseText} share the same line handling and
 * produce identical batches and stats for the same input.
 * <p>
 * Instances are stateless and may be shared between threads.
 */
@Slf4j
public class PlaylistParser {

    public static final int DEFAULT_BATCH_SIZE = 2000;
    public static final long DEFAULT_PROGRESS_INTERVAL_MS = 100;
    public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024;

    private static final String METADATA_MARKER = "#EXTINF:";
    private static final String DIRECTIVE_MARKER = "#";
    private static final int READ_BUFFER_CHARS = 8192;

    private final int batchSize;
    private final long progressIntervalMillis;
    private final int maxLineLength;
    private final LongSupplier clock;

    public PlaylistParser() {
        this(DEFAULT_BATCH_SIZE, DEFAULT_PROGRESS_INTERVAL_MS);
    }

    public PlaylistParser(int batchSize, long progressIntervalMillis) {
        this(batchSize, progressIntervalMillis, DEFAULT_MAX_LINE_LENGTH, System::currentTimeMillis);
    }

    public PlaylistParser(int batchSize, long progressIntervalMillis, int maxLineLength, LongSupplier clock) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.batchSize = batchSize;
        this.progressIntervalMillis = progressIntervalMillis;
        this.maxLineLength = maxLineLength;
        this.clock = clock;
    }

    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Decode and parse a UTF-8 byte stream incrementally. A partial line at the
     * end of one read is carried over to the next.
     *
     * @return the final stats; the same copy is also passed to {@code progress} once more
     * @throws SyncCancelledException when {@code token} is cancelled before or during a read
     */
    public PlaylistStats parseStream(InputStream input, BatchSink sink, ProgressListener progress,
                                     CancellationToken token) throws IOException {
        ParseSession session = new ParseSession(sink);
        Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8);
        char[] buffer = new char[READ_BUFFER_CHARS];
        StringBuilder partialLine = new StringBuilder();
        boolean skippingOverlongLine = false;
        long lastProgressAt = -1;

        while (true) {
            token.throwIfCancelled();

            int read;
            try {
                read = reader.read(buffer);
            } catch (IOException e) {
                if (token.isCancelled()) {
                    throw new SyncCancelledException("Sync cancelled while reading: " + token.getLabel(), e);
                }
                throw e;
            }
            if (read == -1) {
                break;
            }

            int lineStart = 0;
            for (int i = 0; i < read; i++) {
                if (buffer[i] != '\n') {
                    continue;
                }
                if (!skippingOverlongLine) {
                    partialLine.append(buffer, lineStart, i - lineStart);
                    if (partialLine.length() <= maxLineLength) {
                        session.acceptLine(partialLine);
                    } else {
                        log.warn("Dropping playlist line longer than {} characters", maxLineLength);
                    }
                }
                partialLine.setLength(0);
                skippingOverlongLine = false;
                lineStart = i + 1;
            }
            if (!skippingOverlongLine) {
                partialLine.append(buffer, lineStart, read - lineStart);
                if (partialLine.length() > maxLineLength) {
                    log.warn("Dropping playlist line longer than {} characters", maxLineLength);
                    partialLine.setLength(0);
                    skippingOverlongLine = true;
                }
            }

            long now = clock.getAsLong();
            if (lastProgressAt < 0 || now - lastProgressAt >= progressIntervalMillis) {
                progress.onProgress(session.stats.copy());
                lastProgressAt = now;
            }
        }

        if (!skippingOverlongLine && partialLine.length() > 0) {
            session.acceptLine(partialLine);
        }
        return session.finish(progress);
    }

    /**
     * Parse input that is already fully in memory.
     */
    public PlaylistStats parseText(String text, BatchSink sink, ProgressListener progress) {
        ParseSession session = new ParseSession(sink);
        int lineStart = 0;
        int length = text.length();
        while (lineStart <= length) {
            int newline = text.indexOf('\n', lineStart);
            int lineEnd = newline == -1 ? length : newline;
            if (lineEnd - lineStart <= maxLineLength) {
                session.acceptLine(text.substring(lineStart, lineEnd));
            } else {
                log.warn("Dropping playlist line longer than {} characters", maxLineLength);
            }
            if (newline == -1) {
                break;
            }
            lineStart = newline + 1;
        }
        return session.finish(progress);
    }

    /**
     * Parse state for one pass over one input.
     */
    private final class ParseSession {

        private final BatchSink sink;
        private final PlaylistStats stats = new PlaylistStats();
        private List<PlaylistItem> batch = new ArrayList<>();

        // Metadata collected since the last completed item, null when none
        private PendingItem pending;
        private int batchesFlushed;

        ParseSession(BatchSink sink) {
            this.sink = sink;
        }

        void acceptLine(CharSequence rawLine) {
            String line = rawLine.toString().trim();
            if (line.isEmpty()) {
                return;
            }

            if (line.startsWith(METADATA_MARKER)) {
                if (pending == null) {
                    pending = new PendingItem();
                }
                pending.merge(ExtinfMetadataExtractor.extract(line));
            } else if (line.startsWith(DIRECTIVE_MARKER)) {
                // #EXTM3U, #EXTGRP, #EXTVLCOPT, ...
                return;
            } else if (pending != null && pending.hasTitle()) {
                complete(pending, line);
                pending = null;
            }
            // A URL without a preceding title is dropped
        }

        private void complete(PendingItem metadata, String url) {
            ContentCategory category = ContentCategorizer.categorize(url);
            PlaylistItem item = PlaylistItem.builder()
                    .title(metadata.title)
                    .url(url)
                    .logo(metadata.logo)
                    .group(metadata.group)
                    .providerId(metadata.id)
                    .category(category)
                    .build();
            stats.increment(category);
            batch.add(item);

            if (batch.size() >= batchSize) {
                flush();
            }
        }

        private void flush() {
            List<PlaylistItem> full = Collections.unmodifiableList(batch);
            batch = new ArrayList<>();
            batchesFlushed++;
            sink.accept(full);
        }

        PlaylistStats finish(ProgressListener progress) {
            if (!batch.isEmpty()) {
                flush();
            }
            PlaylistStats result = stats.copy();
            progress.onProgress(result.copy());
            log.debug("Parsed {} items in {} batches (channels={}, movies={}, series={})",
                    result.total(), batchesFlushed, result.getChannels(), result.getMovies(), result.getSeries());
            return result;
        }
    }

    private static final class PendingItem {
        private String title;
        private String logo;
        private String group;
        private String id;

        void merge(ExtinfMetadata metadata) {
            title = metadata.title();
            group = metadata.group();
            if (metadata.logo() != null) {
                logo = metadata.logo();
            }
            if (metadata.id() != null) {
                id = metadata.id();
            }
        }

        boolean hasTitle() {
            return title != null && !title.isEmpty();
        }
    }
}
