package com.xksgroup.playlistsync.config;

import com.xksgroup.playlistsync.parser.PlaylistParser;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ParserConfig {

    @Bean
    public PlaylistParser playlistParser(
            @Value("${playlist.sync.batch-size:" + PlaylistParser.DEFAULT_BATCH_SIZE + "}") int batchSize,
            @Value("${playlist.sync.progress-interval-ms:" + PlaylistParser.DEFAULT_PROGRESS_INTERVAL_MS + "}") long progressIntervalMs,
            @Value("${playlist.sync.max-line-length:" + PlaylistParser.DEFAULT_MAX_LINE_LENGTH + "}") int maxLineLength) {
        return new PlaylistParser(batchSize, progressIntervalMs, maxLineLength, System::currentTimeMillis);
    }
}
