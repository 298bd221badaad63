package com.xksgroup.playlistsync.config;

import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    /**
     * Client for playlist downloads. The call timeout bounds a whole download,
     * read timeouts only catch a stalled connection.
     */
    @Bean
    public OkHttpClient playlistHttpClient(
            @Value("${playlist.fetch.connect-timeout-ms:15000}") long connectTimeoutMs,
            @Value("${playlist.fetch.read-timeout-ms:60000}") long readTimeoutMs,
            @Value("${playlist.fetch.call-timeout-ms:300000}") long callTimeoutMs) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .readTimeout(Duration.ofMillis(readTimeoutMs))
                .callTimeout(Duration.ofMillis(callTimeoutMs))
                .followRedirects(true)
                .retryOnConnectionFailure(false)
                .build();
    }
}
