package com.xksgroup.playlistsync.service.helper;

import com.xksgroup.playlistsync.exception.PlaylistFetchException;
import com.xksgroup.playlistsync.exception.SyncCancelledException;
import com.xksgroup.playlistsync.service.sync.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens playlist sources as byte streams. A failed direct request is retried once
 * through the configured proxy; cancellation aborts the in-flight call and is never retried.
 */
@Slf4j
@Service
public class PlaylistFetcher {

    public static final String DEFAULT_PROXY_TEMPLATE = "https://api.allorigins.win/raw?url={url}";

    private final OkHttpClient httpClient;
    private final String proxyTemplate;

    public PlaylistFetcher(OkHttpClient httpClient,
                           @Value("${playlist.fetch.proxy-template:" + DEFAULT_PROXY_TEMPLATE + "}") String proxyTemplate) {
        this.httpClient = httpClient;
        this.proxyTemplate = proxyTemplate;
    }

    /**
     * Fetch {@code url} and pass the body to {@code handler}. The handler may run twice
     * (direct, then proxy); the route it receives tells the attempts apart.
     *
     * @throws PlaylistFetchException  when every attempt failed
     * @throws SyncCancelledException when {@code token} was cancelled
     */
    public <T> T fetch(String url, CancellationToken token, StreamHandler<T> handler) {
        token.throwIfCancelled();

        if (url.regionMatches(true, 0, "file:", 0, 5)) {
            return readLocalFile(url, token, handler);
        }

        try {
            return execute(url, FetchRoute.DIRECT, token, handler);
        } catch (IOException | UncheckedIOException | PlaylistFetchException e) {
            if (token.isCancelled()) {
                throw new SyncCancelledException("Fetch cancelled: " + url, e);
            }
            if (proxyTemplate == null || proxyTemplate.isBlank()) {
                throw asFetchException(url, e);
            }
            log.warn("Direct fetch of {} failed ({}), retrying through proxy", url, e.getMessage());
        }

        String proxiedUrl = ProxyHelper.buildProxyUrl(proxyTemplate, url);
        try {
            return execute(proxiedUrl, FetchRoute.PROXY, token, handler);
        } catch (IOException | UncheckedIOException | PlaylistFetchException e) {
            if (token.isCancelled()) {
                throw new SyncCancelledException("Fetch cancelled: " + url, e);
            }
            log.error("Proxy fetch of {} failed: {}", url, e.getMessage());
            throw asFetchException(url, e);
        }
    }

    private <T> T execute(String url, FetchRoute route, CancellationToken token, StreamHandler<T> handler)
            throws IOException {
        Request request;
        try {
            request = new Request.Builder().url(url).get().build();
        } catch (IllegalArgumentException e) {
            throw new PlaylistFetchException("Invalid playlist URL: " + url, e);
        }

        Call call = httpClient.newCall(request);
        try (CancellationToken.Registration abort = token.onCancel(call::cancel);
             Response response = call.execute()) {
            if (!response.isSuccessful()) {
                throw new PlaylistFetchException("HTTP " + response.code() + " fetching " + url);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new PlaylistFetchException("Empty response fetching " + url);
            }
            log.info("Fetching playlist {} ({})", url, route);
            try (InputStream stream = body.byteStream()) {
                return handler.handle(stream, route);
            }
        }
    }

    private <T> T readLocalFile(String url, CancellationToken token, StreamHandler<T> handler) {
        Path path;
        try {
            path = Path.of(URI.create(url));
        } catch (IllegalArgumentException e) {
            throw new PlaylistFetchException("Invalid file URL: " + url, e);
        }

        try (InputStream stream = Files.newInputStream(path);
             CancellationToken.Registration abort = token.onCancel(() -> closeQuietly(stream))) {
            log.info("Reading playlist from {}", path);
            return handler.handle(stream, FetchRoute.LOCAL_FILE);
        } catch (IOException e) {
            if (token.isCancelled()) {
                throw new SyncCancelledException("Read cancelled: " + url, e);
            }
            throw new PlaylistFetchException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    private static PlaylistFetchException asFetchException(String url, Exception cause) {
        if (cause instanceof PlaylistFetchException) {
            return (PlaylistFetchException) cause;
        }
        return new PlaylistFetchException("Failed to fetch " + url + ": " + cause.getMessage(), cause);
    }

    private static void closeQuietly(InputStream stream) {
        try {
            stream.close();
        } catch (IOException e) {
            log.debug("Closing cancelled stream failed: {}", e.getMessage());
        }
    }
}
