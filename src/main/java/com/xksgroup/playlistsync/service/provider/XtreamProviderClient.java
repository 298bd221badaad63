package com.xksgroup.playlistsync.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.xksgroup.playlistsync.exception.PlaylistFetchException;
import com.xksgroup.playlistsync.exception.ProviderAuthenticationException;
import com.xksgroup.playlistsync.exception.SyncCancelledException;
import com.xksgroup.playlistsync.model.CategorizedPlaylist;
import com.xksgroup.playlistsync.model.ContentCategory;
import com.xksgroup.playlistsync.model.PlaylistItem;
import com.xksgroup.playlistsync.model.PlaylistStats;
import com.xksgroup.playlistsync.model.ProviderCatalog;
import com.xksgroup.playlistsync.model.ProviderCredentials;
import com.xksgroup.playlistsync.service.sync.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Client of the Xtream Codes {@code player_api.php} API.
 * <p>
 * Category lists are fetched in parallel and are optional: a failed list only
 * means items fall back to the default group. Stream sections are fetched one
 * after the other; a failed section is logged and skipped, and the fetch only
 * fails when no section at all could be read.
 */
@Slf4j
@Service
public class XtreamProviderClient implements ProviderClient {

    private static final String API_PATH = "/player_api.php";
    private static final String DEFAULT_MOVIE_EXTENSION = "mp4";

    private final WebClient webClient;
    private final Duration timeout;

    public XtreamProviderClient(WebClient.Builder webClientBuilder,
                                @Value("${playlist.provider.timeout-ms:30000}") long timeoutMs,
                                @Value("${playlist.provider.max-response-bytes:67108864}") int maxResponseBytes) {
        this.webClient = webClientBuilder
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(maxResponseBytes))
                .build();
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public ProviderCatalog fetchAll(ProviderCredentials credentials, CancellationToken token) {
        token.throwIfCancelled();
        String host = credentials.getNormalizedHost();
        log.info("Fetching provider catalog from {}", host);

        CompletableFuture<JsonNode> liveCategories = request(credentials, "get_live_categories");
        CompletableFuture<JsonNode> vodCategories = request(credentials, "get_vod_categories");
        CompletableFuture<JsonNode> seriesCategories = request(credentials, "get_series_categories");

        Map<String, String> liveGroups = categoryNames(liveCategories, "get_live_categories", token);
        Map<String, String> vodGroups = categoryNames(vodCategories, "get_vod_categories", token);
        Map<String, String> seriesGroups = categoryNames(seriesCategories, "get_series_categories", token);

        CategorizedPlaylist data = new CategorizedPlaylist();
        PlaylistStats stats = new PlaylistStats();
        int failedSections = 0;

        try {
            JsonNode streams = await(request(credentials, "get_live_streams"), "get_live_streams", token);
            forEachEntry(streams, "get_live_streams", stream -> {
                String streamId = text(stream, "stream_id");
                if (streamId == null) {
                    return;
                }
                add(data, stats, PlaylistItem.builder()
                        .title(text(stream, "name"))
                        .logo(text(stream, "stream_icon"))
                        .group(groupOf(liveGroups, stream))
                        .url(streamUrl(credentials, "live", streamId + ".ts"))
                        .providerId(streamId)
                        .epgId(text(stream, "epg_channel_id"))
                        .category(ContentCategory.CHANNELS)
                        .build());
            });
        } catch (PlaylistFetchException e) {
            failedSections++;
            log.error("Error fetching live streams from {}: {}", host, e.getMessage());
        }

        try {
            JsonNode streams = await(request(credentials, "get_vod_streams"), "get_vod_streams", token);
            forEachEntry(streams, "get_vod_streams", stream -> {
                String streamId = text(stream, "stream_id");
                if (streamId == null) {
                    return;
                }
                String extension = text(stream, "container_extension");
                if (extension == null || extension.isBlank()) {
                    extension = DEFAULT_MOVIE_EXTENSION;
                }
                add(data, stats, PlaylistItem.builder()
                        .title(text(stream, "name"))
                        .logo(text(stream, "stream_icon"))
                        .group(groupOf(vodGroups, stream))
                        .url(streamUrl(credentials, "movie", streamId + "." + extension))
                        .providerId(streamId)
                        .rating(text(stream, "rating"))
                        .category(ContentCategory.MOVIES)
                        .build());
            });
        } catch (PlaylistFetchException e) {
            failedSections++;
            log.error("Error fetching vod streams from {}: {}", host, e.getMessage());
        }

        try {
            JsonNode seriesList = await(request(credentials, "get_series"), "get_series", token);
            forEachEntry(seriesList, "get_series", series -> {
                String seriesId = text(series, "series_id");
                if (seriesId == null) {
                    return;
                }
                // Series have no playable URL, the address identifies the show for the player
                add(data, stats, PlaylistItem.builder()
                        .title(text(series, "name"))
                        .logo(text(series, "cover"))
                        .group(groupOf(seriesGroups, series))
                        .url(streamUrl(credentials, "series", seriesId))
                        .providerId(seriesId)
                        .rating(text(series, "rating"))
                        .category(ContentCategory.SERIES)
                        .build());
            });
        } catch (PlaylistFetchException e) {
            failedSections++;
            log.error("Error fetching series from {}: {}", host, e.getMessage());
        }

        if (failedSections == 3) {
            throw new PlaylistFetchException("Provider " + host + " returned no stream section");
        }

        log.info("Fetched provider catalog from {} (channels={}, movies={}, series={})",
                host, stats.getChannels(), stats.getMovies(), stats.getSeries());
        return new ProviderCatalog(data, stats);
    }

    @Override
    public void authenticate(ProviderCredentials credentials) {
        JsonNode response = await(request(credentials, null), "authenticate", CancellationToken.none());
        JsonNode userInfo = response.path("user_info");

        if (userInfo.path("auth").asInt(0) != 1) {
            log.warn("Provider {} rejected credentials of user {}", credentials.getNormalizedHost(), credentials.getUsername());
            throw new ProviderAuthenticationException("Authentication failed for " + credentials.getNormalizedHost());
        }
        log.info("Authenticated user {} on {}", credentials.getUsername(), credentials.getNormalizedHost());
    }

    private CompletableFuture<JsonNode> request(ProviderCredentials credentials, String action) {
        UriComponentsBuilder builder = UriComponentsBuilder
                .fromHttpUrl(credentials.getNormalizedHost() + API_PATH)
                .queryParam("username", credentials.getUsername())
                .queryParam("password", credentials.getPassword());
        if (action != null) {
            builder.queryParam("action", action);
        }
        URI uri = builder.encode().build().toUri();

        return webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .toFuture();
    }

    private JsonNode await(CompletableFuture<JsonNode> future, String action, CancellationToken token) {
        try (CancellationToken.Registration abort = token.onCancel(() -> future.cancel(true))) {
            JsonNode body = future.get();
            return body != null ? body : MissingNode.getInstance();
        } catch (CancellationException e) {
            throw new SyncCancelledException("Provider request cancelled: " + action);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new SyncCancelledException("Interrupted during provider request: " + action, e);
        } catch (ExecutionException e) {
            token.throwIfCancelled();
            throw new PlaylistFetchException("Provider request " + action + " failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private Map<String, String> categoryNames(CompletableFuture<JsonNode> future, String action, CancellationToken token) {
        Map<String, String> names = new HashMap<>();
        try {
            JsonNode categories = await(future, action, token);
            if (categories.isArray()) {
                categories.forEach(category -> {
                    String id = text(category, "category_id");
                    String name = text(category, "category_name");
                    if (id != null && name != null) {
                        names.put(id, name);
                    }
                });
            }
        } catch (PlaylistFetchException e) {
            log.warn("Could not load {}, using default groups: {}", action, e.getMessage());
        }
        return names;
    }

    private void forEachEntry(JsonNode entries, String action, Consumer<JsonNode> consumer) {
        if (!entries.isArray()) {
            log.warn("Provider answered {} with a non-list payload, skipping", action);
            return;
        }
        entries.forEach(consumer);
    }

    private static void add(CategorizedPlaylist data, PlaylistStats stats, PlaylistItem item) {
        data.add(item);
        stats.increment(item.getCategory());
    }

    private static String groupOf(Map<String, String> groups, JsonNode entry) {
        String categoryId = text(entry, "category_id");
        return categoryId != null ? groups.getOrDefault(categoryId, PlaylistItem.DEFAULT_GROUP) : PlaylistItem.DEFAULT_GROUP;
    }

    private static String streamUrl(ProviderCredentials credentials, String kind, String resource) {
        return credentials.getNormalizedHost() + "/" + kind + "/" + credentials.getUsername()
                + "/" + credentials.getPassword() + "/" + resource;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
