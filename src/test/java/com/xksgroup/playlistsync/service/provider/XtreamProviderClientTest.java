package com.xksgroup.playlistsync.service.provider;

import com.xksgroup.playlistsync.exception.PlaylistFetchException;
import com.xksgroup.playlistsync.exception.ProviderAuthenticationException;
import com.xksgroup.playlistsync.exception.SyncCancelledException;
import com.xksgroup.playlistsync.model.ContentCategory;
import com.xksgroup.playlistsync.model.PlaylistItem;
import com.xksgroup.playlistsync.model.PlaylistStats;
import com.xksgroup.playlistsync.model.ProviderCatalog;
import com.xksgroup.playlistsync.model.ProviderCredentials;
import com.xksgroup.playlistsync.service.sync.CancellationToken;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XtreamProviderClientTest {

    private MockWebServer server;
    private XtreamProviderClient client;
    private ProviderCredentials credentials;
    private final Map<String, String> answers = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String action = request.getRequestUrl().queryParameter("action");
                String body = answers.get(action == null ? "" : action);
                if (body == null) {
                    return new MockResponse().setResponseCode(500);
                }
                return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
            }
        });
        server.start();
        client = new XtreamProviderClient(WebClient.builder(), 5000, 1024 * 1024);
        credentials = ProviderCredentials.builder()
                .host(server.url("/").toString())
                .username("user")
                .password("secret")
                .build();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void buildsCatalogFromAllSections() {
        answers.put("get_live_categories", "[{\"category_id\":\"1\",\"category_name\":\"News\"}]");
        answers.put("get_vod_categories", "[{\"category_id\":\"2\",\"category_name\":\"Action\"}]");
        answers.put("get_series_categories", "[{\"category_id\":\"3\",\"category_name\":\"Drama\"}]");
        answers.put("get_live_streams", "[{\"stream_id\":10,\"name\":\"News 24\",\"stream_icon\":\"http://logo\","
                + "\"category_id\":\"1\",\"epg_channel_id\":\"news.fr\"},"
                + "{\"stream_id\":11,\"name\":\"Loose\",\"category_id\":\"99\"}]");
        answers.put("get_vod_streams", "[{\"stream_id\":20,\"name\":\"Film\",\"category_id\":\"2\","
                + "\"container_extension\":\"mkv\",\"rating\":\"7.5\"},"
                + "{\"stream_id\":21,\"name\":\"No Ext\",\"category_id\":\"2\"}]");
        answers.put("get_series", "[{\"series_id\":30,\"name\":\"Saga\",\"cover\":\"http://cover\",\"category_id\":\"3\"}]");

        ProviderCatalog catalog = client.fetchAll(credentials, new CancellationToken("t"));

        assertThat(catalog.stats()).isEqualTo(new PlaylistStats(2, 2, 1));
        String base = credentials.getNormalizedHost();

        PlaylistItem news = catalog.data().items(ContentCategory.CHANNELS, "News").get(0);
        assertThat(news.getTitle()).isEqualTo("News 24");
        assertThat(news.getUrl()).isEqualTo(base + "/live/user/secret/10.ts");
        assertThat(news.getEpgId()).isEqualTo("news.fr");
        assertThat(news.getLogo()).isEqualTo("http://logo");
        assertThat(catalog.data().items(ContentCategory.CHANNELS, PlaylistItem.DEFAULT_GROUP))
                .extracting(PlaylistItem::getTitle).containsExactly("Loose");

        List<PlaylistItem> movies = catalog.data().items(ContentCategory.MOVIES, "Action");
        assertThat(movies).extracting(PlaylistItem::getUrl)
                .containsExactly(base + "/movie/user/secret/20.mkv", base + "/movie/user/secret/21.mp4");
        assertThat(movies.get(0).getRating()).isEqualTo("7.5");

        PlaylistItem saga = catalog.data().items(ContentCategory.SERIES, "Drama").get(0);
        assertThat(saga.getProviderId()).isEqualTo("30");
        assertThat(saga.getLogo()).isEqualTo("http://cover");
        assertThat(saga.getUrl()).isEqualTo(base + "/series/user/secret/30");
    }

    @Test
    void missingCategoriesFallBackToDefaultGroup() {
        answers.put("get_live_streams", "[{\"stream_id\":1,\"name\":\"A\",\"category_id\":\"5\"}]");
        answers.put("get_vod_streams", "[]");
        answers.put("get_series", "[]");

        ProviderCatalog catalog = client.fetchAll(credentials, new CancellationToken("t"));

        assertThat(catalog.data().groups(ContentCategory.CHANNELS).keySet()).containsExactly(PlaylistItem.DEFAULT_GROUP);
    }

    @Test
    void failedSectionIsSkipped() {
        answers.put("get_vod_streams", "[{\"stream_id\":20,\"name\":\"Film\"}]");
        answers.put("get_series", "{\"error\":\"not a list\"}");

        ProviderCatalog catalog = client.fetchAll(credentials, new CancellationToken("t"));

        assertThat(catalog.stats()).isEqualTo(new PlaylistStats(0, 1, 0));
    }

    @Test
    void failsWhenNoSectionCanBeFetched() {
        assertThatThrownBy(() -> client.fetchAll(credentials, new CancellationToken("t")))
                .isInstanceOf(PlaylistFetchException.class);
    }

    @Test
    void cancelledTokenStopsBeforeAnyRequest() {
        CancellationToken token = new CancellationToken("t");
        token.cancel();

        assertThatThrownBy(() -> client.fetchAll(credentials, token)).isInstanceOf(SyncCancelledException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void authenticateAcceptsAuthorizedUser() throws InterruptedException {
        answers.put("", "{\"user_info\":{\"auth\":1,\"status\":\"Active\"}}");

        client.authenticate(credentials);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/player_api.php");
        assertThat(request.getRequestUrl().queryParameter("username")).isEqualTo("user");
        assertThat(request.getRequestUrl().queryParameter("password")).isEqualTo("secret");
    }

    @Test
    void authenticateRejectsUnauthorizedUser() {
        answers.put("", "{\"user_info\":{\"auth\":0}}");

        assertThatThrownBy(() -> client.authenticate(credentials))
                .isInstanceOf(ProviderAuthenticationException.class);
    }
}
