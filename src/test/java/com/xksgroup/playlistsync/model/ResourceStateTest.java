package com.xksgroup.playlistsync.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.xksgroup.playlistsync.service.sync.CancellationToken;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceStateTest {

    @Test
    void serializedStateOmitsViewAndToken() throws Exception {
        ResourceState state = new ResourceState("res-1");
        state.markSyncing(new CancellationToken("res-1"));
        state.setPlaylist(CategorizedPlaylist.empty());

        JsonNode json = new ObjectMapper().registerModule(new JavaTimeModule()).valueToTree(state.snapshot());

        assertThat(json.get("resourceId").asText()).isEqualTo("res-1");
        assertThat(json.get("status").asText()).isEqualTo("SYNCING");
        assertThat(json.get("loading").asBoolean()).isTrue();
        assertThat(json.has("playlist")).isFalse();
        assertThat(json.has("cancellationToken")).isFalse();
    }

    @Test
    void clearInFlightKeepsTokenOfAnotherFlow() {
        ResourceState state = new ResourceState("res-1");
        CancellationToken current = new CancellationToken("current");
        state.markSyncing(current);

        state.clearInFlight(new CancellationToken("older"));

        assertThat(state.getCancellationToken()).isSameAs(current);
        assertThat(state.isLoading()).isFalse();
        assertThat(state.getProgress()).isNull();
    }

    @Test
    void viewPublishedByOneThreadIsSeenByAnother() throws Exception {
        ResourceState state = new ResourceState("res-1");
        CategorizedPlaylist committed = CategorizedPlaylist.empty();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(() -> state.markSynced(committed)).get(1, TimeUnit.SECONDS);
            Future<CategorizedPlaylist> seen = executor.submit(state::getPlaylist);

            assertThat(seen.get(1, TimeUnit.SECONDS)).isSameAs(committed);
            assertThat(state.getStatus()).isEqualTo(SyncStatus.SYNCED);
            assertThat(state.getLastError()).isNull();
        } finally {
            executor.shutdownNow();
        }
    }
}
