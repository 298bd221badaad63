package com.xksgroup.playlistsync;

import com.xksgroup.playlistsync.service.store.ChunkStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class PlaylistSyncApplicationTest {

    @Container
    @ServiceConnection
    static MongoDBContainer mongo = new MongoDBContainer("mongo:7.0");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ChunkStore chunkStore;

    @Test
    void healthReportsMongo() throws Exception {
        mockMvc.perform(get("/playlist-sync/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.mongoReachable").value(true));
    }

    @Test
    void importedPlaylistShowsUpInAggregatedContent() throws Exception {
        mockMvc.perform(post("/playlist-sync/api/v1/resources").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"res-it\",\"name\":\"Imported\",\"url\":\"http://host/list.m3u\"}"))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/playlist-sync/api/v1/resources/res-it/import")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("#EXTM3U\n#EXTINF:-1 group-title=\"Films\",Movie\nhttp://host/movie/u/p/1.mp4\n"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SYNCED"))
                .andExpect(jsonPath("$.stats.movies").value(1));

        mockMvc.perform(get("/playlist-sync/api/v1/content/movies/groups/Films"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].title").value("Movie"))
                .andExpect(jsonPath("$[0].source").value("Imported"));

        assertThat(chunkStore.countChunks("res-it")).isEqualTo(1);
        assertThat(chunkStore.getAll(ChunkStore.tempOwnerId("res-it"))).isEmpty();

        mockMvc.perform(post("/playlist-sync/api/v1/resources/res-it/import")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("#EXTM3U\n"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stats.movies").value(0));
        mockMvc.perform(get("/playlist-sync/api/v1/content/movies/groups/Films"))
                .andExpect(status().isOk())
                .andExpect(content().json("[]"));
    }
}
