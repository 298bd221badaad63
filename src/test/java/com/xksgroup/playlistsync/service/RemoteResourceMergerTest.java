package com.xksgroup.playlistsync.service;

import com.xksgroup.playlistsync.model.PlaylistResource;
import com.xksgroup.playlistsync.model.ProviderCredentials;
import com.xksgroup.playlistsync.model.ResourceType;
import com.xksgroup.playlistsync.model.dto.ResourceRequest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteResourceMergerTest {

    private final RemoteResourceMerger merger = new RemoteResourceMerger();

    private final PlaylistResource news = local("res-1", "News", "http://a/news.m3u");
    private final PlaylistResource films = local("res-2", "Films", "http://a/films.m3u");

    @Test
    void unknownEntriesAreAddedOnce() {
        ResourceRequest fresh = remote(null, "Sports", "http://a/sports.m3u");

        RemoteResourceMerger.MergePlan plan = merger.plan(List.of(news), List.of(fresh, fresh), RemoteMergePolicy.MERGE);

        assertThat(plan.additions()).containsExactly(fresh);
        assertThat(plan.updates()).isEmpty();
        assertThat(plan.removals()).isEmpty();
    }

    @Test
    void matchByIdWithNewUrlIsAnUpdate() {
        ResourceRequest moved = remote("res-1", "News", "http://b/news.m3u");

        RemoteResourceMerger.MergePlan plan = merger.plan(List.of(news), List.of(moved), RemoteMergePolicy.MERGE);

        assertThat(plan.additions()).isEmpty();
        assertThat(plan.updates()).singleElement().satisfies(update -> {
            assertThat(update.local()).isSameAs(news);
            assertThat(update.remote()).isSameAs(moved);
        });
    }

    @Test
    void matchByUrlAndNameWithoutChangeIsNoop() {
        ResourceRequest same = remote("other-id", "News", "http://a/news.m3u");

        RemoteResourceMerger.MergePlan plan = merger.plan(List.of(news), List.of(same), RemoteMergePolicy.MERGE);

        assertThat(plan.isEmpty()).isTrue();
    }

    @Test
    void changedCredentialsAreAnUpdate() {
        PlaylistResource provider = local("res-3", "Provider", "http://p");
        provider.setType(ResourceType.XTREAM);
        provider.setCredentials(ProviderCredentials.builder().host("http://p").username("u").password("old").build());
        ResourceRequest rotated = remote("res-3", "Provider", "http://p");
        rotated.setType(ResourceType.XTREAM);
        rotated.setCredentials(ProviderCredentials.builder().host("http://p").username("u").password("new").build());

        RemoteResourceMerger.MergePlan plan = merger.plan(List.of(provider), List.of(rotated), RemoteMergePolicy.MERGE);

        assertThat(plan.updates()).hasSize(1);
    }

    @Test
    void mergeKeepsLocalOnlyResources() {
        RemoteResourceMerger.MergePlan plan = merger.plan(List.of(news, films),
                List.of(remote("res-1", "News", "http://a/news.m3u")), RemoteMergePolicy.MERGE);

        assertThat(plan.removals()).isEmpty();
    }

    @Test
    void replaceRemovesLocalOnlyResources() {
        RemoteResourceMerger.MergePlan plan = merger.plan(List.of(news, films),
                List.of(remote("res-1", "News", "http://a/news.m3u")), RemoteMergePolicy.REPLACE);

        assertThat(plan.removals()).containsExactly(films);
    }

    private static PlaylistResource local(String id, String name, String url) {
        return PlaylistResource.builder().id(id).name(name).url(url).type(ResourceType.M3U).build();
    }

    private static ResourceRequest remote(String id, String name, String url) {
        return ResourceRequest.builder().id(id).name(name).url(url).build();
    }
}
