package com.xksgroup.playlistsync.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CategorizedPlaylistTest {

    @Test
    void chunksAppendToTheirGroupsInOrder() {
        CategorizedPlaylist playlist = new CategorizedPlaylist();
        playlist.addChunk(chunk(0, item("A", "News", ContentCategory.CHANNELS), item("B", "Sport", ContentCategory.CHANNELS)));
        playlist.addChunk(chunk(1, item("C", "News", ContentCategory.CHANNELS)));
        playlist.addChunk(PlaylistChunk.builder().ownerId("res-1").chunkId(2).build());

        assertThat(playlist.flatten()).extracting(PlaylistItem::getTitle).containsExactly("A", "C", "B");
        assertThat(playlist.groups(ContentCategory.CHANNELS).keySet()).containsExactly("News", "Sport");
    }

    @Test
    void countsItemsPerCategory() {
        CategorizedPlaylist playlist = new CategorizedPlaylist();
        playlist.add(item("A", "G", ContentCategory.CHANNELS));
        playlist.add(item("B", "G", ContentCategory.MOVIES));
        playlist.add(item("C", "G", ContentCategory.MOVIES));

        assertThat(playlist.stats()).isEqualTo(new PlaylistStats(1, 2, 0));
        assertThat(playlist.size()).isEqualTo(3);
        assertThat(playlist.isEmpty()).isFalse();
    }

    @Test
    void itemsWithoutCategoryOrGroupUseDefaults() {
        CategorizedPlaylist playlist = new CategorizedPlaylist();
        playlist.add(PlaylistItem.builder().title("X").url("http://x").group(null).build());

        assertThat(playlist.items(ContentCategory.CHANNELS, PlaylistItem.DEFAULT_GROUP))
                .extracting(PlaylistItem::getTitle).containsExactly("X");
    }

    @Test
    void addAllAppliesMapper() {
        CategorizedPlaylist source = new CategorizedPlaylist();
        source.add(item("A", "G", ContentCategory.SERIES));
        CategorizedPlaylist target = new CategorizedPlaylist();

        target.addAll(source, item -> item.toBuilder().source("Provider").build());

        assertThat(target.items(ContentCategory.SERIES, "G")).singleElement()
                .extracting(PlaylistItem::getSource).isEqualTo("Provider");
    }

    @Test
    void unknownGroupYieldsEmptyList() {
        assertThat(CategorizedPlaylist.empty().items(ContentCategory.MOVIES, "nope")).isEmpty();
        assertThat(CategorizedPlaylist.empty().isEmpty()).isTrue();
    }

    @Test
    void mapViewIsKeyedByCategoryKey() {
        assertThat(CategorizedPlaylist.empty().asMap().keySet()).containsExactly("channels", "movies", "series");
    }

    private static PlaylistItem item(String title, String group, ContentCategory category) {
        return PlaylistItem.builder().title(title).url("http://host/" + title).group(group).category(category).build();
    }

    private static PlaylistChunk chunk(int chunkId, PlaylistItem... items) {
        return PlaylistChunk.builder().ownerId("res-1").chunkId(chunkId).items(List.of(items)).build();
    }
}
