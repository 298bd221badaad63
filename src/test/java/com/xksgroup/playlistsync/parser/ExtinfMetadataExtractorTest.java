package com.xksgroup.playlistsync.parser;

import com.xksgroup.playlistsync.model.PlaylistItem;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExtinfMetadataExtractorTest {

    @Test
    void readsAttributesAndTitle() {
        ExtinfMetadata metadata = ExtinfMetadataExtractor.extract(
                "#EXTINF:-1 tvg-id=\"id.1\" tvg-logo=\"http://logo\" group-title=\"Sports\",Match Day");

        assertThat(metadata.title()).isEqualTo("Match Day");
        assertThat(metadata.id()).isEqualTo("id.1");
        assertThat(metadata.logo()).isEqualTo("http://logo");
        assertThat(metadata.group()).isEqualTo("Sports");
    }

    @Test
    void titleIsTextAfterLastComma() {
        ExtinfMetadata metadata = ExtinfMetadataExtractor.extract("#EXTINF:-1 group-title=\"A, B\",Hello, World");

        assertThat(metadata.title()).isEqualTo("World");
        assertThat(metadata.group()).isEqualTo("A, B");
    }

    @Test
    void attributeKeysAreCaseInsensitive() {
        ExtinfMetadata metadata = ExtinfMetadataExtractor.extract("#EXTINF:-1 GROUP-TITLE=\"Kids\" TVG-LOGO=\"l\",Cartoon");

        assertThat(metadata.group()).isEqualTo("Kids");
        assertThat(metadata.logo()).isEqualTo("l");
    }

    @Test
    void missingOrEmptyGroupFallsBackToDefault() {
        assertThat(ExtinfMetadataExtractor.extract("#EXTINF:-1,Plain").group()).isEqualTo(PlaylistItem.DEFAULT_GROUP);
        assertThat(ExtinfMetadataExtractor.extract("#EXTINF:-1 group-title=\"\",Plain").group())
                .isEqualTo(PlaylistItem.DEFAULT_GROUP);
    }

    @Test
    void absentAttributesAreNull() {
        ExtinfMetadata metadata = ExtinfMetadataExtractor.extract("#EXTINF:-1,Plain");

        assertThat(metadata.logo()).isNull();
        assertThat(metadata.id()).isNull();
    }
}
