package com.xksgroup.playlistsync.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One playable entry of a playlist. Never mutated after categorization,
 * use {@link #toBuilder()} to derive a copy.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlaylistItem {

    public static final String DEFAULT_GROUP = "Uncategorized";

    String title;
    String url;
    String logo;

    @Builder.Default
    String group = DEFAULT_GROUP;

    ContentCategory category;

    // tvg-id for M3U entries, stream/series id for provider entries
    @JsonProperty("id")
    String providerId;

    String epgId;
    String rating;

    // Name of the resource the item came from, only set on aggregated views
    String source;
}
