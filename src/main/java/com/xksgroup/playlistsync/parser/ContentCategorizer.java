package com.xksgroup.playlistsync.parser;

import com.xksgroup.playlistsync.model.ContentCategory;

import java.util.Locale;

/**
 * Derives the content category from the shape of a stream URL.
 * Movie paths win over series paths, everything else is a live channel.
 */
public final class ContentCategorizer {

    private ContentCategorizer() {
    }

    public static ContentCategory categorize(String url) {
        if (url == null) {
            return ContentCategory.CHANNELS;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.contains("/movie/") || lower.contains("/movies/")) {
            return ContentCategory.MOVIES;
        }
        if (lower.contains("/series/")) {
            return ContentCategory.SERIES;
        }
        return ContentCategory.CHANNELS;
    }
}
