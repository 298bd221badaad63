package com.xksgroup.playlistsync.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Two-level grouping of playlist items: category, then group, then items in
 * encounter order. Groups keep the order in which they were first seen.
 */
public class CategorizedPlaylist {

    private final Map<ContentCategory, Map<String, List<PlaylistItem>>> categories =
            new EnumMap<>(ContentCategory.class);

    public CategorizedPlaylist() {
        for (ContentCategory category : ContentCategory.values()) {
            categories.put(category, new LinkedHashMap<>());
        }
    }

    public static CategorizedPlaylist empty() {
        return new CategorizedPlaylist();
    }

    public void addChunk(PlaylistChunk chunk) {
        if (chunk.getItems() != null) {
            chunk.getItems().forEach(this::add);
        }
    }

    public void add(PlaylistItem item) {
        ContentCategory category = item.getCategory() != null ? item.getCategory() : ContentCategory.CHANNELS;
        String group = item.getGroup() != null ? item.getGroup() : PlaylistItem.DEFAULT_GROUP;
        categories.get(category).computeIfAbsent(group, g -> new ArrayList<>()).add(item);
    }

    /**
     * Append every item of another view, passing each through the mapper first.
     */
    public void addAll(CategorizedPlaylist other, Function<PlaylistItem, PlaylistItem> mapper) {
        other.categories.forEach((category, groups) ->
                groups.forEach((group, items) -> items.forEach(item -> add(mapper.apply(item)))));
    }

    public Map<String, List<PlaylistItem>> groups(ContentCategory category) {
        return Collections.unmodifiableMap(categories.get(category));
    }

    public List<PlaylistItem> items(ContentCategory category, String group) {
        List<PlaylistItem> items = categories.get(category).get(group);
        return items != null ? Collections.unmodifiableList(items) : List.of();
    }

    /**
     * Flatten in category order (channels, movies, series), then group order.
     */
    public List<PlaylistItem> flatten() {
        List<PlaylistItem> all = new ArrayList<>();
        categories.values().forEach(groups -> groups.values().forEach(all::addAll));
        return all;
    }

    public PlaylistStats stats() {
        PlaylistStats stats = new PlaylistStats();
        categories.forEach((category, groups) ->
                groups.values().forEach(items -> items.forEach(item -> stats.increment(category))));
        return stats;
    }

    public int size() {
        return stats().total();
    }

    public boolean isEmpty() {
        return categories.values().stream().allMatch(Map::isEmpty);
    }

    @JsonValue
    public Map<String, Map<String, List<PlaylistItem>>> asMap() {
        Map<String, Map<String, List<PlaylistItem>>> view = new LinkedHashMap<>();
        categories.forEach((category, groups) -> view.put(category.key(), Collections.unmodifiableMap(groups)));
        return view;
    }
}
