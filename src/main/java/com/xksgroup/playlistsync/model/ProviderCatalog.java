package com.xksgroup.playlistsync.model;

/**
 * Everything a structured provider returned in one bulk fetch.
 */
public record ProviderCatalog(CategorizedPlaylist data, PlaylistStats stats) {
}
