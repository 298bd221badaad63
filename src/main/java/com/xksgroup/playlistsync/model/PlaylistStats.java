package com.xksgroup.playlistsync.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-category item counters. Counters only ever grow during one parse pass.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlaylistStats {

    private int channels;
    private int movies;
    private int series;

    public void increment(ContentCategory category) {
        switch (category) {
            case CHANNELS:
                channels++;
                break;
            case MOVIES:
                movies++;
                break;
            case SERIES:
                series++;
                break;
        }
    }

    public int get(ContentCategory category) {
        switch (category) {
            case MOVIES:
                return movies;
            case SERIES:
                return series;
            case CHANNELS:
            default:
                return channels;
        }
    }

    public int total() {
        return channels + movies + series;
    }

    public PlaylistStats copy() {
        return new PlaylistStats(channels, movies, series);
    }

    public static PlaylistStats empty() {
        return new PlaylistStats();
    }
}
