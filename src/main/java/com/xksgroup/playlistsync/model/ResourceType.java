package com.xksgroup.playlistsync.model;

public enum ResourceType {
    M3U,        // Plain M3U/M3U8 text reachable by URL
    XTREAM      // Structured provider API (player_api.php)
}
