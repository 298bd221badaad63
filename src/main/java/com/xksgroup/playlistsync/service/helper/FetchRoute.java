package com.xksgroup.playlistsync.service.helper;

public enum FetchRoute {
    DIRECT,         // Plain GET on the source URL
    PROXY,          // Retry through the proxy template
    LOCAL_FILE      // file: URL read from disk
}
