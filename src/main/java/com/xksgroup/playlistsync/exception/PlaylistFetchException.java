package com.xksgroup.playlistsync.exception;

/**
 * The playlist source could not be read: both the direct and the proxied
 * fetch failed, or the provider returned nothing usable.
 */
public class PlaylistFetchException extends RuntimeException {

    public PlaylistFetchException(String message) {
        super(message);
    }

    public PlaylistFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
