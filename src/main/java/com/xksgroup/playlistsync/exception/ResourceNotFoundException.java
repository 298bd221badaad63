package com.xksgroup.playlistsync.exception;

public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resourceId) {
        super("Playlist resource not found with id: " + resourceId);
    }
}
