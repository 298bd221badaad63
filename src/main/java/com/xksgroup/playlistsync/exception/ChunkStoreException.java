package com.xksgroup.playlistsync.exception;

public class ChunkStoreException extends RuntimeException {

    public ChunkStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
