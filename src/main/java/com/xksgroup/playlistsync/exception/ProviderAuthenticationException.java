package com.xksgroup.playlistsync.exception;

public class ProviderAuthenticationException extends RuntimeException {

    public ProviderAuthenticationException(String message) {
        super(message);
    }

    public ProviderAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
