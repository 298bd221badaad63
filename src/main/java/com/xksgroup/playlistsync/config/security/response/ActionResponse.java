package com.xksgroup.playlistsync.config.security.response;

import java.time.OffsetDateTime;

/**
 * Représente la structure standard pour les réponses des actions (sync, annulation, reset).
 */
public record ActionResponse(
        boolean success,
        int status,
        String message,
        Object data,
        String timestamp,
        String path
) {
    public static ActionResponse of(int status, String message, Object data, String path) {
        return new ActionResponse(status < 400, status, message, data, OffsetDateTime.now().toString(), path);
    }
}
