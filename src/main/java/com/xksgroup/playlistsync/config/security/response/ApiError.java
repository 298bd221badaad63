package com.xksgroup.playlistsync.config.security.response;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Corps JSON des refus 401/403 émis par la chaîne de sécurité, avant tout contrôleur.
 */
public record ApiError(
        boolean success,
        int status,
        String error,
        String message,
        Map<String, Object> details,
        String timestamp,
        String path
) {

    public static ApiError of(HttpServletRequest request, int status, String error, String message,
                              Map<String, Object> details) {
        return new ApiError(false, status, error, message, details,
                OffsetDateTime.now().toString(), request.getRequestURI());
    }

    public void writeTo(HttpServletResponse response, ObjectMapper objectMapper) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), this);
    }
}
