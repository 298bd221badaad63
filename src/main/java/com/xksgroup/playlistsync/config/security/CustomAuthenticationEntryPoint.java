package com.xksgroup.playlistsync.config.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.playlistsync.config.security.response.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Handler personnalisé pour gérer les erreurs d'authentification (401).
 * Distingue un token manquant, expiré ou invalide.
 */
@Slf4j
@RequiredArgsConstructor
public class CustomAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException) throws IOException {

        log.warn("Erreur d'authentification: {} - Path: {}", authException.getMessage(), request.getRequestURI());

        String errorType;
        String message;
        Map<String, Object> details = new HashMap<>();
        String lowerMessage = authException.getMessage() != null
                ? authException.getMessage().toLowerCase(Locale.ROOT)
                : "";

        if (lowerMessage.contains("expired")) {
            errorType = "TokenExpired";
            message = "Le token d'authentification a expiré";
            details.put("reason", "Token expiré. Veuillez rafraîchir votre token.");
        } else if (lowerMessage.contains("malformed") || lowerMessage.contains("signature")) {
            errorType = "TokenInvalid";
            message = "Token d'authentification invalide";
            details.put("reason", authException.getMessage());
        } else if (request.getHeader("Authorization") == null) {
            errorType = "TokenMissing";
            message = "Token d'authentification manquant";
            details.put("reason", "Aucun token fourni.");
            details.put("format", "Authorization: Bearer <votre-token>");
        } else {
            errorType = "AuthenticationException";
            message = "Authentification requise";
            details.put("reason", authException.getMessage());
            details.put("exceptionType", authException.getClass().getSimpleName());
        }

        ApiError.of(request, HttpServletResponse.SC_UNAUTHORIZED, errorType, message, details)
                .writeTo(response, objectMapper);
    }
}
