package com.xksgroup.playlistsync.config.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.playlistsync.config.security.response.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.access.AccessDeniedHandler;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 403 : le token est valide mais ne porte pas le rôle de gestion des playlists.
 */
@Slf4j
@RequiredArgsConstructor
public class CustomAccessDeniedHandler implements AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    @Override
    public void handle(HttpServletRequest request,
                       HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        String user = authentication != null ? authentication.getName() : "anonymous";
        List<String> roles = authentication == null ? List.of() : authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .collect(Collectors.toList());

        log.warn("Access denied to {} {} for {} (roles={})", request.getMethod(), request.getRequestURI(), user, roles);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requiredRole", SecurityConfig.ADMIN);
        details.put("grantedRoles", roles);
        details.put("user", user);

        ApiError.of(request, HttpServletResponse.SC_FORBIDDEN, "AccessDenied",
                        "La gestion des playlists exige le rôle '" + SecurityConfig.ADMIN + "'", details)
                .writeTo(response, objectMapper);
    }
}
