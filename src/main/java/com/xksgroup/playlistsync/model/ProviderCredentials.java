package com.xksgroup.playlistsync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderCredentials {

    @NotBlank(message = "host is required")
    private String host;

    @NotBlank(message = "username is required")
    private String username;

    @NotBlank(message = "password is required")
    private String password;

    /**
     * Host with a scheme and without trailing slash, e.g. "http://line.example.com:8080".
     */
    @JsonIgnore
    public String getNormalizedHost() {
        return normalizeHost(host);
    }

    public static String normalizeHost(String host) {
        if (host == null) {
            return null;
        }
        String safeHost = host.trim();
        if (!safeHost.startsWith("http")) {
            safeHost = "http://" + safeHost;
        }
        while (safeHost.endsWith("/")) {
            safeHost = safeHost.substring(0, safeHost.length() - 1);
        }
        return safeHost;
    }
}
