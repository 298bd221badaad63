package com.xksgroup.playlistsync.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class OpenApiConfig {

    private static final String BEARER = "bearerAuth";

    @Bean
    public OpenAPI playlistSyncOpenAPI(@Value("${server.port:8080}") int serverPort,
                                       @Value("${playlist.api.public-url:}") String publicUrl,
                                       @Value("${security.jwt.enabled:false}") boolean jwtEnabled) {

        List<Server> servers = new ArrayList<>();
        if (!publicUrl.isBlank()) {
            servers.add(new Server().url(publicUrl).description("Déploiement"));
        }
        servers.add(new Server().url("http://localhost:" + serverPort).description("Développement local"));

        OpenAPI openAPI = new OpenAPI()
                .info(new Info()
                        .title("API Playlist Sync")
                        .version("v1")
                        .description("Synchronisation de playlists M3U et de catalogues Xtream, stockage par blocs "
                                + "dans MongoDB et suivi de progression en SSE."))
                .servers(servers);

        if (jwtEnabled) {
            openAPI.components(new Components().addSecuritySchemes(BEARER, new SecurityScheme()
                            .type(SecurityScheme.Type.HTTP)
                            .scheme("bearer")
                            .bearerFormat("JWT")))
                    .addSecurityItem(new SecurityRequirement().addList(BEARER));
        }
        return openAPI;
    }
}
