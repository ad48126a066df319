package com.xksgroup.conversionengine.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(@Value("${server.port:8080}") int serverPort,
                                 @Value("${conversion.openapi.public-url:}") String publicUrl) {

        List<Server> servers = new ArrayList<>();
        if (!publicUrl.isBlank()) {
            servers.add(new Server().url(publicUrl).description("Instance publiée"));
        }
        servers.add(new Server()
                .url("http://localhost:" + serverPort)
                .description("Développement local"));

        SecurityScheme bearerScheme = new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer")
                .bearerFormat("JWT")
                .in(SecurityScheme.In.HEADER)
                .name("Authorization");

        return new OpenAPI()
                .info(new Info()
                        .title("API Conversion Engine")
                        .version("v1")
                        .description("Admission, suivi et diffusion en temps réel des tâches de conversion vidéo"))
                .components(new Components()
                        .addSecuritySchemes("bearerAuth", bearerScheme))
                .addSecurityItem(new SecurityRequirement().addList("bearerAuth"))
                .tags(List.of(
                        new Tag().name("Gestion des Tâches").description("Cycle de vie des tâches et callbacks du worker"),
                        new Tag().name("Espace Disque").description("Budget de stockage et admission"),
                        new Tag().name("Événements Temps Réel").description("Flux SSE, groupes et heartbeat")))
                .servers(servers);
    }
}
