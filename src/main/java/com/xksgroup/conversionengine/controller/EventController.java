package com.xksgroup.conversionengine.controller;

import com.xksgroup.conversionengine.model.dto.GroupRequest;
import com.xksgroup.conversionengine.service.ConnectionManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.security.Principal;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/events")
@RequiredArgsConstructor
@Tag(name = "Événements Temps Réel", description = "Flux SSE des mises à jour de tâches et d'espace disque, gestion des abonnements")
public class EventController {

    private final ConnectionManager connectionManager;

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(
        summary = "Ouvrir le flux d'événements",
        description = "Le premier événement 'Connected' contient l'identifiant de connexion à utiliser pour rejoindre des groupes et répondre aux 'Ping'."
    )
    public SseEmitter stream(
            @Parameter(description = "Identifiant utilisateur, ignoré si un JWT est fourni")
            @RequestParam(required = false) String userId,
            Principal principal) {
        String effectiveUserId = principal != null ? principal.getName() : userId;
        return connectionManager.openStream(effectiveUserId);
    }

    @PostMapping("/connections/{connectionId}/groups")
    @Operation(
        summary = "Rejoindre un groupe",
        description = "Groupes acceptés : task:<id>, user:<id>, space-monitor, all. Rejoindre deux fois est sans effet."
    )
    public ResponseEntity<Map<String, Object>> joinGroup(@PathVariable String connectionId, @Valid @RequestBody GroupRequest request) {
        connectionManager.join(connectionId, request.getName());
        return ResponseEntity.ok(Map.of("connectionId", connectionId, "group", request.getName(), "joined", true));
    }

    @DeleteMapping("/connections/{connectionId}/groups/{group}")
    @Operation(summary = "Quitter un groupe")
    public ResponseEntity<Map<String, Object>> leaveGroup(@PathVariable String connectionId, @PathVariable String group) {
        connectionManager.leave(connectionId, group);
        return ResponseEntity.ok(Map.of("connectionId", connectionId, "group", group, "joined", false));
    }

    @PostMapping("/connections/{connectionId}/pong")
    @Operation(summary = "Répondre à un Ping", description = "Sans Pong pendant le délai configuré, la connexion est fermée.")
    public ResponseEntity<Void> pong(@PathVariable String connectionId) {
        connectionManager.recordPong(connectionId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/connections/{connectionId}")
    @Operation(summary = "Fermer une connexion")
    public ResponseEntity<Void> close(@PathVariable String connectionId) {
        connectionManager.close(connectionId);
        return ResponseEntity.noContent().build();
    }
}
