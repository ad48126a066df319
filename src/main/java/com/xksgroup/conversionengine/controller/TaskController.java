package com.xksgroup.conversionengine.controller;

import com.xksgroup.conversionengine.model.Task;
import com.xksgroup.conversionengine.model.dto.FailTaskRequest;
import com.xksgroup.conversionengine.model.dto.ProgressUpdateRequest;
import com.xksgroup.conversionengine.model.dto.StartTaskRequest;
import com.xksgroup.conversionengine.model.dto.StartTaskResponse;
import com.xksgroup.conversionengine.model.dto.TaskSnapshotDto;
import com.xksgroup.conversionengine.service.AdmissionService;
import com.xksgroup.conversionengine.service.TaskRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api/v1/tasks")
@RequiredArgsConstructor
@Tag(name = "Gestion des Tâches", description = "Démarrer, suivre et gérer les tâches de conversion")
public class TaskController {

    private final AdmissionService admissionService;
    private final TaskRegistry taskRegistry;

    @PostMapping
    @Operation(
        summary = "Démarrer une tâche de conversion",
        description = "Réserve l'espace disque nécessaire puis crée la tâche en attente. Retourne 507 si l'espace est insuffisant, 409 si le même fichier source est déjà en cours de conversion."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "201",
            description = "Tâche admise",
            content = @Content(
                mediaType = "application/json",
                examples = @ExampleObject(
                    name = "Tâche créée",
                    value = """
                    {
                        "taskId": "task-123e4567-e89b-12d3-a456-426614174000",
                        "reservedBytes": 1900000000
                    }
                    """
                )
            )
        ),
        @ApiResponse(responseCode = "400", description = "Requête invalide"),
        @ApiResponse(responseCode = "409", description = "Fichier source déjà en cours de conversion"),
        @ApiResponse(responseCode = "507", description = "Espace disque insuffisant")
    })
    public ResponseEntity<StartTaskResponse> startTask(@Valid @RequestBody StartTaskRequest request, Principal principal) {
        if ((request.getUserId() == null || request.getUserId().isBlank()) && principal != null) {
            request.setUserId(principal.getName());
        }
        Task task = admissionService.startTask(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new StartTaskResponse(task.getId(), task.getReservedBytes()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Détails d'une tâche", description = "Retourne l'état courant d'une tâche.")
    public ResponseEntity<TaskSnapshotDto> getTask(@PathVariable String id) {
        return ResponseEntity.ok(TaskSnapshotDto.fromTask(taskRegistry.get(id)));
    }

    @GetMapping("/active")
    @Operation(
        summary = "Lister les tâches actives",
        description = "Tâches en attente ou en cours de conversion, de la plus ancienne à la plus récente. Utilisé par les clients pour se resynchroniser après une reconnexion."
    )
    public ResponseEntity<List<TaskSnapshotDto>> listActive() {
        return ResponseEntity.ok(toDtos(taskRegistry.listActive()));
    }

    @GetMapping("/completed")
    @Operation(summary = "Lister les tâches terminées", description = "Tâches terminées, échouées ou annulées, les plus récentes d'abord.")
    public ResponseEntity<List<TaskSnapshotDto>> listCompleted(
            @Parameter(description = "Numéro de page (basé sur 1)", example = "1")
            @RequestParam(defaultValue = "1") int page,

            @Parameter(description = "Taille de la page (1 à 100)", example = "20")
            @RequestParam(defaultValue = "20") int pageSize) {
        return ResponseEntity.ok(toDtos(taskRegistry.listCompleted(page, pageSize)));
    }

    @GetMapping("/recent")
    @Operation(summary = "Tâches récentes", description = "Dernières tâches créées, tous statuts confondus.")
    public ResponseEntity<List<TaskSnapshotDto>> listRecent(
            @Parameter(description = "Nombre de tâches (1 à 100)", example = "10")
            @RequestParam(defaultValue = "10") int count) {
        return ResponseEntity.ok(toDtos(taskRegistry.listRecent(count)));
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Annuler une tâche", description = "Annule une tâche en attente ou en cours. Le worker arrête la conversion de lui-même.")
    public ResponseEntity<TaskSnapshotDto> cancelTask(@PathVariable String id) {
        return ResponseEntity.ok(TaskSnapshotDto.fromTask(taskRegistry.cancel(id)));
    }

    @PostMapping("/{id}/retry")
    @Operation(summary = "Relancer une tâche échouée", description = "Crée une nouvelle tâche pour le même fichier source, si le nombre maximal de relances n'est pas atteint.")
    public ResponseEntity<StartTaskResponse> retryTask(@PathVariable String id) {
        Task task = admissionService.retryTask(id);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new StartTaskResponse(task.getId(), task.getReservedBytes()));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Supprimer une tâche", description = "Supprime la tâche et libère l'espace réservé pour elle.")
    public ResponseEntity<Map<String, Object>> deleteTask(@PathVariable String id) {
        taskRegistry.delete(id);
        return ResponseEntity.ok(Map.of("taskId", id, "deleted", true));
    }

    @PostMapping("/cleanup")
    @Operation(summary = "Nettoyer les anciennes tâches", description = "Supprime les tâches terminées créées il y a plus de N jours (1 à 365).")
    public ResponseEntity<Map<String, Object>> cleanup(
            @Parameter(description = "Ancienneté minimale en jours", example = "30")
            @RequestParam(defaultValue = "30") int daysOld) {
        int removed = taskRegistry.cleanupTerminalTasks(daysOld);
        return ResponseEntity.ok(Map.of("removed", removed, "daysOld", daysOld));
    }

    // Worker callbacks

    @PostMapping("/{id}/start")
    @Operation(summary = "Début de conversion (worker)", description = "Le worker signale qu'il commence la conversion.")
    public ResponseEntity<TaskSnapshotDto> markStarted(@PathVariable String id) {
        return ResponseEntity.ok(TaskSnapshotDto.fromTask(taskRegistry.start(id)));
    }

    @PostMapping("/{id}/progress")
    @Operation(summary = "Progression (worker)", description = "Met à jour la progression (0 à 100), la vitesse et le temps restant estimé.")
    public ResponseEntity<TaskSnapshotDto> reportProgress(@PathVariable String id, @Valid @RequestBody ProgressUpdateRequest request) {
        Task task = taskRegistry.updateProgress(id, request.getProgress(), request.getSpeed(), request.getEtaSeconds());
        return ResponseEntity.ok(TaskSnapshotDto.fromTask(task));
    }

    @PostMapping("/{id}/complete")
    @Operation(summary = "Fin de conversion (worker)", description = "Le worker signale que la conversion a réussi.")
    public ResponseEntity<TaskSnapshotDto> markCompleted(@PathVariable String id) {
        return ResponseEntity.ok(TaskSnapshotDto.fromTask(taskRegistry.complete(id)));
    }

    @PostMapping("/{id}/fail")
    @Operation(summary = "Échec de conversion (worker)", description = "Le worker signale un échec avec un message d'erreur.")
    public ResponseEntity<TaskSnapshotDto> markFailed(@PathVariable String id, @Valid @RequestBody FailTaskRequest request) {
        log.warn("Worker reported failure for task {}: {}", id, request.getMessage());
        return ResponseEntity.ok(TaskSnapshotDto.fromTask(taskRegistry.fail(id, request.getMessage())));
    }

    private static List<TaskSnapshotDto> toDtos(List<Task> tasks) {
        return tasks.stream()
                .map(TaskSnapshotDto::fromTask)
                .collect(Collectors.toList());
    }
}
