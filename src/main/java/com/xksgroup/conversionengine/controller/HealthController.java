package com.xksgroup.conversionengine.controller;

import com.xksgroup.conversionengine.model.SpaceUsageSnapshot;
import com.xksgroup.conversionengine.model.TaskStatus;
import com.xksgroup.conversionengine.service.BroadcastHub;
import com.xksgroup.conversionengine.service.SpaceAccountant;
import com.xksgroup.conversionengine.service.TaskRegistry;
import com.xksgroup.conversionengine.service.helper.BackgroundSupervisor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Santé", description = "État du service de conversion")
public class HealthController {

    private final TaskRegistry taskRegistry;
    private final SpaceAccountant spaceAccountant;
    private final BroadcastHub hub;
    private final BackgroundSupervisor supervisor;

    @GetMapping
    @Operation(
        summary = "Vérification de santé",
        description = "Compteurs de tâches par statut, connexions actives, état de l'espace disque et des tâches de fond."
    )
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("timestamp", LocalDateTime.now());
        health.put("service", "conversion-engine");

        long uptime = ManagementFactory.getRuntimeMXBean().getUptime();
        long hours = uptime / (1000 * 60 * 60);
        long minutes = (uptime % (1000 * 60 * 60)) / (1000 * 60);
        health.put("uptime", String.format("%d hours %d minutes", hours, minutes));

        try {
            Map<String, Long> tasks = new LinkedHashMap<>();
            taskRegistry.counts().forEach((status, count) -> tasks.put(status.name(), count));
            health.put("tasks", tasks);
            health.put("activeTasks", tasks.get(TaskStatus.PENDING.name()) + tasks.get(TaskStatus.CONVERTING.name()));
        } catch (RuntimeException e) {
            log.error("Health check could not read tasks - Error: {}", e.getMessage(), e);
            health.put("status", "unhealthy");
            health.put("tasks", "unavailable");
        }

        SpaceUsageSnapshot space = spaceAccountant.getUsage();
        Map<String, Object> spaceInfo = new LinkedHashMap<>();
        spaceInfo.put("usagePercentage", Math.round(space.getUsagePercentage() * 10) / 10.0);
        spaceInfo.put("availableBytes", space.getAvailableBytes());
        spaceInfo.put("stale", space.isStale());
        health.put("space", spaceInfo);
        if (space.isStale() && "healthy".equals(health.get("status"))) {
            health.put("status", "degraded");
        }

        health.put("connections", hub.connectionCount());

        Map<String, String> failingJobs = new LinkedHashMap<>();
        supervisor.lastFailures().forEach((job, error) -> failingJobs.put(job, error.getMessage()));
        health.put("backgroundFailures", failingJobs);

        return ResponseEntity.ok(health);
    }
}
