package com.xksgroup.conversionengine.controller;

import com.xksgroup.conversionengine.model.SpaceBudget;
import com.xksgroup.conversionengine.model.SpaceCheckResult;
import com.xksgroup.conversionengine.model.SpaceUsageSnapshot;
import com.xksgroup.conversionengine.model.dto.SpaceCheckRequest;
import com.xksgroup.conversionengine.model.dto.SpaceConfigRequest;
import com.xksgroup.conversionengine.model.dto.SpaceEstimateRequest;
import com.xksgroup.conversionengine.model.dto.SpaceEstimateResponse;
import com.xksgroup.conversionengine.service.SpaceAccountant;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;

@Slf4j
@RestController
@RequestMapping("/api/v1/space")
@RequiredArgsConstructor
@Tag(name = "Espace Disque", description = "Budget de stockage, vérification et estimation de l'espace nécessaire")
public class SpaceController {

    private final SpaceAccountant spaceAccountant;

    @GetMapping("/usage")
    @Operation(
        summary = "Utilisation de l'espace",
        description = "Dernier instantané de l'utilisation du budget, réservations en attente déduites. 'stale' indique que le dernier calcul a échoué."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Instantané récupéré",
            content = @Content(
                mediaType = "application/json",
                examples = @ExampleObject(
                    name = "Utilisation",
                    value = """
                    {
                        "totalBytes": 107374182400,
                        "reservedBytes": 5368709120,
                        "usedBytes": 21474836480,
                        "availableBytes": 80530636800,
                        "pendingReservationBytes": 0,
                        "usagePercentage": 20.0,
                        "enabled": true,
                        "hasSufficientSpace": true,
                        "sourceFilesBytes": 10737418240,
                        "outputFilesBytes": 9663676416,
                        "tempFilesBytes": 1073741824,
                        "computedAt": "2024-01-01T12:00:00",
                        "stale": false
                    }
                    """
                )
            )
        )
    })
    public ResponseEntity<SpaceUsageSnapshot> getUsage() {
        return ResponseEntity.ok(spaceAccountant.getUsage());
    }

    @PostMapping("/check")
    @Operation(
        summary = "Vérifier l'espace disponible",
        description = "Calcule l'espace requis (original + sortie estimée + 10% temporaire) et le compare à l'espace disponible. Sans taille de sortie, 70% de l'original est supposé."
    )
    public ResponseEntity<SpaceCheckResult> checkSpace(@Valid @RequestBody SpaceCheckRequest request) {
        return ResponseEntity.ok(spaceAccountant.checkSpace(request));
    }

    @PostMapping("/estimate")
    @Operation(summary = "Estimer la taille de sortie", description = "Estimation selon le codec vidéo et le format de sortie.")
    public ResponseEntity<SpaceEstimateResponse> estimate(@Valid @RequestBody SpaceEstimateRequest request) {
        return ResponseEntity.ok(spaceAccountant.estimate(
                request.getOriginalFileSize(), request.getOutputFormat(), request.getVideoCodec()));
    }

    @PostMapping("/refresh")
    @Operation(summary = "Recalculer l'utilisation", description = "Force un nouveau parcours des répertoires de stockage.")
    public ResponseEntity<SpaceUsageSnapshot> refresh() {
        spaceAccountant.refresh();
        return ResponseEntity.ok(spaceAccountant.getUsage());
    }

    @GetMapping("/config")
    @Operation(summary = "Configuration du budget", description = "Espace total, espace réservé et activation de la limitation.")
    public ResponseEntity<SpaceBudget> getConfig() {
        return ResponseEntity.ok(spaceAccountant.getBudget());
    }

    @PostMapping("/config")
    @Operation(
        summary = "Modifier la configuration du budget",
        description = "L'espace réservé doit être strictement inférieur à l'espace total. Le nouveau statut est diffusé à tous les clients connectés."
    )
    public ResponseEntity<SpaceBudget> updateConfig(@Valid @RequestBody SpaceConfigRequest request, Principal principal) {
        String updatedBy = principal != null ? principal.getName() : null;
        SpaceBudget budget = spaceAccountant.updateBudget(
                request.getMaxTotal(), request.getReserved(), request.isEnabled(), updatedBy);
        return ResponseEntity.ok(budget);
    }
}
