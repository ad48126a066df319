package com.xksgroup.conversionengine.model.dto;

import com.xksgroup.conversionengine.model.ConversionParameters;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Requête de démarrage d'une tâche de conversion")
public class StartTaskRequest {

    @NotBlank(message = "name is required")
    @Schema(description = "Nom lisible de la tâche", example = "Conférence 2024 - partie 1")
    private String name;

    @Schema(
        description = "Chemin du fichier source déjà téléversé. Par défaut, le nom de la tâche.",
        example = "uploads/conference-2024-part1.mkv"
    )
    private String sourcePath;

    @Positive(message = "sourceSize must be positive")
    @Schema(description = "Taille du fichier source en octets", example = "1000000000")
    private long sourceSize;

    @Schema(description = "Paramètres de conversion transmis tels quels au worker")
    private ConversionParameters parameters;

    @Schema(description = "Identifiant de l'utilisateur propriétaire (renseigné depuis le JWT si absent)")
    private String userId;

    @Min(value = 0, message = "maxRetries must be >= 0")
    @Max(value = 10, message = "maxRetries must be <= 10")
    @Schema(description = "Nombre maximal de relances autorisées", example = "3")
    private Integer maxRetries;
}
