package com.xksgroup.conversionengine.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Configuration du budget d'espace disque")
public class SpaceConfigRequest {

    @Positive(message = "maxTotal must be positive")
    @Schema(description = "Espace total alloué en octets", example = "107374182400")
    private long maxTotal;

    @PositiveOrZero(message = "reserved must be >= 0")
    @Schema(description = "Espace réservé intouchable en octets", example = "5368709120")
    private long reserved;

    @Schema(description = "Active la limitation d'espace", example = "true")
    private boolean enabled;
}
