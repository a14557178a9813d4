package org.background.task.engine.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationRequest {

    @NotBlank(message = "optimizationType is required")
    @Schema(description = "low_memory, performance or balanced", example = "low_memory")
    private String optimizationType;
}
