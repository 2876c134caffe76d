package com.company.cropstress.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to analyse one field over a stack of acquisitions
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeFieldRequest {
    @Valid
    @NotNull(message = "Field metadata is required")
    private FieldRequest field;

    @Valid
    @NotEmpty(message = "At least one scene is required")
    private List<SceneRequest> scenes;
}
