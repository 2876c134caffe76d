package com.company.cropstress.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One acquisition: band name (e.g. "B08") to row-major 2-D pixel grid
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SceneRequest {
    @NotNull(message = "Acquisition time is required")
    private Instant acquiredAt;

    @NotEmpty(message = "At least one band is required")
    private Map<String, double[][]> bands;

    // Optional, true = usable pixel
    private boolean[][] validMask;
}
