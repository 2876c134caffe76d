package com.company.cropstress.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldRequest {
    @NotBlank(message = "Field ID is required")
    private String fieldId;

    private String cropType;

    @PositiveOrZero(message = "Field size must not be negative")
    private Double fieldSizeHectares;

    @NotNull(message = "Analysis date is required")
    private LocalDate analysisDate;

    // Optional WGS84 extent
    private Double minLon;
    private Double minLat;
    private Double maxLon;
    private Double maxLat;
}
