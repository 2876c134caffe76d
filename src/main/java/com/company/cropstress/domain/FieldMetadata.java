package com.company.cropstress.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
@JsonPropertyOrder({"fieldId", "cropType", "fieldSizeHectares", "analysisDate", "extent"})
public class FieldMetadata {
    String fieldId;
    String cropType;
    Double fieldSizeHectares;
    LocalDate analysisDate;
    GeoExtent extent;
}
