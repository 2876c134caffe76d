package com.company.cropstress.domain;

import com.company.cropstress.domain.enums.VegetationIndex;
import lombok.Value;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Idempotency key of an analysis request: field, analysis date and the index set.
 */
@Value
public class AnalysisKey {
    String fieldId;
    LocalDate analysisDate;
    String indexSet;

    public static AnalysisKey of(String fieldId, LocalDate analysisDate, Collection<VegetationIndex> indices) {
        String indexSet = indices.stream()
                .map(Enum::name)
                .sorted()
                .distinct()
                .collect(Collectors.joining(","));
        return new AnalysisKey(fieldId, analysisDate, indexSet);
    }

    public static AnalysisKey of(FieldMetadata field) {
        return of(field.getFieldId(), field.getAnalysisDate(), Arrays.asList(VegetationIndex.values()));
    }

    @Override
    public String toString() {
        return fieldId + "@" + analysisDate + "[" + indexSet + "]";
    }
}
