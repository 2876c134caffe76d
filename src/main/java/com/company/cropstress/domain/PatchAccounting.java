package com.company.cropstress.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonPropertyOrder({"patchSize", "stride", "totalPatches", "validPatches", "excludedPatches", "note", "excludedAnchors"})
public class PatchAccounting {
    int patchSize;
    int stride;
    int totalPatches;
    int validPatches;
    int excludedPatches;
    String note;
    List<PatchAnchor> excludedAnchors;

    public static String exclusionNote(int excluded, int total) {
        return excluded + " of " + total + " patches excluded for insufficient data";
    }
}
