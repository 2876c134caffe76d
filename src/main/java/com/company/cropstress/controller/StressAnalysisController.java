package com.company.cropstress.controller;

import com.company.cropstress.domain.FieldMetadata;
import com.company.cropstress.domain.FieldStressReport;
import com.company.cropstress.domain.GeoExtent;
import com.company.cropstress.domain.RasterGrid;
import com.company.cropstress.domain.RasterStack;
import com.company.cropstress.domain.Scene;
import com.company.cropstress.domain.enums.Band;
import com.company.cropstress.dto.request.AnalyzeFieldRequest;
import com.company.cropstress.dto.request.FieldRequest;
import com.company.cropstress.dto.request.SceneRequest;
import com.company.cropstress.service.StressAnalysisService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

@RestController
@RequestMapping("/api/v1/stress-reports")
@Tag(name = "Stress Analysis", description = "Field crop-stress analysis from multi-date imagery")
@RequiredArgsConstructor
@Slf4j
public class StressAnalysisController {

    private final StressAnalysisService analysisService;
    private final MeterRegistry meterRegistry;

    @PostMapping
    @Operation(summary = "Analyse a field",
            description = "Computes indices, stress clusters and anomalies for the submitted scenes")
    public ResponseEntity<FieldStressReport> analyze(@Valid @RequestBody AnalyzeFieldRequest request) {
        FieldRequest field = request.getField();
        log.info("Stress report request for field {} ({} scenes, analysis date {})",
                field.getFieldId(), request.getScenes().size(), field.getAnalysisDate());

        meterRegistry.counter("api.stress-reports.requests").increment();

        RasterStack stack = RasterStack.of(request.getScenes().stream().map(this::toScene).toList());
        FieldStressReport report = analysisService.analyzeOnce(stack, toFieldMetadata(field));

        return ResponseEntity.ok(report);
    }

    private Scene toScene(SceneRequest request) {
        Map<Band, RasterGrid> grids = new EnumMap<>(Band.class);
        request.getBands().forEach((name, rows) -> grids.put(Band.fromString(name), RasterGrid.of(rows)));
        return Scene.of(request.getAcquiredAt(), grids, flatten(request.getValidMask()));
    }

    private static boolean[] flatten(boolean[][] mask) {
        if (mask == null) {
            return null;
        }
        int width = mask.length == 0 ? 0 : mask[0].length;
        boolean[] flat = new boolean[mask.length * width];
        for (int r = 0; r < mask.length; r++) {
            if (mask[r].length != width) {
                throw new IllegalArgumentException("Valid mask row " + r + " has length "
                        + mask[r].length + ", expected " + width);
            }
            System.arraycopy(mask[r], 0, flat, r * width, width);
        }
        return flat;
    }

    private FieldMetadata toFieldMetadata(FieldRequest request) {
        GeoExtent extent = null;
        if (Stream.of(request.getMinLon(), request.getMinLat(), request.getMaxLon(), request.getMaxLat())
                .allMatch(Objects::nonNull)) {
            extent = GeoExtent.builder()
                    .minLon(request.getMinLon())
                    .minLat(request.getMinLat())
                    .maxLon(request.getMaxLon())
                    .maxLat(request.getMaxLat())
                    .build();
        }
        return FieldMetadata.builder()
                .fieldId(request.getFieldId())
                .cropType(request.getCropType())
                .fieldSizeHectares(request.getFieldSizeHectares())
                .analysisDate(request.getAnalysisDate())
                .extent(extent)
                .build();
    }
}
