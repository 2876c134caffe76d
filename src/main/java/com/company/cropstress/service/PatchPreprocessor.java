package com.company.cropstress.service;

import com.company.cropstress.config.PipelineProperties;
import com.company.cropstress.domain.IndexStack;
import com.company.cropstress.domain.Patch;
import com.company.cropstress.domain.PatchAnchor;
import com.company.cropstress.domain.PatchSet;
import com.company.cropstress.domain.RasterGrid;
import com.company.cropstress.domain.enums.PatchStatus;
import com.company.cropstress.domain.enums.VegetationIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts the index stack into overlapping square patches in raster order (row-major over anchors).
 * Windows that would cross the field edge are not generated.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PatchPreprocessor {

    private static final VegetationIndex[] CHANNELS = VegetationIndex.values();

    private final PipelineProperties properties;

    public PatchSet extract(IndexStack indexStack) {
        return extract(indexStack, properties.getPatchSize(), properties.getStride());
    }

    public PatchSet extract(IndexStack indexStack, int size, int stride) {
        if (size <= 0 || stride <= 0) {
            throw new IllegalArgumentException("Patch size and stride must be positive, got "
                    + size + "/" + stride);
        }

        List<Integer> rowAnchors = anchors(indexStack.getHeight(), size, stride);
        List<Integer> colAnchors = anchors(indexStack.getWidth(), size, stride);

        int scenes = indexStack.sceneCount();
        RasterGrid[][] grids = new RasterGrid[scenes][CHANNELS.length];
        for (int t = 0; t < scenes; t++) {
            for (int ch = 0; ch < CHANNELS.length; ch++) {
                grids[t][ch] = indexStack.grid(t, CHANNELS[ch]);
            }
        }

        List<Patch> patches = new ArrayList<>(rowAnchors.size() * colAnchors.size());
        int ordinal = 0;
        for (int row : rowAnchors) {
            for (int col : colAnchors) {
                patches.add(cut(ordinal++, new PatchAnchor(row, col, size), grids));
            }
        }

        long excluded = patches.stream().filter(p -> !p.getStatus().isUsable()).count();
        log.debug("Generated {} patches ({}x{} anchors, size={}, stride={}), {} with insufficient data",
                patches.size(), rowAnchors.size(), colAnchors.size(), size, stride, excluded);

        return new PatchSet(List.copyOf(patches), rowAnchors.size(), colAnchors.size(), size, stride);
    }

    static List<Integer> anchors(int extent, int size, int stride) {
        List<Integer> anchors = new ArrayList<>();
        for (int a = 0; a + size <= extent; a += stride) {
            anchors.add(a);
        }
        return anchors;
    }

    private Patch cut(int ordinal, PatchAnchor anchor, RasterGrid[][] grids) {
        int size = anchor.getSize();
        int timesteps = grids.length;
        double[][][][] tensor = new double[timesteps][size][size][CHANNELS.length];
        boolean[] validTimesteps = new boolean[timesteps];
        int invalid = 0;

        for (int t = 0; t < timesteps; t++) {
            boolean anyFinite = false;
            for (int r = 0; r < size; r++) {
                for (int c = 0; c < size; c++) {
                    for (int ch = 0; ch < CHANNELS.length; ch++) {
                        double v = grids[t][ch].get(anchor.getRow() + r, anchor.getCol() + c);
                        tensor[t][r][c][ch] = v;
                        if (!Double.isNaN(v)) {
                            anyFinite = true;
                        }
                    }
                }
            }
            validTimesteps[t] = anyFinite;
            if (!anyFinite) {
                invalid++;
            }
        }

        PatchStatus status = invalid * 2 > timesteps ? PatchStatus.INSUFFICIENT_DATA : PatchStatus.VALID;
        return new Patch(ordinal, anchor, tensor, validTimesteps, status);
    }
}
