package com.company.cropstress.domain;

import com.company.cropstress.domain.enums.PatchStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Output of the patch preprocessor: every generated patch in raster order plus the grid geometry.
 */
@Getter
@AllArgsConstructor
public class PatchSet {
    private final List<Patch> patches;
    private final int gridRows;
    private final int gridCols;
    private final int patchSize;
    private final int stride;

    public List<Patch> valid() {
        return patches.stream().filter(p -> p.getStatus() == PatchStatus.VALID).toList();
    }

    public List<Patch> excluded() {
        return patches.stream().filter(p -> p.getStatus() != PatchStatus.VALID).toList();
    }

    /**
     * Rows of the field covered by the union of all footprints.
     */
    public int coveredHeight() {
        return gridRows == 0 ? 0 : (gridRows - 1) * stride + patchSize;
    }

    public int coveredWidth() {
        return gridCols == 0 ? 0 : (gridCols - 1) * stride + patchSize;
    }
}
