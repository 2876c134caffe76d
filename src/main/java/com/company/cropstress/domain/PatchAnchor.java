package com.company.cropstress.domain;

import lombok.Value;

/**
 * Top-left pixel of a patch footprint on the field grid.
 */
@Value
public class PatchAnchor {
    int row;
    int col;
    int size;

    public boolean contains(int pixelRow, int pixelCol) {
        return pixelRow >= row && pixelRow < row + size
                && pixelCol >= col && pixelCol < col + size;
    }
}
