package com.company.cropstress.domain;

import com.company.cropstress.domain.enums.VegetationIndex;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

@Getter
@AllArgsConstructor
public final class IndexRaster {
    private final VegetationIndex index;
    private final Instant acquiredAt;
    private final RasterGrid grid;
}
