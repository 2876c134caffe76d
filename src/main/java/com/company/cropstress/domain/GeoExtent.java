package com.company.cropstress.domain;

import lombok.Builder;
import lombok.Value;

/**
 * WGS84 bounding box of the field.
 */
@Value
@Builder
public class GeoExtent {
    double minLon;
    double minLat;
    double maxLon;
    double maxLat;

    public double centerLon() {
        return (minLon + maxLon) / 2.0;
    }

    public double centerLat() {
        return (minLat + maxLat) / 2.0;
    }
}
