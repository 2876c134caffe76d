package com.company.cropstress.domain.enums;

public enum Band {
    B01("Coastal aerosol"),
    B02("Blue"),
    B03("Green"),
    B04("Red"),
    B05("Red edge 1"),
    B06("Red edge 2"),
    B07("Red edge 3"),
    B08("NIR"),
    B8A("Narrow NIR"),
    B09("Water vapour"),
    B11("SWIR 1"),
    B12("SWIR 2"),
    VV("SAR VV backscatter"),
    VH("SAR VH backscatter");

    private final String description;

    Band(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static Band fromString(String band) {
        if (band == null) {
            throw new IllegalArgumentException("Band name is required");
        }
        return Band.valueOf(band.trim().toUpperCase());
    }
}
