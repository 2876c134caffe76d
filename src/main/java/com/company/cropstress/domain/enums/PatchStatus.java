package com.company.cropstress.domain.enums;

public enum PatchStatus {
    VALID("Patch is encoded, clustered and scored"),
    INSUFFICIENT_DATA("Patch excluded: too few valid timesteps");

    private final String description;

    PatchStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isUsable() {
        return this == VALID;
    }
}
