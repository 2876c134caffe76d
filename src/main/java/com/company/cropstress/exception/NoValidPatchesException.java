package com.company.cropstress.exception;

public class NoValidPatchesException extends RuntimeException {
    public NoValidPatchesException(String fieldId, int totalPatches) {
        super("No valid patches for field " + fieldId + " (" + totalPatches + " generated)");
    }
}
