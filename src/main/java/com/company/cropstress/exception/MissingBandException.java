package com.company.cropstress.exception;

import com.company.cropstress.domain.enums.Band;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A band required by the index table is absent from at least one scene.
 */
@Getter
public class MissingBandException extends RuntimeException {

    private final Map<Instant, Set<Band>> missingByScene;

    public MissingBandException(Map<Instant, Set<Band>> missingByScene) {
        super("Required bands missing: " + describe(missingByScene));
        this.missingByScene = Map.copyOf(missingByScene);
    }

    private static String describe(Map<Instant, Set<Band>> missingByScene) {
        return missingByScene.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + " " + e.getValue())
                .collect(Collectors.joining("; "));
    }
}
