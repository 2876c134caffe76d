package com.company.cropstress.domain;

import com.company.cropstress.exception.InvalidRasterStackException;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scenes of one field, ordered by acquisition instant and sharing one pixel grid.
 */
@Getter
public final class RasterStack {

    private final List<Scene> scenes;
    private final int height;
    private final int width;

    private RasterStack(List<Scene> scenes, int height, int width) {
        this.scenes = scenes;
        this.height = height;
        this.width = width;
    }

    public static RasterStack of(List<Scene> scenes) {
        if (scenes == null || scenes.isEmpty()) {
            throw new InvalidRasterStackException("Raster stack contains no scenes");
        }

        List<Scene> ordered = new ArrayList<>(scenes);
        ordered.sort(Comparator.comparing(Scene::getAcquiredAt));

        Scene first = ordered.get(0);
        for (int i = 0; i < ordered.size(); i++) {
            Scene scene = ordered.get(i);
            if (scene.getHeight() != first.getHeight() || scene.getWidth() != first.getWidth()) {
                throw new InvalidRasterStackException(String.format(
                        "Scene %s is %dx%d, expected %dx%d", scene.getAcquiredAt(),
                        scene.getHeight(), scene.getWidth(), first.getHeight(), first.getWidth()));
            }
            if (i > 0 && scene.getAcquiredAt().equals(ordered.get(i - 1).getAcquiredAt())) {
                throw new InvalidRasterStackException("Duplicate acquisition instant " + scene.getAcquiredAt());
            }
        }

        return new RasterStack(List.copyOf(ordered), first.getHeight(), first.getWidth());
    }

    public int sceneCount() {
        return scenes.size();
    }

    public List<Instant> acquisitionTimes() {
        return scenes.stream().map(Scene::getAcquiredAt).toList();
    }

    public Instant firstAcquisition() {
        return scenes.get(0).getAcquiredAt();
    }

    public Instant lastAcquisition() {
        return scenes.get(scenes.size() - 1).getAcquiredAt();
    }
}
