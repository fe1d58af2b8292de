package de.bsommerfeld.upvision.core.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A checkpoint file discovered on disk together with the output scale it
 * produces.
 *
 * @param name        file name without extension, used as lookup key
 * @param location    absolute or relative path to the checkpoint file
 * @param scaleFactor output magnification, always positive
 */
public record CheckpointInfo(String name, Path location, int scaleFactor) {

    public CheckpointInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(location, "location");
        if (scaleFactor <= 0) {
            throw new IllegalArgumentException("Scale factor must be positive: " + scaleFactor);
        }
    }
}
