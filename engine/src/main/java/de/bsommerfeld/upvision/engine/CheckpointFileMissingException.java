package de.bsommerfeld.upvision.engine;

import java.nio.file.Path;

/**
 * Thrown when a known checkpoint's file disappeared after discovery.
 */
public class CheckpointFileMissingException extends EngineException {

    private final Path location;

    public CheckpointFileMissingException(Path location) {
        super("Checkpoint file missing: " + location);
        this.location = location;
    }

    public Path getLocation() {
        return location;
    }
}
