package de.bsommerfeld.upvision.engine;

import java.nio.file.Path;

/**
 * Thrown when the output directory of a batch cannot be created.
 */
public class DirectoryCreationException extends EngineException {

    public DirectoryCreationException(Path directory, Throwable cause) {
        super("Cannot create output directory " + directory + ": " + cause.getMessage(), cause);
    }
}
