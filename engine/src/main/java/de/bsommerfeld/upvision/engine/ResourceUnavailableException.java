package de.bsommerfeld.upvision.engine;

/**
 * Thrown when the enhancement backend cannot be initialized, e.g. because its
 * library is missing or the checkpoint cannot be loaded.
 */
public class ResourceUnavailableException extends EngineException {

    public ResourceUnavailableException(String message) {
        super(message);
    }

    public ResourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
