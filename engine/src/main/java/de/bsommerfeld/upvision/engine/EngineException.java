package de.bsommerfeld.upvision.engine;

/**
 * Base type for recoverable engine failures. None of these terminate the
 * process; callers report them and carry on.
 */
public class EngineException extends Exception {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
