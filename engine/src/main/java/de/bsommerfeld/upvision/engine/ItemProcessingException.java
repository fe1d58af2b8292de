package de.bsommerfeld.upvision.engine;

import java.nio.file.Path;

/**
 * Failure of a single batch item. Recorded by the batch runner and never
 * allowed to abort the rest of the batch.
 */
public class ItemProcessingException extends EngineException {

    /** Step of the per-item pipeline that failed. */
    public enum Stage {
        DECODE,
        ENHANCE,
        ENCODE
    }

    private final Stage stage;
    private final Path item;

    public ItemProcessingException(Stage stage, Path item, String message) {
        super(message);
        this.stage = stage;
        this.item = item;
    }

    public ItemProcessingException(Stage stage, Path item, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.item = item;
    }

    public Stage getStage() {
        return stage;
    }

    public Path getItem() {
        return item;
    }
}
