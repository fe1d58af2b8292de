package de.bsommerfeld.upvision.engine;

/**
 * Thrown when a checkpoint name is not part of the last discovered set.
 */
public class CheckpointNotFoundException extends EngineException {

    private final String checkpointName;

    public CheckpointNotFoundException(String checkpointName, String directory) {
        super("Checkpoint '" + checkpointName + "' not found in " + directory);
        this.checkpointName = checkpointName;
    }

    public String getCheckpointName() {
        return checkpointName;
    }
}
