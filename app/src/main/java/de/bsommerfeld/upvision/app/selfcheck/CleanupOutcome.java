package de.bsommerfeld.upvision.app.selfcheck;

import java.nio.file.Path;

/**
 * Result of removing one self-check output.
 *
 * @param reason failure description, {@code null} when removed
 */
public record CleanupOutcome(Path path, boolean removed, String reason) {

    public static CleanupOutcome removed(Path path) {
        return new CleanupOutcome(path, true, null);
    }

    public static CleanupOutcome failed(Path path, String reason) {
        return new CleanupOutcome(path, false, reason);
    }
}
