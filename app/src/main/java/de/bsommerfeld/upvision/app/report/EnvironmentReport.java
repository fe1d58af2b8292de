package de.bsommerfeld.upvision.app.report;

import de.bsommerfeld.upvision.core.domain.CheckpointInfo;
import de.bsommerfeld.upvision.core.domain.DeviceSummary;

import java.nio.file.Path;
import java.util.List;

/**
 * Text rendering of the runtime environment for the status line and
 * {@code --env-check}.
 */
public final class EnvironmentReport {

    static final String ABSENT = "—";
    static final String LIBRARY_MISSING =
            "Image processing library not installed. Install it to continue.";

    private EnvironmentReport() {
    }

    /**
     * One-line summary, e.g.
     * {@code Library 17.0.9 | Accelerator compiled: — | Accelerator available: no | Device: — | Checkpoint: x4}
     */
    public static String statusLine(DeviceSummary summary, String checkpoint) {
        if (!summary.libraryAvailable()) {
            return LIBRARY_MISSING;
        }
        return "Library " + orAbsent(summary.libraryVersion())
                + " | Accelerator compiled: " + orAbsent(summary.compiledAcceleratorVersion())
                + " | Accelerator available: " + (summary.acceleratorAvailable() ? "yes" : "no")
                + " | Device: " + orAbsent(summary.acceleratorName())
                + " | Checkpoint: " + (checkpoint == null || checkpoint.isBlank() ? "none selected" : checkpoint);
    }

    /** Multi-line report with the discovered checkpoints. */
    public static String describe(DeviceSummary summary, List<CheckpointInfo> checkpoints, Path directory) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== ENV CHECK ===").append(System.lineSeparator());
        sb.append("Java: ").append(System.getProperty("java.version")).append(" (")
                .append(System.getProperty("java.vendor")).append(')').append(System.lineSeparator());
        if (!summary.libraryAvailable()) {
            sb.append(LIBRARY_MISSING).append(System.lineSeparator());
        } else {
            sb.append("Library: ").append(orAbsent(summary.libraryVersion())).append(System.lineSeparator());
            sb.append("Accelerator (compiled): ").append(orAbsent(summary.compiledAcceleratorVersion()))
                    .append(System.lineSeparator());
            sb.append("Accelerator available: ").append(summary.acceleratorAvailable())
                    .append(System.lineSeparator());
            if (summary.acceleratorAvailable()) {
                sb.append("Accelerator: ").append(orAbsent(summary.acceleratorName())).append(System.lineSeparator());
            }
            sb.append("Preferred device: ").append(summary.preferredDevice()).append(System.lineSeparator());
        }
        sb.append("Checkpoints in ").append(directory).append(": ");
        if (checkpoints.isEmpty()) {
            sb.append("none").append(System.lineSeparator());
        } else {
            sb.append(checkpoints.size()).append(System.lineSeparator());
            for (CheckpointInfo c : checkpoints) {
                sb.append("  ").append(c.name()).append(" (x").append(c.scaleFactor()).append(')')
                        .append(System.lineSeparator());
            }
        }
        sb.append("=== END ENV CHECK ===");
        return sb.toString();
    }

    private static String orAbsent(String value) {
        return value == null || value.isBlank() ? ABSENT : value;
    }
}
