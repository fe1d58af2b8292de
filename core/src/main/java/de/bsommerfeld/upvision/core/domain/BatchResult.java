package de.bsommerfeld.upvision.core.domain;

import java.util.Locale;

/**
 * Aggregate outcome of one batch run. Created once when the run ends.
 *
 * @param total           number of items the run was asked to process
 * @param succeeded       items written to the destination
 * @param failed          items that failed during decode, enhance or encode
 * @param durationSeconds wall-clock time from entry to completion
 */
public record BatchResult(int total, int succeeded, int failed, double durationSeconds) {

    public BatchResult {
        if (total < 0 || succeeded < 0 || failed < 0) {
            throw new IllegalArgumentException("Counts must not be negative");
        }
        if (succeeded + failed != total) {
            throw new IllegalArgumentException(
                    "succeeded (" + succeeded + ") + failed (" + failed + ") != total (" + total + ")");
        }
    }

    /** Result of a run that processed nothing. */
    public static BatchResult empty(double durationSeconds) {
        return new BatchResult(0, 0, 0, durationSeconds);
    }

    /** True if at least one item was written and none failed. */
    public boolean isCleanSuccess() {
        return succeeded > 0 && failed == 0;
    }

    /** Human readable summary, e.g. {@code Processed: 2/3 | Failed: 1 | Time: 4.20s}. */
    public String summaryLine() {
        return String.format(Locale.ROOT, "Processed: %d/%d | Failed: %d | Time: %.2fs",
                succeeded, total, failed, durationSeconds);
    }
}
