package de.bsommerfeld.upvision.core.event;

import de.bsommerfeld.upvision.core.domain.BatchResult;

/**
 * Events produced by a batch run and consumed by the observing control
 * surface. Consumers must process them in the order they were produced;
 * {@link Done} is always the last event of a run.
 */
public interface BatchEvent {

    /** A single log line, already formatted for display. */
    record Log(String text) implements BatchEvent {
    }

    /**
     * Emitted exactly once per item after that item's log lines.
     *
     * @param current   1-based index of the finished item
     * @param total     number of items in the run
     * @param itemLabel display name of the item
     */
    record Progress(int current, int total, String itemLabel) implements BatchEvent {

        /** Completion in percent, {@code 0} for an empty run. */
        public double percent() {
            return total == 0 ? 0.0 : (current * 100.0) / total;
        }
    }

    /** Terminal event carrying the same result the runner returns. */
    record Done(BatchResult result) implements BatchEvent {
    }

    /** A failure that aborted the whole run before any item was touched. */
    record Error(String message) implements BatchEvent {
    }
}
