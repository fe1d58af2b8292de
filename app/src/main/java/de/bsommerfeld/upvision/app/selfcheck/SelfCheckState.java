package de.bsommerfeld.upvision.app.selfcheck;

/**
 * Lifecycle of the first-run self-check.
 */
public enum SelfCheckState {
    IDLE,
    CHECKING,
    /** Ran but had nothing to do (no sample or no checkpoint). Retried next start. */
    SKIPPED,
    AUTO_RUNNING,
    SUCCESS,
    SENTINEL_WRITTEN,
    FAILURE,
    SHUTDOWN_SCHEDULED
}
