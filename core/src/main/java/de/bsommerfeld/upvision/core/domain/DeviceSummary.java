package de.bsommerfeld.upvision.core.domain;

/**
 * Snapshot of the enhancement runtime as seen by a single probe. Optional
 * values are {@code null} when unknown.
 *
 * @param libraryAvailable           whether the enhancement library can be used
 * @param libraryVersion             version string of the library, if known
 * @param compiledAcceleratorVersion accelerator backend the library was built
 *                                   against, if any
 * @param acceleratorAvailable       whether an accelerator is usable right now
 * @param acceleratorName            display name of the accelerator, if
 *                                   available
 */
public record DeviceSummary(boolean libraryAvailable,
        String libraryVersion,
        String compiledAcceleratorVersion,
        boolean acceleratorAvailable,
        String acceleratorName) {

    public static final String ACCELERATOR = "cuda";
    public static final String BASELINE = "cpu";

    /** Summary reported when the enhancement library cannot be loaded at all. */
    public static DeviceSummary unavailable() {
        return new DeviceSummary(false, null, null, false, null);
    }

    /** Returns {@value #ACCELERATOR} if an accelerator is usable, else {@value #BASELINE}. */
    public String preferredDevice() {
        return acceleratorAvailable ? ACCELERATOR : BASELINE;
    }
}
