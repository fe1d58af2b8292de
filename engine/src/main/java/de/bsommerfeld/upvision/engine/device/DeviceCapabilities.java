package de.bsommerfeld.upvision.engine.device;

import java.util.Optional;

/**
 * Raw view of the enhancement runtime. Implementations answer each question
 * independently; {@link DeviceProbe} turns the answers into a consistent
 * summary and shields callers from lookup failures.
 */
public interface DeviceCapabilities {

    /** Whether the enhancement library can be loaded at all. */
    boolean isLibraryInstalled();

    /** Whether an accelerator is usable right now. Only meaningful if the library is installed. */
    boolean isAcceleratorAvailable();

    /** Display name of the accelerator. May throw if the driver misbehaves. */
    Optional<String> acceleratorName();

    Optional<String> libraryVersion();

    /** Accelerator backend the library was built for, if any. */
    Optional<String> compiledAcceleratorVersion();
}
