package de.bsommerfeld.upvision.engine.enhance;

import de.bsommerfeld.upvision.engine.ResourceUnavailableException;

import java.nio.file.Path;

/**
 * Factory for {@link EnhancementHandle}s. Construction is expensive and is
 * therefore only invoked by the {@link EnhancerCache}.
 */
public interface EnhancementProvider {

    /** Short backend name for log output. */
    String name();

    /**
     * Loads the checkpoint at {@code checkpoint} for the given device.
     *
     * @param reducedPrecision whether to trade quality for speed; set for
     *                         accelerated devices
     * @throws ResourceUnavailableException if the backend or the checkpoint
     *                                      cannot be loaded
     */
    EnhancementHandle construct(Path checkpoint, int scale, String device, boolean reducedPrecision)
            throws ResourceUnavailableException;
}
