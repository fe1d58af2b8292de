package de.bsommerfeld.upvision.engine.enhance;

import com.google.inject.Singleton;
import de.bsommerfeld.upvision.core.domain.CheckpointInfo;
import de.bsommerfeld.upvision.engine.ResourceUnavailableException;
import de.bsommerfeld.upvision.engine.device.DeviceProbe;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Holds at most one live {@link Enhancer}, keyed by checkpoint name and
 * normalized device.
 *
 * <p>
 * A request for the current key returns the same instance. A request for a
 * different key closes the current enhancer <b>before</b> constructing the
 * new one, so two models never occupy accelerator memory at the same time.
 * If construction fails the slot stays empty.
 */
@Singleton
public class EnhancerCache {

    private static final Logger LOG = LoggerFactory.getLogger(EnhancerCache.class);

    private final EnhancementProvider provider;
    private final DeviceProbe deviceProbe;

    private Enhancer current;

    @Inject
    public EnhancerCache(EnhancementProvider provider, DeviceProbe deviceProbe) {
        this.provider = provider;
        this.deviceProbe = deviceProbe;
    }

    /**
     * Returns an enhancer for {@code checkpoint} on {@code device}, building
     * one if the cached enhancer does not match.
     *
     * @throws ResourceUnavailableException if the backend cannot construct the
     *                                      enhancer
     */
    public synchronized Enhancer ensure(CheckpointInfo checkpoint, String device) throws ResourceUnavailableException {
        String normalized = deviceProbe.normalize(device);
        if (current != null && current.matches(checkpoint.name(), normalized)) {
            return current;
        }

        discardCurrent();

        boolean reduced = deviceProbe.isAccelerated(normalized);
        LOG.info("Loading checkpoint '{}' (x{}) on {} via {}", checkpoint.name(), checkpoint.scaleFactor(),
                normalized, provider.name());
        EnhancementHandle handle;
        try {
            handle = provider.construct(checkpoint.location(), checkpoint.scaleFactor(), normalized, reduced);
        } catch (RuntimeException e) {
            throw new ResourceUnavailableException("Failed to load checkpoint '" + checkpoint.name() + "': "
                    + e.getMessage(), e);
        }
        current = new Enhancer(checkpoint, normalized, reduced, handle);
        return current;
    }

    public synchronized Optional<Enhancer> current() {
        return Optional.ofNullable(current);
    }

    /** Closes and drops the cached enhancer, if any. */
    public synchronized void invalidate() {
        discardCurrent();
    }

    private void discardCurrent() {
        if (current == null) {
            return;
        }
        Enhancer old = current;
        current = null;
        try {
            old.close();
            LOG.debug("Released {}", old);
        } catch (RuntimeException e) {
            LOG.warn("Failed to release {}: {}", old, e.getMessage());
        }
    }
}
