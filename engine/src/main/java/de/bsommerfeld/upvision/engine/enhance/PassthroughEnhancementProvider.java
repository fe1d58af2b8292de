package de.bsommerfeld.upvision.engine.enhance;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.RenderingHints;
import java.nio.file.Path;

/**
 * Backend for TEST mode. Skips all checks and scales with nearest-neighbour,
 * so batches run without checkpoints or graphics support.
 */
@Singleton
public class PassthroughEnhancementProvider implements EnhancementProvider {

    private static final Logger LOG = LoggerFactory.getLogger(PassthroughEnhancementProvider.class);

    public PassthroughEnhancementProvider() {
        LOG.warn("==================================================");
        LOG.warn("  TEST MODE: passthrough enhancement is active");
        LOG.warn("  Output images are NOT enhanced");
        LOG.warn("==================================================");
    }

    @Override
    public String name() {
        return "passthrough";
    }

    @Override
    public EnhancementHandle construct(Path checkpoint, int scale, String device, boolean reducedPrecision) {
        return new Java2dEnhancementProvider.ResamplingHandle(RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
    }
}
