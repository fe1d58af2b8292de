package de.bsommerfeld.upvision.engine.enhance;

import com.google.inject.Singleton;
import de.bsommerfeld.upvision.engine.ResourceUnavailableException;
import de.bsommerfeld.upvision.engine.device.DeviceCapabilities;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Default backend: resamples with Java2D. The checkpoint file is only checked
 * for readability; the scale factor comes from its name.
 */
@Singleton
public class Java2dEnhancementProvider implements EnhancementProvider {

    private static final Logger LOG = LoggerFactory.getLogger(Java2dEnhancementProvider.class);

    private final DeviceCapabilities capabilities;

    @Inject
    public Java2dEnhancementProvider(DeviceCapabilities capabilities) {
        this.capabilities = capabilities;
    }

    @Override
    public String name() {
        return "java2d";
    }

    @Override
    public EnhancementHandle construct(Path checkpoint, int scale, String device, boolean reducedPrecision)
            throws ResourceUnavailableException {
        if (!capabilities.isLibraryInstalled()) {
            throw new ResourceUnavailableException("Image processing library not available");
        }
        if (!Files.isReadable(checkpoint)) {
            throw new ResourceUnavailableException("Checkpoint not readable: " + checkpoint);
        }
        Object interpolation = reducedPrecision
                ? RenderingHints.VALUE_INTERPOLATION_BILINEAR
                : RenderingHints.VALUE_INTERPOLATION_BICUBIC;
        LOG.debug("Java2D handle for {} (x{}, {}, {})", checkpoint.getFileName(), scale, device,
                reducedPrecision ? "bilinear" : "bicubic");
        return new ResamplingHandle(interpolation);
    }

    /** Scales with a fixed interpolation hint. Shared with the passthrough provider. */
    static final class ResamplingHandle implements EnhancementHandle {

        private final Object interpolation;
        private volatile boolean closed;

        ResamplingHandle(Object interpolation) {
            this.interpolation = interpolation;
        }

        @Override
        public BufferedImage enhance(BufferedImage image, int scale) {
            if (closed) {
                throw new IllegalStateException("Enhancement handle already closed");
            }
            int width = Math.multiplyExact(image.getWidth(), scale);
            int height = Math.multiplyExact(image.getHeight(), scale);
            Math.multiplyExact(width, height);

            BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
            Graphics2D g = out.createGraphics();
            try {
                g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, interpolation);
                g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
                g.drawImage(image, 0, 0, width, height, null);
            } finally {
                g.dispose();
            }
            return out;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
