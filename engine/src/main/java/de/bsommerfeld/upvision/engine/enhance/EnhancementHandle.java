package de.bsommerfeld.upvision.engine.enhance;

import java.awt.image.BufferedImage;

/**
 * A loaded enhancement model. Owns whatever native or heap resources the
 * backend needs and releases them on {@link #close()}.
 */
public interface EnhancementHandle extends AutoCloseable {

    /**
     * Produces an image {@code scale} times the size of {@code image}.
     * Implementations are not required to be thread-safe.
     */
    BufferedImage enhance(BufferedImage image, int scale);

    @Override
    void close();
}
