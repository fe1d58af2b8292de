package de.bsommerfeld.upvision.engine.image;

import de.bsommerfeld.upvision.engine.ItemProcessingException;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Reads and writes image files. Decoded images are always 3-channel RGB.
 */
public interface ImageCodec {

    /**
     * @throws ItemProcessingException with stage {@code DECODE} if the file
     *                                 is missing, unreadable or not an image
     */
    BufferedImage decode(Path file) throws ItemProcessingException;

    /**
     * Writes {@code image} in the format implied by the file extension,
     * replacing an existing file.
     *
     * @throws ItemProcessingException with stage {@code ENCODE}
     */
    void encode(BufferedImage image, Path file) throws ItemProcessingException;
}
