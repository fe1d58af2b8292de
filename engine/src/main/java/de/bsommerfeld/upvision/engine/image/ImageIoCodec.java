package de.bsommerfeld.upvision.engine.image;

import com.google.inject.Singleton;
import de.bsommerfeld.upvision.engine.ItemProcessingException;
import de.bsommerfeld.upvision.engine.ItemProcessingException.Stage;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Iterator;

/**
 * {@link ImageCodec} backed by {@link ImageIO}. JPEG output is written at a
 * fixed quality of {@value #JPEG_QUALITY}.
 */
@Singleton
public class ImageIoCodec implements ImageCodec {

    static final float JPEG_QUALITY = 0.95f;

    @Override
    public BufferedImage decode(Path file) throws ItemProcessingException {
        if (!Files.isRegularFile(file)) {
            throw new ItemProcessingException(Stage.DECODE, file, "File not found");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(file.toFile());
        } catch (IOException e) {
            throw new ItemProcessingException(Stage.DECODE, file, "Unreadable image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ItemProcessingException(Stage.DECODE, file, "Unsupported or corrupt image");
        }
        return toRgb(image);
    }

    @Override
    public void encode(BufferedImage image, Path file) throws ItemProcessingException {
        String format = ImageFormats.extensionOf(file);
        Iterator<ImageWriter> writers = ImageIO.getImageWritersBySuffix(format);
        if (!writers.hasNext()) {
            throw new ItemProcessingException(Stage.ENCODE, file, "No image writer for '" + format + "'");
        }
        ImageWriter writer = writers.next();
        try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
                ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (param.canWriteCompressed() && isJpeg(format)) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(JPEG_QUALITY);
            }
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException e) {
            throw new ItemProcessingException(Stage.ENCODE, file, "Write failed: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
    }

    private static boolean isJpeg(String format) {
        return "jpg".equals(format) || "jpeg".equals(format);
    }

    private static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
