package de.bsommerfeld.upvision.engine.image;

import java.nio.file.Path;

/**
 * Naming rule for enhanced outputs: {@code <stem>_x<scale><ext>}.
 */
public final class OutputNaming {

    private OutputNaming() {
    }

    /**
     * {@code photo.jpg} at scale 4 becomes {@code photo_x4.jpg}; a file
     * without extension keeps none.
     */
    public static String outputFileName(Path input, int scale) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return name + "_x" + scale;
        }
        return name.substring(0, dot) + "_x" + scale + name.substring(dot);
    }

    public static Path outputPath(Path input, Path destination, int scale) {
        return destination.resolve(outputFileName(input, scale));
    }
}
