package de.bsommerfeld.upvision.engine.image;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * File extensions accepted as batch input.
 */
public final class ImageFormats {

    public static final Set<String> SUPPORTED = Set.of("png", "jpg", "jpeg", "bmp", "tif", "tiff", "webp");

    private ImageFormats() {
    }

    /** Lower-cased extension without dot, or an empty string. */
    public static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static boolean isSupported(Path file) {
        return Files.isRegularFile(file) && SUPPORTED.contains(extensionOf(file));
    }
}
