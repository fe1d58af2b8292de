package de.bsommerfeld.upvision.app.results;

import de.bsommerfeld.upvision.engine.image.ImageFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Pairs enhanced outputs with their source images for side-by-side review.
 *
 * <p>
 * Only the exact {@code _x<digits>} suffix this application appends is
 * recognized. {@code photo_x4.jpg} pairs with {@code photo.jpg} (extension
 * compared case-insensitively); {@code photo_final.jpg} pairs with nothing.
 */
public final class ResultPairing {

    private static final Logger LOG = LoggerFactory.getLogger(ResultPairing.class);

    private static final Pattern SCALE_SUFFIX = Pattern.compile("^(.+)_x\\d+$");

    private ResultPairing() {
    }

    /**
     * Finds the original of {@code processed}, first among {@code candidates}
     * (the inputs of the last batch), then next to the processed file.
     */
    public static Optional<Path> findOriginal(Path processed, Collection<Path> candidates) {
        String name = processed.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot + 1) : "";

        Matcher m = SCALE_SUFFIX.matcher(stem);
        if (!m.matches()) {
            return Optional.empty();
        }
        String originalStem = m.group(1);

        for (Path candidate : candidates) {
            if (isOriginal(candidate, originalStem, extension) && !candidate.equals(processed)) {
                return Optional.of(candidate);
            }
        }

        Path directory = processed.toAbsolutePath().getParent();
        if (directory == null || !Files.isDirectory(directory)) {
            return Optional.empty();
        }
        try (Stream<Path> siblings = Files.list(directory)) {
            return siblings.filter(p -> isOriginal(p, originalStem, extension))
                    .sorted()
                    .findFirst();
        } catch (IOException e) {
            LOG.warn("Could not search {} for the original of {}: {}", directory, name, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Lists image files in {@code directory}, sorted by name. A missing
     * directory yields an empty list.
     */
    public static List<Path> listProcessed(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return new ArrayList<>();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(ImageFormats::isSupported)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    private static boolean isOriginal(Path candidate, String stem, String extension) {
        Path fileName = candidate.getFileName();
        if (fileName == null || !Files.isRegularFile(candidate)) {
            return false;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        String candidateStem = dot > 0 ? name.substring(0, dot) : name;
        String candidateExtension = dot > 0 ? name.substring(dot + 1) : "";
        return candidateStem.equals(stem) && candidateExtension.equalsIgnoreCase(extension);
    }
}
