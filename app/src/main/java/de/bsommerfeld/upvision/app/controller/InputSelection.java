package de.bsommerfeld.upvision.app.controller;

import de.bsommerfeld.upvision.engine.image.ImageFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns user-selected files and folders into a batch item list. Folders
 * contribute their supported images (non-recursive, sorted by name). The
 * result keeps selection order and contains every file once.
 */
public final class InputSelection {

    private static final Logger LOG = LoggerFactory.getLogger(InputSelection.class);

    private InputSelection() {
    }

    public static List<Path> expand(Collection<Path> selection) throws IOException {
        Set<Path> items = new LinkedHashSet<>();
        for (Path path : selection) {
            Path absolute = path.toAbsolutePath().normalize();
            if (Files.isDirectory(absolute)) {
                items.addAll(imagesIn(absolute));
            } else if (ImageFormats.isSupported(absolute)) {
                items.add(absolute);
            } else {
                LOG.warn("Skipping unsupported or missing input: {}", path);
            }
        }
        return new ArrayList<>(items);
    }

    private static List<Path> imagesIn(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(ImageFormats::isSupported)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }
}
