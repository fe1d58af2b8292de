package de.bsommerfeld.upvision.engine.checkpoint;

import com.google.inject.Singleton;
import de.bsommerfeld.upvision.core.config.EngineConfig;
import de.bsommerfeld.upvision.core.domain.CheckpointInfo;
import de.bsommerfeld.upvision.engine.CheckpointFileMissingException;
import de.bsommerfeld.upvision.engine.CheckpointNotFoundException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers checkpoint files in a directory and resolves them by name.
 *
 * <h3>Scale inference</h3>
 * The first case-insensitive {@code x<digits>} token in the file name is the
 * output scale ({@code RealESRGAN_x2plus.pth} → 2, {@code ModelX8Plus_x2.pth}
 * → 8). Without a token, or with one that does not parse to a positive
 * number, the scale defaults to {@value #DEFAULT_SCALE}.
 *
 * <h3>Snapshot semantics</h3>
 * Every {@link #discover()} builds a complete new set and publishes it with a
 * single volatile write. Readers always see one whole discovery result, never a
 * mix of two.
 */
@Singleton
public class CheckpointRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(CheckpointRegistry.class);

    public static final int DEFAULT_SCALE = 4;

    private static final Pattern SCALE_PATTERN = Pattern.compile("x(\\d+)", Pattern.CASE_INSENSITIVE);

    private final Path directory;
    private final String extension;

    private volatile Snapshot snapshot;

    private record Snapshot(List<CheckpointInfo> checkpoints, Map<String, CheckpointInfo> byName) {
    }

    @Inject
    public CheckpointRegistry(EngineConfig config) {
        this(config.checkpointDirectory(), config.getCheckpointExtension());
    }

    /**
     * A {@code directory} that exists but is not a directory is only logged;
     * discovery then finds nothing.
     */
    public CheckpointRegistry(Path directory, String extension) {
        if (Files.exists(directory) && !Files.isDirectory(directory)) {
            LOG.warn("Checkpoint path {} is not a directory, no checkpoints will be found", directory);
        }
        this.directory = directory;
        this.extension = extension.toLowerCase(Locale.ROOT);
    }

    /**
     * Scans the directory and replaces the cached set. A missing directory
     * yields an empty set so the application stays usable without checkpoints.
     *
     * @return checkpoints sorted by file name
     */
    public List<CheckpointInfo> discover() {
        List<CheckpointInfo> found = scan();
        Map<String, CheckpointInfo> byName = new LinkedHashMap<>();
        for (CheckpointInfo info : found) {
            byName.putIfAbsent(info.name(), info);
        }
        this.snapshot = new Snapshot(List.copyOf(found), Collections.unmodifiableMap(byName));
        LOG.info("Discovered {} checkpoint(s) in {}", found.size(), directory);
        return this.snapshot.checkpoints();
    }

    /** Returns the last discovered set, discovering first if nothing ran yet. */
    public List<CheckpointInfo> list() {
        return current().checkpoints();
    }

    /**
     * Looks up a checkpoint by name in the last discovered set.
     *
     * @throws CheckpointNotFoundException    if the name is unknown
     * @throws CheckpointFileMissingException if the file was removed after
     *                                        discovery
     */
    public CheckpointInfo resolve(String name) throws CheckpointNotFoundException, CheckpointFileMissingException {
        CheckpointInfo info = current().byName().get(name);
        if (info == null) {
            throw new CheckpointNotFoundException(name, directory.toString());
        }
        if (!Files.exists(info.location())) {
            throw new CheckpointFileMissingException(info.location());
        }
        return info;
    }

    public Path directory() {
        return directory;
    }

    /**
     * Derives the scale factor from a checkpoint file name.
     *
     * @return first {@code x<digits>} value, or {@value #DEFAULT_SCALE}
     */
    public static int inferScale(String fileName) {
        Matcher m = SCALE_PATTERN.matcher(fileName);
        if (m.find()) {
            try {
                int scale = Integer.parseInt(m.group(1));
                if (scale > 0) {
                    return scale;
                }
            } catch (NumberFormatException e) {
                LOG.debug("Scale token in '{}' does not fit an int, using default", fileName);
            }
        }
        return DEFAULT_SCALE;
    }

    private Snapshot current() {
        Snapshot s = snapshot;
        if (s == null) {
            discover();
            s = snapshot;
        }
        return s;
    }

    private List<CheckpointInfo> scan() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(this::hasCheckpointExtension)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .map(this::toCheckpoint)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            LOG.warn("Failed to list checkpoints in {}: {}", directory, e.getMessage());
            return List.of();
        }
    }

    private boolean hasCheckpointExtension(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension);
    }

    private CheckpointInfo toCheckpoint(Path file) {
        String fileName = file.getFileName().toString();
        String name = fileName.substring(0, fileName.length() - extension.length());
        return new CheckpointInfo(name, file, inferScale(fileName));
    }
}
