package de.bsommerfeld.upvision.app.selfcheck;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * {@link SentinelStore} backed by a file. The content is the completion
 * timestamp; only its presence matters.
 */
public class FileSentinelStore implements SentinelStore {

    private final Path file;

    public FileSentinelStore(Path file) {
        this.file = file;
    }

    @Override
    public boolean exists() {
        return Files.exists(file);
    }

    @Override
    public void write() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, Instant.now().toString());
    }

    @Override
    public Path location() {
        return file;
    }
}
