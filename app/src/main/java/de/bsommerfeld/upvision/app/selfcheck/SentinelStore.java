package de.bsommerfeld.upvision.app.selfcheck;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Marker that the first-run self-check has passed on this installation.
 */
public interface SentinelStore {

    boolean exists();

    void write() throws IOException;

    Path location();
}
