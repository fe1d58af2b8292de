package de.bsommerfeld.upvision.app.controller;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything needed to start one batch.
 *
 * @param items          input images in processing order
 * @param destination    output directory, created if missing
 * @param checkpointName checkpoint to use; {@code null} picks the first
 *                       discovered one
 * @param device         device string, normalized later; {@code null} means
 *                       auto
 */
public record BatchRequest(List<Path> items, Path destination, String checkpointName, String device) {

    public BatchRequest {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
