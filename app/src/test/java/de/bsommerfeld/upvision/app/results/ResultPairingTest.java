package de.bsommerfeld.upvision.app.results;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResultPairingTest {

    @TempDir
    Path dir;

    @Test
    void findOriginal_shouldPreferBatchInputs() throws IOException {
        Path inputs = Files.createDirectory(dir.resolve("in"));
        Path outputs = Files.createDirectory(dir.resolve("out"));
        Path original = Files.createFile(inputs.resolve("photo.jpg"));
        Path processed = Files.createFile(outputs.resolve("photo_x4.jpg"));

        assertEquals(Optional.of(original), ResultPairing.findOriginal(processed, List.of(original)));
    }

    @Test
    void findOriginal_shouldFallBackToSameDirectory() throws IOException {
        Path original = Files.createFile(dir.resolve("photo.JPG"));
        Path processed = Files.createFile(dir.resolve("photo_x2.jpg"));

        assertEquals(Optional.of(original), ResultPairing.findOriginal(processed, List.of()));
    }

    @Test
    void findOriginal_shouldRequireExactStem() throws IOException {
        Files.createFile(dir.resolve("my_photo.jpg"));
        Files.createFile(dir.resolve("photo_old.jpg"));
        Path processed = Files.createFile(dir.resolve("photo_x4.jpg"));

        assertTrue(ResultPairing.findOriginal(processed, List.of()).isEmpty());
    }

    @Test
    void findOriginal_shouldIgnoreFilesWithoutScaleSuffix() throws IOException {
        Files.createFile(dir.resolve("photo.jpg"));
        Path processed = Files.createFile(dir.resolve("photo_final.jpg"));

        assertTrue(ResultPairing.findOriginal(processed, List.of()).isEmpty());
    }

    @Test
    void findOriginal_shouldStripOnlyLastSuffix() throws IOException {
        Path original = Files.createFile(dir.resolve("photo_x2.png"));
        Path processed = Files.createFile(dir.resolve("photo_x2_x4.png"));

        assertEquals(Optional.of(original), ResultPairing.findOriginal(processed, List.of()));
    }

    @Test
    void listProcessed_shouldFilterAndSort() throws IOException {
        Files.createFile(dir.resolve("b_x4.png"));
        Files.createFile(dir.resolve("a_x4.WEBP"));
        Files.createFile(dir.resolve("log.txt"));

        List<Path> listed = ResultPairing.listProcessed(dir);

        assertEquals(List.of(dir.resolve("a_x4.WEBP"), dir.resolve("b_x4.png")), listed);
    }

    @Test
    void listProcessed_shouldIncludeEveryInputFormat() throws IOException {
        Files.createFile(dir.resolve("scan_x4.tif"));
        Files.createFile(dir.resolve("scan.tif"));
        Files.createFile(dir.resolve("photo_x2.jpeg"));

        List<Path> listed = ResultPairing.listProcessed(dir);

        assertEquals(List.of(dir.resolve("photo_x2.jpeg"), dir.resolve("scan.tif"), dir.resolve("scan_x4.tif")),
                listed);
        assertEquals(Optional.of(dir.resolve("scan.tif")),
                ResultPairing.findOriginal(dir.resolve("scan_x4.tif"), List.of()));
    }

    @Test
    void listProcessed_shouldReturnEmptyForMissingDirectory() throws IOException {
        assertTrue(ResultPairing.listProcessed(dir.resolve("absent")).isEmpty());
    }
}
