package de.bsommerfeld.upvision.app;

import de.bsommerfeld.upvision.core.config.ConfigurationLoader;
import de.bsommerfeld.upvision.core.config.GlobalConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the command line against a temp configuration.
 */
class AppMainTest {

    @TempDir
    Path dir;

    private Path configPath;
    private Path models;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    @BeforeEach
    void setUp() throws IOException {
        models = Files.createDirectory(dir.resolve("models"));
        Files.createFile(models.resolve("model_x2.pth"));
        configPath = dir.resolve("config.toml");

        GlobalConfig config = new GlobalConfig();
        config.getEngine().setCheckpointDir(models.toString());
        config.getFirstRun().setSampleImage(dir.resolve("assets").resolve("sample.jpg").toString());
        ConfigurationLoader.save(configPath, config);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void run_shouldPrintUsageOnHelp() {
        assertEquals(0, AppMain.run(out, "--help"));
        assertTrue(output().contains("Usage: upvision"));
    }

    @Test
    void run_shouldRejectUnknownOption() {
        assertEquals(2, AppMain.run(out, "--bogus"));
        assertTrue(output().contains("Unknown option: --bogus"));
    }

    @Test
    void run_shouldPrintEnvironmentReport() {
        assertEquals(0, AppMain.run(out, "--config", configPath.toString(), "--env-check"));
        assertTrue(output().contains("=== ENV CHECK ==="));
        assertTrue(output().contains("model_x2 (x2)"));
    }

    @Test
    void run_shouldListCheckpoints() {
        assertEquals(0, AppMain.run(out, "--config", configPath.toString(), "--list"));
        assertTrue(output().startsWith("model_x2\tx2\t"));
    }

    @Test
    void run_shouldEnhanceInputs() throws IOException {
        Path input = dir.resolve("photo.png");
        ImageIO.write(new BufferedImage(3, 3, BufferedImage.TYPE_INT_RGB), "png", input.toFile());
        Path outDir = dir.resolve("enhanced");

        int code = AppMain.run(out, "--config", configPath.toString(), "-d", "cpu", "-o", outDir.toString(),
                input.toString());

        assertEquals(0, code);
        BufferedImage written = ImageIO.read(outDir.resolve("photo_x2.png").toFile());
        assertEquals(6, written.getWidth());
    }

    @Test
    void run_shouldReturnOneWhenItemsFail() throws IOException {
        Path broken = Files.writeString(dir.resolve("broken.png"), "garbage");

        int code = AppMain.run(out, "--config", configPath.toString(), "-d", "cpu", broken.toString());

        assertEquals(1, code);
    }

    @Test
    void run_shouldSkipSelfCheckWithoutSample() {
        assertEquals(0, AppMain.run(out, "--config", configPath.toString()));
        assertTrue(output().contains("Usage: upvision"));
        assertFalse(Files.exists(dir.resolve(".first_run_complete")));
    }

    @Test
    void run_shouldPairResults() throws IOException {
        Path results = Files.createDirectory(dir.resolve("results"));
        Files.createFile(results.resolve("cat.png"));
        Files.createFile(results.resolve("cat_x4.png"));

        assertEquals(0, AppMain.run(out, "--config", configPath.toString(), "--results", results.toString()));
        assertTrue(output().contains("cat_x4.png\t<- " + results.resolve("cat.png")));
    }
}
