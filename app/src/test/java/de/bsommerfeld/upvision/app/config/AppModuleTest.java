package de.bsommerfeld.upvision.app.config;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.upvision.app.ApplicationLifecycle;
import de.bsommerfeld.upvision.app.controller.BatchController;
import de.bsommerfeld.upvision.app.selfcheck.FirstRunSelfCheck;
import de.bsommerfeld.upvision.app.selfcheck.SentinelStore;
import de.bsommerfeld.upvision.app.selfcheck.ShutdownHandler;
import de.bsommerfeld.upvision.core.config.ConfigurationLoader;
import de.bsommerfeld.upvision.core.config.EngineConfig;
import de.bsommerfeld.upvision.core.config.GlobalConfig;
import de.bsommerfeld.upvision.engine.enhance.EnhancementProvider;
import de.bsommerfeld.upvision.engine.enhance.Java2dEnhancementProvider;
import de.bsommerfeld.upvision.engine.enhance.PassthroughEnhancementProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppModuleTest {

    @TempDir
    Path dir;

    private Injector injector(Path configPath) {
        return Guice.createInjector(new AppModule(configPath));
    }

    @Test
    void configure_shouldWriteDefaultConfigAndBindSections() {
        Path configPath = dir.resolve("config.toml");

        Injector injector = injector(configPath);

        assertTrue(Files.exists(configPath));
        GlobalConfig config = injector.getInstance(GlobalConfig.class);
        assertSame(config.getEngine(), injector.getInstance(EngineConfig.class));
    }

    @Test
    void configure_shouldUseConfiguredValues() throws IOException {
        Path configPath = dir.resolve("config.toml");
        GlobalConfig config = new GlobalConfig();
        config.getEngine().setCheckpointDir(dir.resolve("weights").toString());
        ConfigurationLoader.save(configPath, config);

        Injector injector = injector(configPath);

        assertEquals(dir.resolve("weights").toString(), injector.getInstance(EngineConfig.class).getCheckpointDir());
    }

    @Test
    void configure_shouldPlaceSentinelNextToConfig() {
        Injector injector = injector(dir.resolve("config.toml"));

        assertEquals(dir.resolve(".first_run_complete"), injector.getInstance(SentinelStore.class).location());
    }

    @Test
    void configure_shouldShareSingletons() {
        Injector injector = injector(dir.resolve("config.toml"));

        assertSame(injector.getInstance(BatchController.class), injector.getInstance(BatchController.class));
        assertSame(injector.getInstance(ApplicationLifecycle.class), injector.getInstance(ShutdownHandler.class));
        assertNotNull(injector.getInstance(FirstRunSelfCheck.class));
    }

    @Test
    void configure_shouldSwapProviderByMode() {
        String original = System.getProperty("app.mode");
        try {
            System.setProperty("app.mode", "PROD");
            assertInstanceOf(Java2dEnhancementProvider.class,
                    injector(dir.resolve("prod.toml")).getInstance(EnhancementProvider.class));

            System.setProperty("app.mode", "TEST");
            assertInstanceOf(PassthroughEnhancementProvider.class,
                    injector(dir.resolve("test.toml")).getInstance(EnhancementProvider.class));
        } finally {
            if (original == null) {
                System.clearProperty("app.mode");
            } else {
                System.setProperty("app.mode", original);
            }
        }
    }

    @Test
    void configure_shouldFailOnUnparseableConfig() throws IOException {
        Path configPath = Files.writeString(dir.resolve("config.toml"), "engine = [ broken");

        assertThrows(RuntimeException.class, () -> injector(configPath));
    }
}
