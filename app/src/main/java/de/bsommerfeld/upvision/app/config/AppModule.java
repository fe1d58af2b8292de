package de.bsommerfeld.upvision.app.config;

import com.google.inject.AbstractModule;
import de.bsommerfeld.upvision.app.ApplicationLifecycle;
import de.bsommerfeld.upvision.app.controller.AlertSink;
import de.bsommerfeld.upvision.app.controller.LogAlertSink;
import de.bsommerfeld.upvision.app.selfcheck.FileSentinelStore;
import de.bsommerfeld.upvision.app.selfcheck.SentinelStore;
import de.bsommerfeld.upvision.app.selfcheck.ShutdownHandler;
import de.bsommerfeld.upvision.core.config.ApplicationMode;
import de.bsommerfeld.upvision.core.config.ConfigurationLoader;
import de.bsommerfeld.upvision.core.config.EngineConfig;
import de.bsommerfeld.upvision.core.config.FirstRunConfig;
import de.bsommerfeld.upvision.core.config.GlobalConfig;
import de.bsommerfeld.upvision.core.util.StorageUtils;
import de.bsommerfeld.upvision.engine.device.DeviceCapabilities;
import de.bsommerfeld.upvision.engine.device.Java2dDeviceCapabilities;
import de.bsommerfeld.upvision.engine.enhance.EnhancementProvider;
import de.bsommerfeld.upvision.engine.enhance.Java2dEnhancementProvider;
import de.bsommerfeld.upvision.engine.enhance.PassthroughEnhancementProvider;
import de.bsommerfeld.upvision.engine.image.ImageCodec;
import de.bsommerfeld.upvision.engine.image.ImageIoCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Guice Module for application wiring.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path configPath;

    public AppModule() {
        this(StorageUtils.getAppDataDir(StorageUtils.APP_NAME).resolve("config.toml"));
    }

    public AppModule(Path configPath) {
        this.configPath = configPath.toAbsolutePath();
    }

    @Override
    protected void configure() {
        GlobalConfig config;
        try {
            LOG.info("Loading Configuration from: {}", configPath);
            config = ConfigurationLoader.load(configPath);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load Application Configuration", e);
        }

        bind(GlobalConfig.class).toInstance(config);
        bind(EngineConfig.class).toInstance(config.getEngine());
        bind(FirstRunConfig.class).toInstance(config.getFirstRun());

        // --- MODE SWITCHING (PROD vs TEST) ---
        ApplicationMode mode = ApplicationMode.get();
        LOG.info("Application Mode initialized: {}", mode);
        if (mode == ApplicationMode.TEST) {
            bind(EnhancementProvider.class).to(PassthroughEnhancementProvider.class);
        } else {
            bind(EnhancementProvider.class).to(Java2dEnhancementProvider.class);
        }

        bind(DeviceCapabilities.class).to(Java2dDeviceCapabilities.class);
        bind(ImageCodec.class).to(ImageIoCodec.class);
        bind(AlertSink.class).to(LogAlertSink.class);
        bind(ShutdownHandler.class).to(ApplicationLifecycle.class);

        // Sentinel lives next to the configuration it belongs to
        Path sentinelFile = configPath.getParent().resolve(config.getFirstRun().getSentinelFile());
        bind(SentinelStore.class).toInstance(new FileSentinelStore(sentinelFile));
    }
}
