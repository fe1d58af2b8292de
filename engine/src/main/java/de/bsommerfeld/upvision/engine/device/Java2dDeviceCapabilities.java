package de.bsommerfeld.upvision.engine.device;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.AWTError;
import java.awt.GraphicsConfiguration;
import java.awt.GraphicsEnvironment;
import java.awt.HeadlessException;
import java.util.Optional;

/**
 * {@link DeviceCapabilities} of the bundled Java2D backend.
 *
 * <p>
 * The "library" is the {@code java.desktop} module. The accelerator is the
 * default screen's graphics pipeline when it reports accelerated images; a
 * headless runtime never has one. The compiled accelerator version is the
 * Java2D pipeline forced via system property, if any.
 */
@Singleton
public class Java2dDeviceCapabilities implements DeviceCapabilities {

    private static final Logger LOG = LoggerFactory.getLogger(Java2dDeviceCapabilities.class);

    private static final String[] PIPELINE_PROPERTIES = { "sun.java2d.metal", "sun.java2d.opengl", "sun.java2d.d3d" };

    @Override
    public boolean isLibraryInstalled() {
        return ModuleLayer.boot().findModule("java.desktop").isPresent();
    }

    @Override
    public boolean isAcceleratorAvailable() {
        if (GraphicsEnvironment.isHeadless()) {
            return false;
        }
        try {
            GraphicsConfiguration gc = GraphicsEnvironment.getLocalGraphicsEnvironment()
                    .getDefaultScreenDevice()
                    .getDefaultConfiguration();
            return gc.getImageCapabilities().isAccelerated();
        } catch (HeadlessException | AWTError e) {
            LOG.debug("No graphics device available: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<String> acceleratorName() {
        return Optional.ofNullable(GraphicsEnvironment.getLocalGraphicsEnvironment()
                .getDefaultScreenDevice()
                .getIDstring());
    }

    @Override
    public Optional<String> libraryVersion() {
        return Optional.ofNullable(System.getProperty("java.version"));
    }

    @Override
    public Optional<String> compiledAcceleratorVersion() {
        for (String property : PIPELINE_PROPERTIES) {
            if (Boolean.parseBoolean(System.getProperty(property))) {
                return Optional.of(property.substring(property.lastIndexOf('.') + 1));
            }
        }
        return Optional.empty();
    }
}
