package de.bsommerfeld.upvision.engine.device;

import com.google.inject.Singleton;
import de.bsommerfeld.upvision.core.domain.DeviceSummary;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Summarizes the enhancement runtime and normalizes device strings.
 *
 * <p>
 * {@link #normalize(String)} is also the key function of the enhancer cache.
 * Both places must go through it, otherwise {@code "GPU"} and {@code "cuda"}
 * would build two separate enhancers for the same hardware.
 */
@Singleton
public class DeviceProbe {

    private static final Logger LOG = LoggerFactory.getLogger(DeviceProbe.class);

    public static final String UNKNOWN_ACCELERATOR = "Unidentified accelerator";
    public static final String AUTO = "auto";

    private final DeviceCapabilities capabilities;

    @Inject
    public DeviceProbe(DeviceCapabilities capabilities) {
        this.capabilities = capabilities;
    }

    /**
     * Queries the runtime. A missing library yields
     * {@link DeviceSummary#unavailable()}; a failing accelerator name lookup
     * yields {@value #UNKNOWN_ACCELERATOR} instead of an error.
     */
    public DeviceSummary probe() {
        if (!capabilities.isLibraryInstalled()) {
            return DeviceSummary.unavailable();
        }
        boolean acceleratorAvailable = capabilities.isAcceleratorAvailable();
        String acceleratorName = acceleratorAvailable ? readAcceleratorName() : null;
        return new DeviceSummary(
                true,
                capabilities.libraryVersion().orElse(null),
                capabilities.compiledAcceleratorVersion().orElse(null),
                acceleratorAvailable,
                acceleratorName);
    }

    /**
     * Maps user input to a canonical device string.
     * <ul>
     * <li>{@code cuda}, {@code gpu} → {@code cuda}</li>
     * <li>{@code cpu} → {@code cpu}</li>
     * <li>{@code auto}, blank or {@code null} → {@code cuda} if an accelerator
     * is available, else {@code cpu}</li>
     * <li>anything else (e.g. {@code cuda:1}) → trimmed and lower-cased</li>
     * </ul>
     * Applying it twice gives the same result as applying it once.
     */
    public String normalize(String device) {
        String d = device == null ? AUTO : device.strip().toLowerCase(Locale.ROOT);
        if (d.isEmpty()) {
            d = AUTO;
        }
        switch (d) {
            case "cuda":
            case "gpu":
                return DeviceSummary.ACCELERATOR;
            case "cpu":
                return DeviceSummary.BASELINE;
            case AUTO:
                return acceleratorUsable() ? DeviceSummary.ACCELERATOR : DeviceSummary.BASELINE;
            default:
                return d;
        }
    }

    /** True if a normalized device string addresses the accelerator. */
    public boolean isAccelerated(String normalizedDevice) {
        return normalizedDevice.startsWith(DeviceSummary.ACCELERATOR);
    }

    /** Device choices to offer on a control surface; empty without library. */
    public List<String> availableDevices() {
        List<String> devices = new ArrayList<>();
        if (!capabilities.isLibraryInstalled()) {
            return devices;
        }
        devices.add(DeviceSummary.BASELINE);
        if (capabilities.isAcceleratorAvailable()) {
            devices.add(DeviceSummary.ACCELERATOR);
        }
        return devices;
    }

    private boolean acceleratorUsable() {
        return capabilities.isLibraryInstalled() && capabilities.isAcceleratorAvailable();
    }

    private String readAcceleratorName() {
        try {
            return capabilities.acceleratorName()
                    .filter(name -> !name.isBlank())
                    .orElse(UNKNOWN_ACCELERATOR);
        } catch (RuntimeException e) {
            LOG.warn("Could not read accelerator name: {}", e.getMessage());
            return UNKNOWN_ACCELERATOR;
        }
    }
}
