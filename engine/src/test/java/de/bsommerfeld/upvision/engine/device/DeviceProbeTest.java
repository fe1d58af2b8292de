package de.bsommerfeld.upvision.engine.device;

import de.bsommerfeld.upvision.core.domain.DeviceSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DeviceProbeTest {

    @Mock
    DeviceCapabilities capabilities;

    private void accelerated() {
        when(capabilities.isLibraryInstalled()).thenReturn(true);
        when(capabilities.isAcceleratorAvailable()).thenReturn(true);
    }

    private void cpuOnly() {
        when(capabilities.isLibraryInstalled()).thenReturn(true);
        when(capabilities.isAcceleratorAvailable()).thenReturn(false);
    }

    // -- probe --

    @Test
    void probe_shouldReportUnavailableWithoutLibrary() {
        when(capabilities.isLibraryInstalled()).thenReturn(false);

        assertEquals(DeviceSummary.unavailable(), new DeviceProbe(capabilities).probe());
        verify(capabilities, never()).acceleratorName();
    }

    @Test
    void probe_shouldCarryVersionsAndAcceleratorName() {
        accelerated();
        when(capabilities.libraryVersion()).thenReturn(Optional.of("2.1"));
        when(capabilities.compiledAcceleratorVersion()).thenReturn(Optional.of("12.1"));
        when(capabilities.acceleratorName()).thenReturn(Optional.of("RTX 4090"));

        DeviceSummary summary = new DeviceProbe(capabilities).probe();

        assertTrue(summary.libraryAvailable());
        assertEquals("2.1", summary.libraryVersion());
        assertEquals("12.1", summary.compiledAcceleratorVersion());
        assertTrue(summary.acceleratorAvailable());
        assertEquals("RTX 4090", summary.acceleratorName());
        assertEquals("cuda", summary.preferredDevice());
    }

    @Test
    void probe_shouldUsePlaceholderWhenNameLookupFails() {
        accelerated();
        when(capabilities.libraryVersion()).thenReturn(Optional.empty());
        when(capabilities.compiledAcceleratorVersion()).thenReturn(Optional.empty());
        when(capabilities.acceleratorName()).thenThrow(new IllegalStateException("driver"));

        DeviceSummary summary = new DeviceProbe(capabilities).probe();
        assertEquals(DeviceProbe.UNKNOWN_ACCELERATOR, summary.acceleratorName());
    }

    @Test
    void probe_shouldOmitNameWithoutAccelerator() {
        cpuOnly();
        when(capabilities.libraryVersion()).thenReturn(Optional.of("2.1"));
        when(capabilities.compiledAcceleratorVersion()).thenReturn(Optional.empty());

        DeviceSummary summary = new DeviceProbe(capabilities).probe();
        assertNull(summary.acceleratorName());
        assertEquals("cpu", summary.preferredDevice());
    }

    // -- normalize --

    @Test
    void normalize_shouldMapAcceleratorAliases() {
        cpuOnly();
        var probe = new DeviceProbe(capabilities);
        assertEquals("cuda", probe.normalize("CUDA"));
        assertEquals("cuda", probe.normalize("cuda"));
        assertEquals("cuda", probe.normalize(" gpu "));
        assertEquals("cpu", probe.normalize("CPU"));
    }

    @Test
    void normalize_shouldResolveAutoByAvailability() {
        accelerated();
        assertEquals("cuda", new DeviceProbe(capabilities).normalize("auto"));

        cpuOnly();
        var probe = new DeviceProbe(capabilities);
        assertEquals("cpu", probe.normalize("auto"));
        assertEquals("cpu", probe.normalize(""));
        assertEquals("cpu", probe.normalize(null));
    }

    @Test
    void normalize_shouldPassThroughIndexedDevices() {
        cpuOnly();
        assertEquals("cuda:1", new DeviceProbe(capabilities).normalize(" CUDA:1 "));
    }

    @Test
    void normalize_shouldBeIdempotent() {
        accelerated();
        var probe = new DeviceProbe(capabilities);
        for (String input : List.of("CUDA", "gpu", "cpu", "auto", "", "cuda:0", "Weird")) {
            String once = probe.normalize(input);
            assertEquals(once, probe.normalize(once), input);
        }
    }

    @Test
    void isAccelerated_shouldMatchIndexedAccelerators() {
        var probe = new DeviceProbe(capabilities);
        assertTrue(probe.isAccelerated("cuda"));
        assertTrue(probe.isAccelerated("cuda:1"));
        assertFalse(probe.isAccelerated("cpu"));
    }

    @Test
    void availableDevices_shouldReflectCapabilities() {
        accelerated();
        assertEquals(List.of("cpu", "cuda"), new DeviceProbe(capabilities).availableDevices());

        when(capabilities.isLibraryInstalled()).thenReturn(false);
        assertTrue(new DeviceProbe(capabilities).availableDevices().isEmpty());
    }
}
