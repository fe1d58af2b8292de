package de.bsommerfeld.upvision.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeviceSummaryTest {

    @Test
    void unavailable_shouldReportNothingUsable() {
        DeviceSummary summary = DeviceSummary.unavailable();

        assertFalse(summary.libraryAvailable());
        assertFalse(summary.acceleratorAvailable());
        assertNull(summary.libraryVersion());
        assertNull(summary.acceleratorName());
        assertEquals("cpu", summary.preferredDevice());
    }

    @Test
    void preferredDevice_shouldPickAcceleratorWhenAvailable() {
        DeviceSummary summary = new DeviceSummary(true, "17", null, true, "Display 0");
        assertEquals("cuda", summary.preferredDevice());
    }
}
