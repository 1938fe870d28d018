package de.bsommerfeld.xivpatch.updater.update;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UpdateProgressTest {

    @Test
    void indeterminate_shouldUseNegativeRatio() {
        UpdateProgress progress = UpdateProgress.indeterminate("Checking for updates");
        assertEquals(-1, progress.progressRatio());
        assertTrue(progress.isIndeterminate());
        assertNull(progress.detail());
    }

    @Test
    void of_shouldClampRatio() {
        assertEquals(1.0, UpdateProgress.of("Downloading patches", 1.7).progressRatio());
        assertEquals(0.0, UpdateProgress.of("Downloading patches", "detail", -0.2).progressRatio());
        assertEquals(0.25, UpdateProgress.of("Downloading patches", 0.25).progressRatio());
    }
}
