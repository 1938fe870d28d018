package de.bsommerfeld.xivpatch.updater.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatchDescriptorTest {

    private static PatchDescriptor patch(int repository, String url) {
        return new PatchDescriptor(1536, 1536, 1, 1, GameVersion.parse("2025.05.29.0000.0000"),
                repository, "sha1", 50_000_000, List.of("abc"), url);
    }

    @Test
    void fileName_shouldTakeLastUrlSegment() {
        PatchDescriptor patch = patch(1, "http://patch-dl.ffxiv.com.tw/game/ex1/be3c0f25/D2025.05.29.0000.0000.patch");
        assertEquals("D2025.05.29.0000.0000.patch", patch.fileName());
    }

    @Test
    void localPath_shouldUseRepositoryFolder() {
        assertEquals(Path.of("ex0", "H.patch"), patch(0, "http://host/game/0b90d03e/H.patch").localPath());
        assertEquals(Path.of("ex3", "D.patch"), patch(3, "http://host/game/ex3/1/D.patch").localPath());
    }

    @Test
    void formattedSize_shouldUseByteFormatter() {
        assertEquals("1.5 KB", patch(0, "http://host/a.patch").formattedSize());
    }

    @Test
    void hashes_shouldBeImmutable() {
        PatchDescriptor patch = patch(0, "http://host/a.patch");
        assertThrows(UnsupportedOperationException.class, () -> patch.hashes().add("x"));
    }
}
