package de.bsommerfeld.xivpatch.zipatch.sqpack;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqpackFileTest {

    @Test
    void datPath_shouldUseBaseFolderForExpansionZero() {
        SqpackFile file = new SqpackFile(0x00, 0x0000, 0);

        assertEquals(0, file.expansionId());
        assertEquals("sqpack/ffxiv/000000.win32.dat0", file.datPath(PlatformId.WIN32));
    }

    @Test
    void datPath_shouldDeriveExpansionFromSubId() {
        SqpackFile file = new SqpackFile(0x0c, 0x0301, 2);

        assertEquals(3, file.expansionId());
        assertEquals("sqpack/ex3/0c0301.ps3.dat2", file.datPath(PlatformId.PS3));
    }

    @Test
    void indexPath_shouldOmitZeroFileId() {
        assertEquals("sqpack/ex1/0a0100.win32.index", new SqpackFile(0x0a, 0x0100, 0).indexPath(PlatformId.WIN32));
        assertEquals("sqpack/ex1/0a0100.win32.index2", new SqpackFile(0x0a, 0x0100, 2).indexPath(PlatformId.WIN32));
    }

    @Test
    void fromId_shouldRejectUnknownPlatform() {
        assertEquals(PlatformId.PS4, PlatformId.fromId(2));
        assertThrows(IllegalArgumentException.class, () -> PlatformId.fromId(9));
    }
}
