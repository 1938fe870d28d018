package de.bsommerfeld.xivpatch.zipatch;

import de.bsommerfeld.xivpatch.core.concurrent.CancellationToken;
import de.bsommerfeld.xivpatch.core.config.InstallConfig;
import de.bsommerfeld.xivpatch.zipatch.chunk.Chunk;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class ZiPatchInstallerTest {

    @TempDir
    Path tempDir;

    private final ZiPatchInstaller installer = new ZiPatchInstaller(new InstallConfig());

    @Test
    void install_shouldApplyChunksInStreamOrder() throws Exception {
        Path patch = new PatchImageBuilder()
                .addDirectory("sqpack/ex1")
                .sqpk('F', PatchImageBuilder.fileOperation('A', 0, 1, "sqpack/ex1/readme.txt",
                        PatchImageBuilder.storedBlock("patched".getBytes(StandardCharsets.UTF_8))))
                .endOfFile()
                .writeTo(tempDir.resolve("D2025.06.01.0000.0000.patch"));
        Path gameDir = tempDir.resolve("game");

        List<String> applied = new ArrayList<>();
        int count = installer.install(patch, gameDir, new CancellationToken(),
                (chunk, position, length) -> applied.add(chunk.type()));

        assertEquals(3, count);
        assertEquals(List.of("ADIR", "SQPK:F:A", "EOF_"), applied);
        assertEquals("patched", Files.readString(gameDir.resolve("sqpack/ex1/readme.txt")));
    }

    @Test
    void install_shouldBeRerunnableAfterDirectoryWasDeleted() throws Exception {
        Path patch = new PatchImageBuilder()
                .addDirectory("staging")
                .sqpk('F', PatchImageBuilder.fileOperation('A', 0, 0, "data/file.bin",
                        PatchImageBuilder.storedBlock(new byte[]{1, 2, 3})))
                .deleteDirectory("staging")
                .endOfFile()
                .writeTo(tempDir.resolve("p.patch"));
        Path gameDir = tempDir.resolve("game");

        installer.install(patch, gameDir, new CancellationToken(), InstallProgressListener.NONE);
        assertDoesNotThrow(() ->
                installer.install(patch, gameDir, new CancellationToken(), InstallProgressListener.NONE));

        assertFalse(Files.exists(gameDir.resolve("staging")));
        assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(gameDir.resolve("data/file.bin")));
    }

    @Test
    void install_shouldKeepEarlierChunksWhenLaterChunkFails() throws Exception {
        Path patch = new PatchImageBuilder()
                .addDirectory("first")
                .addDirectory("../escape")
                .addDirectory("never")
                .writeTo(tempDir.resolve("bad.patch"));
        Path gameDir = tempDir.resolve("game");

        ChunkApplyException ex = assertThrows(ChunkApplyException.class, () ->
                installer.install(patch, gameDir, new CancellationToken(), InstallProgressListener.NONE));

        assertEquals("ADIR", ex.getChunkType());
        assertTrue(Files.isDirectory(gameDir.resolve("first")));
        assertFalse(Files.exists(gameDir.resolve("never")));
    }

    @Test
    void install_shouldStopBeforeNextChunkWhenCancelled() throws Exception {
        Path patch = new PatchImageBuilder()
                .addDirectory("one")
                .addDirectory("two")
                .writeTo(tempDir.resolve("p.patch"));
        Path gameDir = tempDir.resolve("game");
        CancellationToken token = new CancellationToken();

        assertThrows(CancellationException.class, () -> installer.install(patch, gameDir, token,
                (Chunk chunk, long position, long length) -> token.cancel()));

        assertTrue(Files.isDirectory(gameDir.resolve("one")));
        assertFalse(Files.exists(gameDir.resolve("two")));
    }

    @Test
    void install_shouldRejectCorruptPatchBeforeApplyingIt() throws Exception {
        Path patch = new PatchImageBuilder()
                .chunk("ADIR", PatchImageBuilder.named("x"), 1L)
                .writeTo(tempDir.resolve("corrupt.patch"));
        Path gameDir = tempDir.resolve("game");

        assertThrows(ChunkDecodeException.class, () ->
                installer.install(patch, gameDir, new CancellationToken(), InstallProgressListener.NONE));
        assertFalse(Files.exists(gameDir.resolve("x")));
    }

    @Test
    void install_shouldReportCorruptBlockSizeAsZiPatchException() throws Exception {
        byte[] block = PatchImageBuilder.deflatedBlock("patched".getBytes(StandardCharsets.UTF_8));
        ByteBuffer.wrap(block).order(ByteOrder.LITTLE_ENDIAN).putInt(12, -1);
        Path patch = new PatchImageBuilder()
                .addDirectory("before")
                .sqpk('F', PatchImageBuilder.fileOperation('A', 0, 0, "boot.cfg", block))
                .endOfFile()
                .writeTo(tempDir.resolve("corrupt-block.patch"));
        Path gameDir = tempDir.resolve("game");

        ZiPatchException ex = assertThrows(ZiPatchException.class, () ->
                installer.install(patch, gameDir, new CancellationToken(), InstallProgressListener.NONE));
        assertInstanceOf(ChunkDecodeException.class, ex);
        assertTrue(Files.isDirectory(gameDir.resolve("before")));
        assertFalse(Files.exists(gameDir.resolve("boot.cfg")));
    }
}
