package de.bsommerfeld.xivpatch.zipatch.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileHandleStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void acquire_shouldReturnSameHandleForEquivalentPaths() throws Exception {
        try (FileHandleStore store = new FileHandleStore()) {
            FileHandle first = store.acquire(tempDir.resolve("sqpack/a.dat"));
            FileHandle second = store.acquire(tempDir.resolve("sqpack/../sqpack/./a.dat"));

            assertSame(first, second);
            assertEquals(1, store.openHandles());
        }
    }

    @Test
    void acquire_shouldCreateMissingParentDirectories() throws Exception {
        Path target = tempDir.resolve("deep/nested/file.dat");

        try (FileHandleStore store = new FileHandleStore()) {
            store.acquire(target);
        }

        assertTrue(Files.exists(target));
    }

    @Test
    void handle_shouldSeeItsOwnWrites() throws Exception {
        try (FileHandleStore store = new FileHandleStore()) {
            FileHandle handle = store.acquire(tempDir.resolve("a.dat"));
            handle.writeAt(4, new byte[]{1, 2, 3, 4});
            store.acquire(tempDir.resolve("a.dat")).wipe(5, 2);

            ByteBuffer read = ByteBuffer.allocate(4);
            handle.readAt(4, read);
            assertArrayEquals(new byte[]{1, 0, 0, 4}, read.array());
            assertEquals(8, handle.size());
        }
    }

    @Test
    void release_shouldCloseAndForgetHandle() throws Exception {
        Path path = tempDir.resolve("a.dat");
        try (FileHandleStore store = new FileHandleStore()) {
            FileHandle handle = store.acquire(path);
            store.release(path);

            assertFalse(handle.isOpen());
            assertFalse(store.isOpen(path));
            assertNotSame(handle, store.acquire(path));
        }
    }

    @Test
    void close_shouldCloseEveryHandleAndRejectFurtherUse() throws Exception {
        FileHandleStore store = new FileHandleStore();
        FileHandle a = store.acquire(tempDir.resolve("a.dat"));
        FileHandle b = store.acquire(tempDir.resolve("b.dat"));

        store.close();
        store.close();

        assertFalse(a.isOpen());
        assertFalse(b.isOpen());
        assertEquals(0, store.openHandles());
        assertThrows(IllegalStateException.class, () -> store.acquire(tempDir.resolve("c.dat")));
    }
}
