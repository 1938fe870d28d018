package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.ChunkApplyException;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;
import de.bsommerfeld.xivpatch.zipatch.sqpack.SqpackFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * {@code SQPK F/R}: wipes the pack and movie files of one expansion before it
 * is reinstalled. Version files and the intro movies are kept.
 */
public record SqpkRemoveAll(ChunkHeader header, int expansionId) implements SqpkCommand {

    private static final Logger LOG = LoggerFactory.getLogger(SqpkRemoveAll.class);

    private static final List<String> KEEP_SUFFIXES =
            List.of(".ver", ".var", "00000.bk2", "00001.bk2", "00002.bk2", "00003.bk2", "00004.bk2");

    @Override
    public char command() {
        return SqpkFileOperations.COMMAND;
    }

    @Override
    public String type() {
        return "SQPK:F:R";
    }

    @Override
    public void apply(ZiPatchSession session) throws ChunkApplyException {
        String folder = SqpackFile.expansionFolder(expansionId);
        List<Path> files = new ArrayList<>();
        files.addAll(listFiles(session.resolve(type(), "sqpack/" + folder)));
        files.addAll(listFiles(session.resolve(type(), "movie/" + folder)));

        int removed = 0;
        for (Path file : files) {
            if (isKept(file)) {
                continue;
            }
            try {
                session.store().release(file);
                Files.deleteIfExists(file);
                removed++;
            } catch (IOException e) {
                throw new ChunkApplyException(type(), file, "cannot remove file", e);
            }
        }
        LOG.debug("Removed {} file(s) of expansion {}", removed, folder);
    }

    private List<Path> listFiles(Path directory) throws ChunkApplyException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.filter(Files::isRegularFile).toList();
        } catch (IOException e) {
            throw new ChunkApplyException(type(), directory, "cannot list directory", e);
        }
    }

    private static boolean isKept(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return KEEP_SUFFIXES.stream().anyMatch(name::endsWith);
    }
}
