package de.bsommerfeld.xivpatch.updater.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Layout of an installation root.
 *
 * <pre>
 * {root}/game/ffxiv_dx11.exe
 * {root}/game/ffxivgame.ver                  base game version
 * {root}/game/sqpack/ex{n}/ex{n}.ver         expansion n version
 * </pre>
 */
public record GameInstallation(Path root) {

    private static final Logger LOG = LoggerFactory.getLogger(GameInstallation.class);

    static final String EXECUTABLE = "ffxiv_dx11.exe";

    public Path gameDir() {
        return root.resolve("game");
    }

    public Path versionFile(int repository) {
        if (repository == VersionVector.BASE) {
            return gameDir().resolve("ffxivgame.ver");
        }
        return gameDir().resolve("sqpack").resolve("ex" + repository).resolve("ex" + repository + ".ver");
    }

    /** A root is valid when it contains the game executable. */
    public boolean isValid() {
        return Files.isRegularFile(gameDir().resolve(EXECUTABLE));
    }

    /**
     * Reads every present version file.
     *
     * @throws VersionFormatException if a version file holds something other
     *                                than a version
     * @throws IOException            if a version file cannot be read
     */
    public VersionVector readVersions() throws IOException {
        Map<Integer, GameVersion> versions = new HashMap<>();
        for (int repository = VersionVector.BASE; repository <= VersionVector.MAX_EXPANSION; repository++) {
            Path file = versionFile(repository);
            if (Files.isRegularFile(file)) {
                versions.put(repository, GameVersion.parse(Files.readString(file, StandardCharsets.UTF_8)));
            }
        }
        return new VersionVector(versions);
    }

    /**
     * Records the installed version of a repository. The file is written to
     * a temporary sibling first and moved into place, so a crash never
     * leaves a truncated version file behind.
     */
    public void writeVersion(int repository, GameVersion version) throws IOException {
        Path file = versionFile(repository);
        Files.createDirectories(file.getParent());
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(temp, version.value(), StandardCharsets.UTF_8);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOG.info("Recorded ex{} version {}", repository, version);
    }

    /**
     * Probes {@code installPaths} below every filesystem root and returns the
     * first valid installation.
     */
    public static Optional<GameInstallation> detect(List<String> installPaths) {
        for (Path fsRoot : FileSystems.getDefault().getRootDirectories()) {
            Optional<GameInstallation> found = detect(fsRoot, installPaths);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    static Optional<GameInstallation> detect(Path fsRoot, List<String> installPaths) {
        for (String installPath : installPaths) {
            GameInstallation candidate = new GameInstallation(fsRoot.resolve(installPath));
            if (candidate.isValid()) {
                LOG.info("Detected game installation at {}", candidate.root());
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
