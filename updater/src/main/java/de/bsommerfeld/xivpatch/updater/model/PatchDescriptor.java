package de.bsommerfeld.xivpatch.updater.model;

import de.bsommerfeld.xivpatch.core.util.ByteFormatter;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;

/**
 * One downloadable patch as announced by the patch server.
 *
 * @param size          declared file size in bytes
 * @param totalSize     cumulative size reported by the server
 * @param count         number of files in the patch
 * @param parts         number of parts the patch is split into
 * @param version       version the repository has after this patch
 * @param repository    repository id, 0 for the base game
 * @param hashType      hash algorithm of {@code hashes}, e.g. {@code sha1}
 * @param hashBlockSize bytes covered by each hash, 0 if not block based
 * @param hashes        content hashes, one per block
 * @param url           download URL
 */
public record PatchDescriptor(long size, long totalSize, int count, int parts, GameVersion version,
                              int repository, String hashType, long hashBlockSize, List<String> hashes,
                              String url) {

    public PatchDescriptor {
        hashes = List.copyOf(hashes);
    }

    /** File name from the last segment of the URL, e.g. {@code D2025.05.29.0000.0000.patch}. */
    public String fileName() {
        String path = URI.create(url).getPath();
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /** {@code ex0} for the base game, {@code ex{n}} for expansions. */
    public String repositoryName() {
        return "ex" + repository;
    }

    /** Path relative to the patch cache directory: {@code ex{n}/{fileName}}. */
    public Path localPath() {
        return Path.of(repositoryName(), fileName());
    }

    public String formattedSize() {
        return ByteFormatter.format(size);
    }

    public boolean isFullInstallPackage() {
        return version.isFullInstallPackage();
    }

    @Override
    public String toString() {
        return repositoryName() + "/" + version + " (" + formattedSize() + ")";
    }
}
