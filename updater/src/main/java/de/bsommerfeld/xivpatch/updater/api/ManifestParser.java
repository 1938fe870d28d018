package de.bsommerfeld.xivpatch.updater.api;

import de.bsommerfeld.xivpatch.updater.ProtocolException;
import de.bsommerfeld.xivpatch.updater.model.GameVersion;
import de.bsommerfeld.xivpatch.updater.model.PatchDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the two tab-separated patch list dialects of the patch server.
 *
 * <h3>Version check response</h3>
 * A multipart body whose patch lines read
 *
 * <pre>
 * {size}\t{totalSize}\t{count}\t{parts}\t{version}\t{hashType}\t{blockSize}\t{hashes}\t{url}
 * </pre>
 *
 * Boundaries and part headers are skipped by prefix. The repository is
 * taken from an {@code /ex{n}/} segment of the URL.
 *
 * <h3>Full patch list</h3>
 * Used for fresh installs. Same nine columns, but the sixth carries the
 * repository id and the hash is a single checksum:
 *
 * <pre>
 * {size}\t{totalSize}\t{count}\t{parts}\t{version}\t{repository}\tx\t{hash}\t{url}
 * </pre>
 *
 * <p>
 * Lines that do not parse are dropped and logged at debug level; the server
 * mixes noise into its responses, so one bad line never fails the whole list.
 */
public final class ManifestParser {

    private static final Logger LOG = LoggerFactory.getLogger(ManifestParser.class);

    static final int MIN_FIELDS = 9;

    private static final Pattern REPOSITORY_SEGMENT = Pattern.compile("/ex(\\d+)/");
    private static final List<String> FRAMING_PREFIXES = List.of("--", "Content-", "X-");
    private static final String CHECKSUM_TYPE = "crc32";

    private ManifestParser() {
    }

    public static List<PatchDescriptor> parseVersionCheckResponse(String body, String urlScheme) {
        List<PatchDescriptor> patches = new ArrayList<>();
        for (String line : body.split("\n")) {
            String trimmed = line.strip();
            if (isFraming(trimmed)) {
                continue;
            }
            try {
                patches.add(parseManifestLine(trimmed, urlScheme));
            } catch (ProtocolException e) {
                LOG.debug("Dropping manifest line: {}", e.getMessage());
            }
        }
        return patches;
    }

    public static List<PatchDescriptor> parsePatchList(String content, String urlScheme) {
        List<PatchDescriptor> patches = new ArrayList<>();
        for (String line : content.split("\n")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                patches.add(parsePatchListLine(trimmed, urlScheme));
            } catch (ProtocolException e) {
                LOG.debug("Dropping patch list line: {}", e.getMessage());
            }
        }
        return patches;
    }

    /**
     * Infers the repository from the download URL: {@code /ex{n}/} means
     * expansion n, no such segment means the base game.
     */
    public static int repositoryFromUrl(String url) {
        Matcher matcher = REPOSITORY_SEGMENT.matcher(url);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : 0;
    }

    static PatchDescriptor parseManifestLine(String line, String urlScheme) throws ProtocolException {
        String[] fields = split(line, urlScheme);
        String url = fields[8];
        try {
            List<String> hashes = Arrays.stream(fields[7].split(","))
                    .map(String::strip)
                    .filter(hash -> !hash.isEmpty())
                    .toList();
            return validated(new PatchDescriptor(
                    Long.parseLong(fields[0]),
                    Long.parseLong(fields[1]),
                    Integer.parseInt(fields[2]),
                    Integer.parseInt(fields[3]),
                    GameVersion.parse(fields[4]),
                    repositoryFromUrl(url),
                    fields[5],
                    Long.parseLong(fields[6]),
                    hashes,
                    url));
        } catch (IllegalArgumentException e) {
            throw new ProtocolException(e.getMessage() + " in '" + line + "'", e);
        }
    }

    static PatchDescriptor parsePatchListLine(String line, String urlScheme) throws ProtocolException {
        String[] fields = split(line, urlScheme);
        try {
            return validated(new PatchDescriptor(
                    Long.parseLong(fields[0]),
                    Long.parseLong(fields[1]),
                    Integer.parseInt(fields[2]),
                    Integer.parseInt(fields[3]),
                    GameVersion.parse(fields[4]),
                    Integer.parseInt(fields[5]),
                    CHECKSUM_TYPE,
                    0,
                    List.of(fields[7]),
                    fields[8]));
        } catch (IllegalArgumentException e) {
            throw new ProtocolException(e.getMessage() + " in '" + line + "'", e);
        }
    }

    private static String[] split(String line, String urlScheme) throws ProtocolException {
        String[] fields = line.split("\t");
        if (fields.length < MIN_FIELDS) {
            throw new ProtocolException("Expected " + MIN_FIELDS + " fields but got " + fields.length);
        }
        fields[8] = fields[8].strip();
        if (!fields[8].startsWith(urlScheme)) {
            throw new ProtocolException("Not a patch URL: " + fields[8]);
        }
        return fields;
    }

    private static PatchDescriptor validated(PatchDescriptor patch) {
        if (patch.size() < 0 || patch.repository() < 0 || patch.repository() > 5) {
            throw new IllegalArgumentException("Out of range size or repository");
        }
        if (patch.fileName().isEmpty()) {
            throw new IllegalArgumentException("URL has no file name");
        }
        return patch;
    }

    private static boolean isFraming(String line) {
        return line.isEmpty() || FRAMING_PREFIXES.stream().anyMatch(line::startsWith);
    }
}
