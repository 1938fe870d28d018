package de.bsommerfeld.xivpatch.updater.api;

import de.bsommerfeld.xivpatch.core.config.ServerConfig;
import de.bsommerfeld.xivpatch.updater.UpdateException;
import de.bsommerfeld.xivpatch.updater.model.GameVersion;
import de.bsommerfeld.xivpatch.updater.model.PatchDescriptor;
import de.bsommerfeld.xivpatch.updater.model.VersionVector;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Asks the version check endpoint which patches the local installation
 * needs.
 *
 * <h3>Request</h3>
 * {@code POST http://{host}/http/win32/{product}/{baseVersion}/} with
 * {@code X-Hash-Check: enabled}. The body starts with an empty line, which
 * makes the server skip its boot version check, followed by
 * {@code ex{n}\t{version}} for every installed expansion.
 *
 * <h3>Response</h3>
 * 204 means the installation is current. Any other 2xx carries the patch
 * lines parsed by {@link ManifestParser}.
 */
public class VersionCheckClient {

    private static final Logger LOG = LoggerFactory.getLogger(VersionCheckClient.class);

    static final int NO_CONTENT = 204;

    private final HttpClient http;
    private final ServerConfig config;

    @Inject
    public VersionCheckClient(HttpClient http, ServerConfig config) {
        this.http = http;
        this.config = config;
    }

    /**
     * @param localVersions installed versions; must contain the base game
     * @return the announced patches, or empty if no update is needed
     * @throws UpdateException on transport failure or non-success status
     */
    public Optional<List<PatchDescriptor>> checkVersion(VersionVector localVersions) throws UpdateException {
        GameVersion base = localVersions.base()
                .orElseThrow(() -> new IllegalArgumentException("Version check requires a base game version"));
        String url = config.versionCheckUrl(base.value());

        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()))
                .header("X-Hash-Check", "enabled")
                .header("User-Agent", config.getUserAgent())
                .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(localVersions), StandardCharsets.UTF_8))
                .build();

        LOG.info("Checking versions {} against {}", localVersions, url);
        HttpResponse<String> response = Requests.send(http, request,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        response.headers().firstValue("X-Latest-Version")
                .ifPresent(latest -> LOG.info("Server reports latest version {}", latest));

        if (response.statusCode() == NO_CONTENT) {
            LOG.info("Installation is up to date");
            return Optional.empty();
        }
        Requests.validateStatus(response.statusCode(), url);

        List<PatchDescriptor> patches =
                ManifestParser.parseVersionCheckResponse(response.body(), config.getPatchUrlScheme());
        LOG.info("Server announced {} patch(es)", patches.size());
        return Optional.of(patches);
    }

    static String buildRequestBody(VersionVector localVersions) {
        StringBuilder body = new StringBuilder("\n");
        for (int repository = 1; repository <= VersionVector.MAX_EXPANSION; repository++) {
            int n = repository;
            localVersions.get(repository)
                    .ifPresent(version -> body.append("ex").append(n).append('\t').append(version).append('\n'));
        }
        return body.toString();
    }
}
