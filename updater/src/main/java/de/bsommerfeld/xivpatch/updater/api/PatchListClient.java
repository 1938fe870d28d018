package de.bsommerfeld.xivpatch.updater.api;

import de.bsommerfeld.xivpatch.core.config.ServerConfig;
import de.bsommerfeld.xivpatch.updater.UpdateException;
import de.bsommerfeld.xivpatch.updater.model.PatchDescriptor;
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

/**
 * Downloads the complete, publicly hosted patch list. The version check
 * endpoint is keyed by the installed base version, so installations
 * without one are planned from this list instead.
 */
public class PatchListClient {

    private static final Logger LOG = LoggerFactory.getLogger(PatchListClient.class);

    private final HttpClient http;
    private final ServerConfig config;

    @Inject
    public PatchListClient(HttpClient http, ServerConfig config) {
        this.http = http;
        this.config = config;
    }

    public List<PatchDescriptor> fetchPatchList() throws UpdateException {
        String url = config.getPatchListUrl();
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()))
                .header("User-Agent", config.getUserAgent())
                .header("Cache-Control", "no-cache")
                .GET()
                .build();

        LOG.info("Fetching full patch list from {}", url);
        HttpResponse<String> response = Requests.send(http, request,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        Requests.validateStatus(response.statusCode(), url);

        List<PatchDescriptor> patches = ManifestParser.parsePatchList(response.body(), config.getPatchUrlScheme());
        LOG.info("Patch list contains {} patch(es)", patches.size());
        return patches;
    }
}
