package de.bsommerfeld.xivpatch.updater.api;

import de.bsommerfeld.xivpatch.core.config.ServerConfig;
import de.bsommerfeld.xivpatch.updater.NetworkException;
import de.bsommerfeld.xivpatch.updater.StubPatchServer;
import de.bsommerfeld.xivpatch.updater.StubPatchServer.Response;
import de.bsommerfeld.xivpatch.updater.model.GameVersion;
import de.bsommerfeld.xivpatch.updater.model.PatchDescriptor;
import de.bsommerfeld.xivpatch.updater.model.VersionVector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class VersionCheckClientTest {

    private static final String BASE = "2025.05.29.0000.0000";
    private static final String CHECK_PATH = "/http/win32/ffxivtc_release_tc_game/" + BASE + "/";

    private StubPatchServer server;
    private VersionCheckClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubPatchServer();
        client = new VersionCheckClient(HttpClient.newHttpClient(), new ServerConfig(server.host(), server.url("/v2.txt")));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private static VersionVector local() {
        return new VersionVector(Map.of(
                0, GameVersion.parse(BASE),
                1, GameVersion.parse("2025.05.20.0000.0000"),
                3, GameVersion.parse("2025.05.21.0000.0000")));
    }

    @Test
    void buildRequestBody_shouldStartWithBlankLineAndListExpansions() {
        assertEquals("\nex1\t2025.05.20.0000.0000\nex3\t2025.05.21.0000.0000\n",
                VersionCheckClient.buildRequestBody(local()));
    }

    @Test
    void buildRequestBody_shouldBeBlankLineWithoutExpansions() {
        VersionVector baseOnly = new VersionVector(Map.of(0, GameVersion.parse(BASE)));
        assertEquals("\n", VersionCheckClient.buildRequestBody(baseOnly));
    }

    @Test
    void checkVersion_shouldReturnEmptyOnNoContent() throws Exception {
        server.respond(CHECK_PATH, Response.of(204, ""));

        assertEquals(Optional.empty(), client.checkVersion(local()));

        StubPatchServer.Request request = server.requests().get(0);
        assertEquals("POST", request.method());
        assertEquals("enabled", request.header("X-Hash-Check"));
        assertEquals(VersionCheckClient.buildRequestBody(local()), request.body());
    }

    @Test
    void checkVersion_shouldParseAnnouncedPatches() throws Exception {
        String body = "--boundary\r\nContent-Type: application/octet-stream\r\n\r\n"
                + "1024\t1024\t1\t1\t2025.06.01.0000.0000\tsha1\t50000000\tabc\t"
                + "http://patch-dl.ffxiv.com.tw/game/ex1/1234/D2025.06.01.0000.0000.patch\r\n--boundary--\r\n";
        server.respond(CHECK_PATH, new Response(200, Map.of("X-Latest-Version", "2025.06.01.0000.0000"),
                body.getBytes()));

        List<PatchDescriptor> patches = client.checkVersion(local()).orElseThrow();

        assertEquals(1, patches.size());
        assertEquals(1, patches.get(0).repository());
    }

    @Test
    void checkVersion_shouldThrowOnServerError() {
        server.respond(CHECK_PATH, Response.of(500, "boom"));

        NetworkException e = assertThrows(NetworkException.class, () -> client.checkVersion(local()));
        assertEquals(500, e.getStatusCode());
    }

    @Test
    void checkVersion_shouldRequireBaseVersion() {
        assertThrows(IllegalArgumentException.class, () -> client.checkVersion(VersionVector.empty()));
        assertTrue(server.requests().isEmpty());
    }
}
