package de.bsommerfeld.xivpatch.updater.api;

import de.bsommerfeld.xivpatch.core.config.ServerConfig;
import de.bsommerfeld.xivpatch.updater.NetworkException;
import de.bsommerfeld.xivpatch.updater.StubPatchServer;
import de.bsommerfeld.xivpatch.updater.StubPatchServer.Response;
import de.bsommerfeld.xivpatch.updater.model.PatchDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatchListClientTest {

    private StubPatchServer server;
    private PatchListClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubPatchServer();
        client = new PatchListClient(HttpClient.newHttpClient(),
                new ServerConfig(server.host(), server.url("/launcher/patch/v2.txt")));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void fetchPatchList_shouldParseEveryLine() throws Exception {
        server.respond("/launcher/patch/v2.txt", Response.of(200,
                "5000\t5000\t1\t1\t2012.01.01.0000.0000\t0\tx\t1a2b\thttp://host/game/0b90/H2012.01.01.0000.0000a.patch\n"
                        + "7000\t12000\t1\t1\t2025.05.29.0000.0000\t1\tx\t5e6f\thttp://host/game/ex1/12/D2025.05.29.0000.0000.patch\n"));

        List<PatchDescriptor> patches = client.fetchPatchList();

        assertEquals(2, patches.size());
        assertEquals("no-cache", server.requests().get(0).header("Cache-Control"));
    }

    @Test
    void fetchPatchList_shouldThrowOnMissingList() {
        NetworkException e = assertThrows(NetworkException.class, client::fetchPatchList);
        assertEquals(404, e.getStatusCode());
    }
}
