package de.bsommerfeld.xivpatch.updater.api;

import de.bsommerfeld.xivpatch.updater.NetworkException;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RequestsTest {

    @Test
    void validateStatus_shouldAcceptAll2xxCodes() {
        assertDoesNotThrow(() -> Requests.validateStatus(200, "url"));
        assertDoesNotThrow(() -> Requests.validateStatus(204, "url"));
        assertDoesNotThrow(() -> Requests.validateStatus(299, "url"));
    }

    @Test
    void validateStatus_shouldRejectBoundaryValues() {
        assertEquals(199, assertThrows(NetworkException.class, () -> Requests.validateStatus(199, "url")).getStatusCode());
        assertEquals(300, assertThrows(NetworkException.class, () -> Requests.validateStatus(300, "url")).getStatusCode());
        assertEquals(404, assertThrows(NetworkException.class, () -> Requests.validateStatus(404, "url")).getStatusCode());
    }

    @Test
    void send_shouldWrapConnectionFailures() {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:1/unreachable"))
                .timeout(Duration.ofSeconds(5))
                .build();

        NetworkException e = assertThrows(NetworkException.class,
                () -> Requests.send(HttpClient.newHttpClient(), request, HttpResponse.BodyHandlers.discarding()));
        assertEquals(-1, e.getStatusCode());
        assertNotNull(e.getCause());
    }
}
