package de.bsommerfeld.xivpatch.updater.api;

import de.bsommerfeld.xivpatch.updater.NetworkException;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CancellationException;

/**
 * Sends requests through the shared {@link HttpClient} and maps transport
 * failures onto {@link NetworkException}.
 */
public final class Requests {

    private Requests() {
    }

    /**
     * @throws NetworkException      on I/O failure or timeout
     * @throws CancellationException if the calling thread is interrupted
     */
    public static <T> HttpResponse<T> send(HttpClient http, HttpRequest request,
            HttpResponse.BodyHandler<T> handler) throws NetworkException {
        try {
            return http.send(request, handler);
        } catch (IOException e) {
            throw new NetworkException("Request to " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while requesting " + request.uri());
        }
    }

    /** Validates that the HTTP status code is in the 2xx success range. */
    public static void validateStatus(int status, String url) throws NetworkException {
        if (status < 200 || status >= 300) {
            throw new NetworkException(status, url);
        }
    }
}
