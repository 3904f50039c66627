package org.netpreserve.evidence.archive;

import org.netpreserve.evidence.CaptureReference;
import org.netpreserve.evidence.config.ArchiveConfig;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;

/**
 * Downloads the unmodified payload of an archived capture. Each call is a single request.
 */
public class ContentClient {
    private final HttpClient httpClient;
    private final ArchiveConfig config;

    public ContentClient(HttpClient httpClient, ArchiveConfig config) {
        this.httpClient = httpClient;
        this.config = config;
    }

    public CompletableFuture<byte[]> fetch(CaptureReference capture) {
        URI uri;
        try {
            uri = contentUri(capture);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new ArchiveException("Invalid capture URL: " + capture.url(), e));
        }
        var request = HttpRequest.newBuilder(uri)
                .timeout(config.requestTimeout())
                .header("User-Agent", config.userAgent())
                .GET()
                .build();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .<byte[]>thenCompose(response -> {
                    if (response.statusCode() != 200) {
                        return CompletableFuture.failedFuture(new HttpStatusException(response.statusCode(), uri));
                    }
                    return CompletableFuture.completedFuture(response.body());
                });
    }

    URI contentUri(CaptureReference capture) {
        return URI.create(config.contentUrl(capture.waybackTimestamp(), capture.url()));
    }
}
