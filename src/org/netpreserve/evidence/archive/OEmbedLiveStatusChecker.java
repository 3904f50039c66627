package org.netpreserve.evidence.archive;

import org.netpreserve.evidence.LiveStatus;
import org.netpreserve.evidence.LiveStatusChecker;
import org.netpreserve.evidence.PostId;
import org.netpreserve.evidence.config.ArchiveConfig;
import org.netpreserve.evidence.config.ExistenceCheckConfig;
import org.netpreserve.evidence.retry.Retrier;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Checks whether a post is still public by asking the platform's oEmbed endpoint for an embed of it. The endpoint
 * answers 404 for deleted posts and 403 for posts of suspended or protected accounts.
 */
public class OEmbedLiveStatusChecker implements LiveStatusChecker {
    private final HttpClient httpClient;
    private final ExistenceCheckConfig config;
    private final ArchiveConfig archiveConfig;
    private final Retrier retrier;

    public OEmbedLiveStatusChecker(HttpClient httpClient, ExistenceCheckConfig config, ArchiveConfig archiveConfig,
                                   Retrier retrier) {
        this.httpClient = httpClient;
        this.config = config;
        this.archiveConfig = archiveConfig;
        this.retrier = retrier;
    }

    @Override
    public CompletableFuture<LiveStatus> check(PostId postId) {
        URI uri = URI.create(config.oembedUrl() + "?omit_script=true&url="
                             + URLEncoder.encode(postId.url(), StandardCharsets.UTF_8));
        var request = HttpRequest.newBuilder(uri)
                .timeout(archiveConfig.requestTimeout())
                .header("User-Agent", archiveConfig.userAgent())
                .GET()
                .build();
        return retrier.call(null, () -> httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .<LiveStatus>thenCompose(response -> switch (response.statusCode()) {
                    case 200 -> CompletableFuture.completedFuture(LiveStatus.LIVE);
                    case 403, 404 -> CompletableFuture.completedFuture(LiveStatus.DELETED);
                    default -> CompletableFuture.failedFuture(new HttpStatusException(response.statusCode(), uri));
                }));
    }
}
