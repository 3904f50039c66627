package org.netpreserve.evidence.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.evidence.retry.RetryPolicy;

import java.time.Duration;

/**
 * Where and how to talk to the web archive.
 *
 * @param baseUrl        Wayback Machine root, e.g. http://web.archive.org
 * @param userAgent      User-Agent string to identify as to the archive
 * @param connectTimeout time allowed to establish a connection
 * @param requestTimeout time allowed for a whole request
 * @param retry          backoff for transient failures
 */
public record ArchiveConfig(
        String baseUrl,
        String userAgent,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration connectTimeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration requestTimeout,
        RetryPolicy retry) {

    public ArchiveConfig {
        if (baseUrl == null || baseUrl.isBlank()) throw new IllegalArgumentException("archive baseUrl is required");
        while (baseUrl.endsWith("/")) baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        if (retry == null) retry = RetryPolicy.DEFAULT;
    }

    public String cdxUrl() {
        return baseUrl + "/cdx/search/cdx";
    }

    /**
     * URL of the unmodified archived payload ("id_" mode, no Wayback rewriting or banner).
     */
    public String contentUrl(String waybackTimestamp, String originalUrl) {
        return baseUrl + "/web/" + waybackTimestamp + "id_/" + originalUrl;
    }

    /**
     * URL for viewing a capture in the Wayback Machine.
     */
    public String viewUrl(String waybackTimestamp, String originalUrl) {
        return baseUrl + "/web/" + waybackTimestamp + "/" + originalUrl;
    }
}
