package org.netpreserve.evidence.config;

/**
 * Live-existence checking of posts.
 *
 * @param enabled     whether to check at all
 * @param oembedUrl   oEmbed endpoint that tells whether a post is still public
 * @param concurrency checks in flight
 */
public record ExistenceCheckConfig(
        boolean enabled,
        String oembedUrl,
        int concurrency) {

    public ExistenceCheckConfig {
        if (concurrency < 1) throw new IllegalArgumentException("existenceCheck concurrency must be at least 1");
    }
}
