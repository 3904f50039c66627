package org.netpreserve.evidence;

import java.util.concurrent.CompletableFuture;

/**
 * Determines whether a post is still visible on the platform.
 */
@FunctionalInterface
public interface LiveStatusChecker {
    CompletableFuture<LiveStatus> check(PostId postId);
}
