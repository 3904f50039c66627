package org.netpreserve.evidence;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Outcome of checking one post.
 *
 * @param captures   usable captures found in the archive, oldest first
 * @param liveStatus whether the post is still live, null if not checked
 * @param downloads  what became of the captures handed to the download pipeline
 * @param error      why the post could not be resolved, for {@link Resolution#FAILED}
 */
public record PostDeletionResult(
        PostId postId,
        List<CaptureReference> captures,
        @Nullable LiveStatus liveStatus,
        Resolution resolution,
        List<DownloadResult> downloads,
        @Nullable String error) {

    public PostDeletionResult {
        captures = List.copyOf(captures);
        downloads = List.copyOf(downloads);
    }

    public static PostDeletionResult failed(PostId postId, String error) {
        return new PostDeletionResult(postId, List.of(), null, Resolution.FAILED, List.of(), error);
    }

    public static PostDeletionResult cancelled(PostId postId) {
        return new PostDeletionResult(postId, List.of(), null, Resolution.CANCELLED, List.of(), null);
    }

    public PostDeletionResult withDownloads(List<DownloadResult> downloads) {
        return new PostDeletionResult(postId, captures, liveStatus, resolution, downloads, error);
    }

    /**
     * The capture most likely to show the post as it was first published.
     */
    public @Nullable CaptureReference earliestCapture() {
        return captures.isEmpty() ? null : captures.get(0);
    }

    public @Nullable CaptureReference latestCapture() {
        return captures.isEmpty() ? null : captures.get(captures.size() - 1);
    }

    /**
     * Whether something went wrong for this post: the lookup failed or evidence couldn't be retrieved.
     */
    public boolean isFailure() {
        if (resolution == Resolution.FAILED) return true;
        for (DownloadResult download : downloads) {
            if (download.status() == DownloadResult.Status.FAILED) return true;
        }
        return false;
    }
}
