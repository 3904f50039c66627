package org.netpreserve.evidence;

import java.util.List;

/**
 * A failure no further progress is possible after, such as the content store becoming unavailable. Carries the
 * results resolved before the failure so they can still be reported.
 */
public class WorkflowAbortedException extends RuntimeException {
    private final List<PostDeletionResult> partialResults;

    public WorkflowAbortedException(String message, List<PostDeletionResult> partialResults, Throwable cause) {
        super(message + ": " + cause.getMessage(), cause);
        this.partialResults = List.copyOf(partialResults);
    }

    public List<PostDeletionResult> partialResults() {
        return partialResults;
    }
}
