package org.netpreserve.evidence.retry;

import org.netpreserve.evidence.archive.ArchiveException;

public class RetriesExhaustedException extends ArchiveException {
    private final int attempts;

    public RetriesExhaustedException(int attempts, Throwable lastFailure) {
        super("Gave up after " + attempts + " attempts: " + lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
