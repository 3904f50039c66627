package org.netpreserve.evidence.retry;

import org.netpreserve.evidence.archive.HttpStatusException;
import org.netpreserve.evidence.archive.MalformedResponseException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;

/**
 * Decides whether a failed attempt is worth retrying and how it counts towards pacing.
 */
@FunctionalInterface
public interface FailureClassifier {
    Verdict classify(Throwable failure);

    FailureClassifier DEFAULT = failure -> {
        if (failure instanceof HttpStatusException e) {
            int status = e.status();
            if (status == 429) return Verdict.RATE_LIMITED;
            if (status == 503) return Verdict.UNAVAILABLE;
            if (status >= 500) return Verdict.SERVER_ERROR;
            if (status == 404 || status == 410) return Verdict.FINAL;
            if (status == 401 || status == 403) return Verdict.BLOCKED;
            return Verdict.FATAL;
        }
        if (failure instanceof MalformedResponseException) return Verdict.DECODE;
        if (failure instanceof HttpTimeoutException || failure instanceof ConnectException) return Verdict.TIMEOUT;
        if (failure instanceof IOException) return Verdict.TRANSIENT;
        return Verdict.FATAL;
    };
}
