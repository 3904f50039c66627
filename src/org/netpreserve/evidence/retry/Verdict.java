package org.netpreserve.evidence.retry;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.evidence.pacing.FailureClass;
import org.netpreserve.evidence.pacing.Outcome;

/**
 * How an attempt's result is reported to pacing and whether it is worth another attempt.
 *
 * @param failureClass what went wrong, null when the server answered normally
 */
public record Verdict(Outcome outcome, boolean retryable, @Nullable FailureClass failureClass) {
    public static final Verdict SUCCESS = new Verdict(Outcome.SUCCESS, false, null);
    /** The server answered normally but the answer is final, like a 404. */
    public static final Verdict FINAL = new Verdict(Outcome.SUCCESS, false, null);
    public static final Verdict RATE_LIMITED = new Verdict(Outcome.THROTTLED, true, FailureClass.RATE_LIMITED);
    public static final Verdict UNAVAILABLE = new Verdict(Outcome.THROTTLED, true, FailureClass.SERVER_ERROR);
    public static final Verdict SERVER_ERROR = new Verdict(Outcome.ERROR, true, FailureClass.SERVER_ERROR);
    public static final Verdict TIMEOUT = new Verdict(Outcome.ERROR, true, FailureClass.TIMEOUT);
    public static final Verdict TRANSIENT = new Verdict(Outcome.ERROR, true, FailureClass.OTHER);
    public static final Verdict BLOCKED = new Verdict(Outcome.ERROR, false, FailureClass.BLOCKED);
    public static final Verdict DECODE = new Verdict(Outcome.ERROR, false, FailureClass.DECODE);
    public static final Verdict FATAL = new Verdict(Outcome.ERROR, false, FailureClass.OTHER);
}
