package org.netpreserve.evidence.pacing;

/**
 * What went wrong with a request that didn't succeed. Each class has its own cooldown under adaptive pacing and its
 * own counter on the scoreboard.
 */
public enum FailureClass {
    /** HTTP 429. */
    RATE_LIMITED("429"),
    /** HTTP 5xx, including 503. */
    SERVER_ERROR("5xx"),
    /** A response that couldn't be parsed, often an error page from the archive's edge. */
    DECODE("decode"),
    /** Timed out or couldn't connect. */
    TIMEOUT("timeout"),
    /** Access refused (401, 403). Treated like rate limiting. */
    BLOCKED("blocked"),
    OTHER("other");

    private final String label;

    FailureClass(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
