package org.netpreserve.evidence;

public enum LiveStatus {
    /** The post is publicly visible. */
    LIVE,
    /** The post, or its account, is gone or no longer public. */
    DELETED
}
