package org.netpreserve.evidence;

public enum Resolution {
    /** The archive has no usable capture of the post. */
    NO_EVIDENCE,
    /** Archived and no longer live. */
    DELETED_WITH_EVIDENCE,
    /** Archived and still live. */
    EXTANT_WITH_EVIDENCE,
    /** Archived, live status not checked. */
    UNCHECKED_WITH_EVIDENCE,
    /** The lookup failed, so nothing is known about the post. */
    FAILED,
    /** The run was cancelled before the post was resolved. */
    CANCELLED;

    /**
     * Whether captures of the post are worth retrieving: it is known to be deleted, or might be.
     */
    public boolean wantsDownload() {
        return this == DELETED_WITH_EVIDENCE || this == UNCHECKED_WITH_EVIDENCE;
    }
}
