package org.netpreserve.evidence.pacing;

/**
 * An independently throttled outbound request channel of the archive.
 */
public enum Surface {
    /** CDX index queries. */
    INDEX("index"),
    /** Downloads of archived capture content. */
    CONTENT("content");

    private final String label;

    Surface(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
