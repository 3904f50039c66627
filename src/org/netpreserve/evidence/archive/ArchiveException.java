package org.netpreserve.evidence.archive;

/**
 * A request to the archive or a related service failed.
 */
public class ArchiveException extends Exception {
    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
