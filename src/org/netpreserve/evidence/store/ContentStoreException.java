package org.netpreserve.evidence.store;

/**
 * The content store can't be read or written. Nothing further can be stored, so this aborts the whole run.
 */
public class ContentStoreException extends RuntimeException {
    public ContentStoreException(String message) {
        super(message);
    }

    public ContentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
