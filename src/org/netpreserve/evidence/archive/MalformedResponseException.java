package org.netpreserve.evidence.archive;

public class MalformedResponseException extends ArchiveException {
    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
