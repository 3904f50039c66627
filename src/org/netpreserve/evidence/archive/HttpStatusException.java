package org.netpreserve.evidence.archive;

import java.net.URI;

/**
 * The server answered with a status code the caller can't use.
 */
public class HttpStatusException extends ArchiveException {
    private final int status;
    private final URI uri;

    public HttpStatusException(int status, URI uri) {
        super("HTTP " + status + " from " + uri);
        this.status = status;
        this.uri = uri;
    }

    public int status() {
        return status;
    }

    public URI uri() {
        return uri;
    }
}
