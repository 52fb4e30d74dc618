package org.dataone.artifactcache.exceptions;

import java.io.IOException;

/**
 * Base exception for failures while retrieving an artifact over the network (connection
 * errors, timeouts, unexpected HTTP responses).
 */
public class ArtifactFetchException extends IOException {

    public ArtifactFetchException(String message) {
        super(message);
    }

    public ArtifactFetchException(String message, Throwable cause) {
        super(message, cause);
    }

}
