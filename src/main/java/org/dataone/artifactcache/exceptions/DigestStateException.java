package org.dataone.artifactcache.exceptions;

/**
 * An exception thrown when a digest sink is used after it has been finalized.
 */

public class DigestStateException extends IllegalStateException {

    public DigestStateException(String message) {
        super(message);
    }

}
