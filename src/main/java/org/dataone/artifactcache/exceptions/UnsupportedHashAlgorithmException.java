package org.dataone.artifactcache.exceptions;

/**
 * An exception thrown when a given algorithm is not supported by the digest verifier
 */

public class UnsupportedHashAlgorithmException extends IllegalArgumentException {

    public UnsupportedHashAlgorithmException(String message, Throwable cause) {
        super(message, cause);
    }

}
