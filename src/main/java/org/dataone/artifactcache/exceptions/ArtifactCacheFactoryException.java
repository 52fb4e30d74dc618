package org.dataone.artifactcache.exceptions;

import java.io.IOException;

/**
 * Custom exception class for ArtifactCacheFactory when it's unable to initialize
 * (like when properties are unavailable or configuration is missing).
 */
public class ArtifactCacheFactoryException extends IOException {
    public ArtifactCacheFactoryException(String message) {
        super(message);
    }

}
