package org.dataone.artifactcache.exceptions;

import java.io.IOException;

/**
 * Custom exception class for when the staging or final artifact path cannot be created,
 * written or renamed (permissions, full disk, missing directories).
 */
public class CacheFilesystemException extends IOException {

    public CacheFilesystemException(String message, Throwable cause) {
        super(message, cause);
    }

}
