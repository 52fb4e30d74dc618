package org.dataone.artifactcache.exceptions;

/**
 * An exception thrown when a chain of HTTP redirects exceeds the configured number of hops.
 */
public class RedirectLoopException extends ArtifactFetchException {

    private final int maxRedirects;
    private final String lastUrl;

    public RedirectLoopException(String message, int maxRedirects, String lastUrl) {
        super(message);
        this.maxRedirects = maxRedirects;
        this.lastUrl = lastUrl;
    }

    public int getMaxRedirects() {
        return maxRedirects;
    }

    public String getLastUrl() {
        return lastUrl;
    }
}
